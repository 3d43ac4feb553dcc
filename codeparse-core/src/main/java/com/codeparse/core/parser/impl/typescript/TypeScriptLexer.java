package com.codeparse.core.parser.impl.typescript;

import java.util.HashSet;
import java.util.Set;

import com.codeparse.core.parser.impl.javascript.JavaScriptLexer;

/**
 * Tokenizer for TypeScript source: JavaScript plus the reserved words of the type layer.
 *
 * <p>Words that are commonly used as ordinary names ({@code type}, {@code module},
 * {@code declare}, {@code namespace}) stay identifiers; the parser recognizes them by position.
 */
public class TypeScriptLexer extends JavaScriptLexer {

    private static final Set<String> KEYWORDS = typeScriptKeywords();

    public TypeScriptLexer(String source) {
        super(source);
    }

    private static Set<String> typeScriptKeywords() {
        Set<String> keywords = new HashSet<>(JavaScriptLexer.KEYWORDS);
        keywords.addAll(Set.of("enum", "interface", "implements", "private", "protected", "public"));
        return Set.copyOf(keywords);
    }

    @Override
    protected Set<String> keywords() {
        return KEYWORDS;
    }
}

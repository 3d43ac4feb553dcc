package com.codeparse.core.parser.impl.javascript;

import java.util.Map;
import java.util.Set;

import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.lexical.LexicalRules;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tokenizer for JavaScript source.
 *
 * <p>Template literals keep their {@code ${...}} interpolations inside one
 * {@link TokenType#TEMPLATE} token. A slash starts a regex literal where an expression may
 * begin: at the start of input, after an operator or opening punctuation, and after keywords
 * such as {@code return} or {@code typeof}.
 */
public class JavaScriptLexer extends Lexer {

    protected static final Set<String> KEYWORDS = Set.of(
        "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
        "do", "else", "export", "extends", "finally", "for", "function", "if", "import", "in",
        "instanceof", "let", "new", "return", "super", "switch", "this", "throw", "try", "typeof",
        "var", "void", "while", "with", "yield", "null", "true", "false");

    private static final Set<String> VALUE_KEYWORDS = Set.of("this", "super", "null", "true", "false");

    private static final LexicalRules RULES = LexicalRules.builder()
        .lineComments("//")
        .blockComment("/*", "*/")
        .stringDelimiters("\"", "'")
        .template("`", "${")
        .regexLiterals(true)
        .build();

    private static final Map<String, TokenType> PUNCTUATION = Map.ofEntries(
        Map.entry("=>", TokenType.FAT_ARROW),
        Map.entry("===", TokenType.OPERATOR),
        Map.entry("!==", TokenType.OPERATOR),
        Map.entry("**", TokenType.OPERATOR),
        Map.entry("**=", TokenType.OPERATOR),
        Map.entry("...", TokenType.OPERATOR),
        Map.entry("?.", TokenType.OPERATOR),
        Map.entry("??", TokenType.OPERATOR),
        Map.entry("??=", TokenType.OPERATOR),
        Map.entry("||=", TokenType.OPERATOR),
        Map.entry("&&=", TokenType.OPERATOR),
        Map.entry(">>>", TokenType.OPERATOR),
        Map.entry(">>>=", TokenType.OPERATOR));

    public JavaScriptLexer(String source) {
        super(source, RULES);
    }

    @Override
    protected Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    protected Map<String, TokenType> extraPunctuation() {
        return PUNCTUATION;
    }

    @Override
    protected boolean isIdentifierStart(int codePoint) {
        return codePoint == '$' || codePoint == '#' || super.isIdentifierStart(codePoint);
    }

    @Override
    protected boolean isIdentifierPart(int codePoint) {
        return codePoint == '$' || super.isIdentifierPart(codePoint);
    }

    @Override
    protected boolean scanSpecial() {
        if (position() == 0 && peek(0) == '#' && peek(1) == '!') {
            int length = 0;
            while (peek(length) != '\0' && peek(length) != '\n' && peek(length) != '\r') {
                length++;
            }
            emit(TokenType.COMMENT, length, Map.of(Token.DELIMITER, "#!", Token.TERMINATED, true));
            return true;
        }
        return false;
    }

    @Override
    protected boolean regexAllowedAfter(Token previous) {
        if (previous == null) {
            return true;
        }
        return switch (previous.type()) {
            case IDENTIFIER, NUMBER, STRING, TEMPLATE, REGEX, CLOSE_PAREN, CLOSE_BRACKET -> false;
            case KEYWORD -> !VALUE_KEYWORDS.contains(previous.text());
            case OPERATOR -> !previous.text().equals("++") && !previous.text().equals("--");
            default -> true;
        };
    }
}

package com.codeparse.core.parser.impl.python;

import java.util.Map;
import java.util.Set;

import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.lexical.LexicalRules;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tokenizer for Python source.
 *
 * <p>Soft keywords ({@code match}, {@code case}, {@code type}) are lexed as identifiers. A
 * backslash followed by a line break is emitted as whitespace so the logical line continues.
 */
public class PythonLexer extends Lexer {

    static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield");

    private static final LexicalRules RULES = LexicalRules.builder()
        .lineComments("#")
        .stringDelimiters("\"\"\"", "'''", "\"", "'")
        .stringPrefixes("r", "u", "b", "f", "rb", "br", "fr", "rf")
        .build();

    private static final Map<String, TokenType> PUNCTUATION = Map.of(
        "**", TokenType.OPERATOR,
        "//", TokenType.OPERATOR,
        "**=", TokenType.OPERATOR,
        "//=", TokenType.OPERATOR,
        ":=", TokenType.OPERATOR,
        "@=", TokenType.OPERATOR,
        "...", TokenType.OPERATOR);

    public PythonLexer(String source) {
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
    protected boolean scanSpecial() {
        if (peek(0) != '\\') {
            return false;
        }
        if (peek(1) == '\n') {
            emit(TokenType.WHITESPACE, 2, Map.of(Token.LINE_START, false));
            return true;
        }
        if (peek(1) == '\r') {
            emit(TokenType.WHITESPACE, peek(2) == '\n' ? 3 : 2, Map.of(Token.LINE_START, false));
            return true;
        }
        return false;
    }
}

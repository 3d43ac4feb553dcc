package com.codeparse.core.token;

/**
 * Closed set of token categories produced by the lexers.
 *
 * <p>Literal categories ({@link #STRING}, {@link #TEMPLATE}, {@link #COMMENT}, {@link #REGEX}) are
 * exclusion zones: each is emitted as a single token that spans the whole literal including its
 * delimiters, so any structural character inside it never surfaces as a separate token.
 *
 * @since 1.0.0
 */
public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    OPERATOR,

    WHITESPACE,
    NEWLINE,

    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACKET,
    CLOSE_BRACKET,

    COLON,
    SEMICOLON,
    COMMA,
    DOT,
    AT,
    EQUALS,
    ARROW,
    FAT_ARROW,

    STRING,
    TEMPLATE,
    COMMENT,
    REGEX,

    UNKNOWN;

    /**
     * Returns whether tokens of this type are lexical exclusion zones.
     *
     * @return true for string, template, comment and regex literals
     */
    public boolean isLiteral() {
        return this == STRING || this == TEMPLATE || this == COMMENT || this == REGEX;
    }

    /**
     * Returns whether tokens of this type carry no meaning for statement structure.
     *
     * @return true for whitespace and comments
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }

    public boolean isOpening() {
        return this == OPEN_BRACE || this == OPEN_PAREN || this == OPEN_BRACKET;
    }

    public boolean isClosing() {
        return this == CLOSE_BRACE || this == CLOSE_PAREN || this == CLOSE_BRACKET;
    }
}

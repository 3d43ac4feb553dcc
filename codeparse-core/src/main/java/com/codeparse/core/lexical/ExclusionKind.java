package com.codeparse.core.lexical;

import com.codeparse.core.token.TokenType;

/**
 * Kinds of lexical exclusion zones.
 */
public enum ExclusionKind {
    STRING(TokenType.STRING),
    TEMPLATE(TokenType.TEMPLATE),
    LINE_COMMENT(TokenType.COMMENT),
    BLOCK_COMMENT(TokenType.COMMENT),
    REGEX(TokenType.REGEX);

    private final TokenType tokenType;

    ExclusionKind(TokenType tokenType) {
        this.tokenType = tokenType;
    }

    /**
     * Returns the token type emitted for a literal of this kind.
     */
    public TokenType tokenType() {
        return tokenType;
    }
}

package com.codeparse.core.diagnostic;

/**
 * Categories of recoverable input irregularities.
 *
 * <p>None of these abort a parse. They are surfaced as data on the returned AST.
 */
public enum WarningKind {
    /** A string, template, comment or regex literal reached end of input without closing. */
    LEXICAL_UNTERMINATED,
    /** A brace or indentation block opened but never closed before end of input. */
    STRUCTURAL_UNTERMINATED,
    /** A token that no rule of the language parser could place; recorded as an error node. */
    UNEXPECTED_TOKEN,
    /** An indentation width whose relation to its block depends on tab expansion. */
    AMBIGUOUS_INDENTATION,
    /** Bytes of a source file that are not valid UTF-8; they were replaced with U+FFFD. */
    MALFORMED_ENCODING;

    /**
     * Returns the lowercase, space separated label used in serialized output.
     */
    public String label() {
        return name().toLowerCase().replace('_', ' ');
    }
}

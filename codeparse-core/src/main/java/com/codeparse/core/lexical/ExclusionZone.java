package com.codeparse.core.lexical;

/**
 * Tracks whether the scanner is inside a string, comment or regex literal.
 *
 * <p>This state is independent of the block-structure context stack. While a zone is active,
 * every character is inert to the structural components until the closing delimiter is found or
 * input ends.
 */
final class ExclusionZone {

    private boolean active;
    private ExclusionKind kind;
    private String delimiter;

    void enter(ExclusionKind kind, String delimiter) {
        if (active) {
            throw new IllegalStateException("Already inside " + this.kind + " opened by " + this.delimiter);
        }
        this.active = true;
        this.kind = kind;
        this.delimiter = delimiter;
    }

    void exit() {
        active = false;
        kind = null;
        delimiter = null;
    }

    boolean isActive() {
        return active;
    }

    ExclusionKind kind() {
        return kind;
    }

    String delimiter() {
        return delimiter;
    }
}

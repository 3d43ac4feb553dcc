package com.codeparse.core.state;

/**
 * Kinds of nested constructs tracked on the {@link ParserState} context stack.
 */
public enum ContextType {
    MODULE(true),
    FUNCTION(true),
    CLASS(true),
    INTERFACE(true),
    ENUM(true),
    NAMESPACE(true),
    BLOCK(false),
    MATCH(false),
    CASE(false),
    STRING(false),
    COMMENT(false),
    REGEX(false);

    private final boolean scope;

    ContextType(boolean scope) {
        this.scope = scope;
    }

    /**
     * Returns whether entering a frame of this type opens a new symbol scope.
     */
    public boolean introducesScope() {
        return scope;
    }

    /**
     * Returns the lowercase label used in scope ids.
     */
    public String label() {
        return name().toLowerCase();
    }
}

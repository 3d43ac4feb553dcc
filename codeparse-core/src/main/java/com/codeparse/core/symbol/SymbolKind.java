package com.codeparse.core.symbol;

/**
 * Kind of a declared name.
 */
public enum SymbolKind {
    VARIABLE,
    FUNCTION,
    METHOD,
    CLASS,
    PARAMETER,
    IMPORT,
    INTERFACE,
    TYPE_ALIAS,
    ENUM,
    ENUM_MEMBER,
    NAMESPACE;

    /**
     * Returns the lowercase label used in serialized output.
     */
    public String label() {
        return name().toLowerCase().replace('_', ' ');
    }
}

package com.codeparse.core.symbol;

import java.util.Objects;

/**
 * A named declaration found in source code.
 *
 * @param name declared identifier
 * @param kind what was declared
 * @param line line of the declaring identifier (1-based)
 * @param column column of the declaring identifier (1-based)
 * @param scopeId id of the scope the name is declared in
 * @since 1.0.0
 */
public record Symbol(
    String name,
    SymbolKind kind,
    int line,
    int column,
    String scopeId
) {
    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(scopeId, "scopeId must not be null");
    }
}

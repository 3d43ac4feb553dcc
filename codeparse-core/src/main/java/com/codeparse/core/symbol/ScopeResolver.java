package com.codeparse.core.symbol;

import java.util.List;
import java.util.Optional;

/**
 * Resolves names lexically over a {@link SymbolTable}.
 *
 * <p>Starting at a scope, the resolver searches that scope and then each recorded parent. Within
 * a scope the latest declaration wins, so a rebinding shadows the earlier one.
 *
 * @since 1.0.0
 */
public class ScopeResolver {

    private final SymbolTable table;

    public ScopeResolver(SymbolTable table) {
        this.table = table;
    }

    public Optional<Symbol> resolve(String name, String fromScopeId) {
        String scope = fromScopeId;
        while (scope != null) {
            List<Symbol> symbols = table.getSymbols(scope);
            for (int i = symbols.size() - 1; i >= 0; i--) {
                if (symbols.get(i).name().equals(name)) {
                    return Optional.of(symbols.get(i));
                }
            }
            scope = table.parentOf(scope).orElse(null);
        }
        return Optional.empty();
    }

    /**
     * Returns whether {@code name} is declared directly in {@code scopeId}.
     */
    public boolean isDeclaredIn(String name, String scopeId) {
        return table.getSymbols(scopeId).stream().anyMatch(symbol -> symbol.name().equals(name));
    }
}

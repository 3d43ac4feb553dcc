package com.codeparse.core.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Scope-indexed registry of declarations.
 *
 * <p>The table is append-only: registering a name that already exists in a scope keeps both
 * records in declaration order, so shadowing and redefinition stay visible. Lookups never consult
 * enclosing scopes; lexical resolution is done by {@link ScopeResolver} using the recorded scope
 * parentage.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * SymbolTable table = result.symbolTable();
 * List<Symbol> moduleSymbols = table.getSymbols("module");
 * table.getSymbolsByScope().forEach((scope, symbols) -> ...);
 * }</pre>
 *
 * @since 1.0.0
 */
public class SymbolTable {

    private final Map<String, List<Symbol>> symbolsByScope = new LinkedHashMap<>();
    private final Map<String, String> scopeParents = new LinkedHashMap<>();

    /**
     * Records a declaration. The scope is declared implicitly (without parent) if unknown.
     */
    public void register(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol must not be null");
        if (!scopeParents.containsKey(symbol.scopeId())) {
            scopeParents.put(symbol.scopeId(), null);
        }
        symbolsByScope.computeIfAbsent(symbol.scopeId(), key -> new ArrayList<>()).add(symbol);
    }

    /**
     * Records a scope and its enclosing scope. Re-declaring keeps the first known parent.
     *
     * @param scopeId scope id
     * @param parentScopeId enclosing scope id, or null for the module scope
     */
    public void declareScope(String scopeId, String parentScopeId) {
        Objects.requireNonNull(scopeId, "scopeId must not be null");
        String known = scopeParents.get(scopeId);
        if (known == null) {
            scopeParents.put(scopeId, parentScopeId);
        }
    }

    /**
     * Returns all symbols grouped by scope, in the order scopes first received a symbol.
     */
    public Map<String, List<Symbol>> getSymbolsByScope() {
        Map<String, List<Symbol>> view = new LinkedHashMap<>();
        symbolsByScope.forEach((scope, symbols) -> view.put(scope, Collections.unmodifiableList(symbols)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Returns the symbols declared directly in {@code scopeId}, in declaration order.
     */
    public List<Symbol> getSymbols(String scopeId) {
        List<Symbol> symbols = symbolsByScope.get(scopeId);
        return symbols != null ? Collections.unmodifiableList(symbols) : List.of();
    }

    public Optional<String> parentOf(String scopeId) {
        return Optional.ofNullable(scopeParents.get(scopeId));
    }

    public Set<String> getScopeIds() {
        return Collections.unmodifiableSet(scopeParents.keySet());
    }

    /**
     * Returns every symbol in registration order of their scopes.
     */
    public List<Symbol> allSymbols() {
        List<Symbol> all = new ArrayList<>();
        symbolsByScope.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return symbolsByScope.values().stream().mapToInt(List::size).sum();
    }
}

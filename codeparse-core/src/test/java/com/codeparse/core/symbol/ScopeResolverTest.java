package com.codeparse.core.symbol;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.parser.impl.python.PythonParser;

/**
 * Tests for {@link ScopeResolver}.
 */
class ScopeResolverTest {

    private SymbolTable table;
    private ScopeResolver resolver;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
        table.declareScope("module", null);
        table.declareScope("module/function:outer", "module");
        table.declareScope("module/function:outer/function:inner", "module/function:outer");
        resolver = new ScopeResolver(table);
    }

    @Test
    void resolve_walksEnclosingScopes() {
        table.register(new Symbol("config", SymbolKind.VARIABLE, 1, 1, "module"));

        assertThat(resolver.resolve("config", "module/function:outer/function:inner"))
            .map(Symbol::scopeId).contains("module");
    }

    @Test
    void resolve_innerDeclarationShadowsOuter() {
        table.register(new Symbol("x", SymbolKind.VARIABLE, 1, 1, "module"));
        table.register(new Symbol("x", SymbolKind.PARAMETER, 3, 11, "module/function:outer"));

        assertThat(resolver.resolve("x", "module/function:outer/function:inner"))
            .map(Symbol::kind).contains(SymbolKind.PARAMETER);
    }

    @Test
    void resolve_latestDeclarationInScopeWins() {
        table.register(new Symbol("handler", SymbolKind.FUNCTION, 1, 5, "module"));
        table.register(new Symbol("handler", SymbolKind.VARIABLE, 9, 1, "module"));

        assertThat(resolver.resolve("handler", "module")).map(Symbol::line).contains(9);
    }

    @Test
    void resolve_unknownName_isEmpty() {
        assertThat(resolver.resolve("missing", "module/function:outer")).isEmpty();
        assertThat(resolver.isDeclaredIn("missing", "module")).isFalse();
    }

    @Test
    void resolve_overParsedSource() {
        ParseResult result = new PythonParser().parse(
            "limit = 10\n\ndef outer(n):\n    def inner():\n        return n + limit\n    return inner\n");
        ScopeResolver parsed = new ScopeResolver(result.symbolTable());

        assertThat(parsed.resolve("n", "module/function:outer/function:inner"))
            .map(Symbol::kind).contains(SymbolKind.PARAMETER);
        assertThat(parsed.resolve("limit", "module/function:outer/function:inner"))
            .map(Symbol::scopeId).contains("module");
        assertThat(parsed.isDeclaredIn("inner", "module/function:outer")).isTrue();
    }
}

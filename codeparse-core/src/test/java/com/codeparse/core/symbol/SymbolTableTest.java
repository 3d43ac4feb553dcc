package com.codeparse.core.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SymbolTable}.
 */
class SymbolTableTest {

    private SymbolTable table;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
        table.declareScope("module", null);
    }

    @Test
    void register_duplicateName_keepsBothInOrder() {
        table.register(new Symbol("x", SymbolKind.VARIABLE, 1, 1, "module"));
        table.register(new Symbol("x", SymbolKind.FUNCTION, 3, 5, "module"));

        List<Symbol> symbols = table.getSymbols("module");

        assertThat(symbols).extracting(Symbol::kind)
            .containsExactly(SymbolKind.VARIABLE, SymbolKind.FUNCTION);
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void getSymbols_doesNotConsultParents() {
        table.declareScope("module/function:f", "module");
        table.register(new Symbol("a", SymbolKind.VARIABLE, 1, 1, "module"));

        assertThat(table.getSymbols("module/function:f")).isEmpty();
        assertThat(table.getSymbols("unknown")).isEmpty();
    }

    @Test
    void register_unknownScope_declaresItWithoutParent() {
        table.register(new Symbol("p", SymbolKind.PARAMETER, 2, 7, "module/function:g"));

        assertThat(table.getScopeIds()).contains("module/function:g");
        assertThat(table.parentOf("module/function:g")).isEmpty();
    }

    @Test
    void declareScope_keepsFirstKnownParent() {
        table.declareScope("module/class:A", "module");
        table.declareScope("module/class:A", "elsewhere");

        assertThat(table.parentOf("module/class:A")).contains("module");
    }

    @Test
    void declareScope_fillsParentOfImplicitScope() {
        table.register(new Symbol("p", SymbolKind.PARAMETER, 2, 7, "module/function:g"));
        table.declareScope("module/function:g", "module");

        assertThat(table.parentOf("module/function:g")).contains("module");
    }

    @Test
    void getSymbolsByScope_groupsInFirstUseOrder() {
        table.register(new Symbol("f", SymbolKind.FUNCTION, 1, 5, "module"));
        table.register(new Symbol("x", SymbolKind.PARAMETER, 1, 7, "module/function:f"));
        table.register(new Symbol("g", SymbolKind.FUNCTION, 4, 5, "module"));

        assertThat(table.getSymbolsByScope()).containsOnlyKeys("module", "module/function:f");
        assertThat(table.getSymbolsByScope().keySet()).containsExactly("module", "module/function:f");
        assertThat(table.allSymbols()).extracting(Symbol::name).containsExactly("f", "g", "x");
    }

    @Test
    void views_areUnmodifiable() {
        table.register(new Symbol("f", SymbolKind.FUNCTION, 1, 5, "module"));

        assertThatThrownBy(() -> table.getSymbols("module").clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void symbol_requiresName() {
        assertThatThrownBy(() -> new Symbol(null, SymbolKind.VARIABLE, 1, 1, "module"))
            .isInstanceOf(NullPointerException.class);
    }
}

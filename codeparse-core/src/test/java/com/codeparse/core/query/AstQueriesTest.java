package com.codeparse.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.parser.impl.javascript.JavaScriptParser;
import com.codeparse.core.parser.impl.python.PythonParser;

/**
 * Tests for {@link AstQueries}.
 */
class AstQueriesTest {

    private static final String SOURCE = """
        import os as o
        from typing import List


        def helper(x):
            return x


        class Service:
            def handle(self, request):
                def inner():
                    return request
                return inner()

            class Inner:
                def method(self):
                    pass


        count = 1
        def helper(y):
            return y
        count = 2
        """;

    private final AstNode root = new PythonParser().parse(SOURCE).root();

    @Test
    void getFunctions_returnsNestedCallablesInSourceOrder() {
        assertThat(AstQueries.getFunctions(root)).extracting(AstNode::getName)
            .containsExactly("helper", "handle", "inner", "method", "helper");
    }

    @Test
    void findFunction_returnsFirstMatch() {
        assertThat(AstQueries.findFunction(root, "helper")).get().extracting(AstNode::getLine).isEqualTo(5);
        assertThat(AstQueries.findFunction(root, "missing")).isEmpty();
        assertThat(AstQueries.findFunction(root, null)).isEmpty();
    }

    @Test
    void findFunctionAtLine_prefersInnermost() {
        assertThat(AstQueries.findFunctionAtLine(root, 12)).get().extracting(AstNode::getName).isEqualTo("inner");
        assertThat(AstQueries.findFunctionAtLine(root, 13)).get().extracting(AstNode::getName).isEqualTo("handle");
        assertThat(AstQueries.findFunctionAtLine(root, 8)).isEmpty();
    }

    @Test
    void findFunctionAtLine_countsCallbacks() {
        AstNode tree = new JavaScriptParser().parse("function outer() {\n  items.map((x) => {\n    return x;\n  });\n}\n").root();

        assertThat(AstQueries.findFunctionAtLine(tree, 3)).get()
            .extracting(AstNode::getNodeType).isEqualTo(NodeTypes.ARROW_FUNCTION);
        assertThat(AstQueries.findFunctionAtLine(tree, 5)).get()
            .extracting(AstNode::getName).isEqualTo("outer");
    }

    @Test
    void getTopLevelDeclarations_laterBindingWins() {
        Map<String, AstNode> declarations = AstQueries.getTopLevelDeclarations(root);

        assertThat(declarations).containsOnlyKeys("o", "List", "Service", "helper", "count");
        assertThat(declarations.keySet()).containsExactly("o", "List", "Service", "helper", "count");
        assertThat(declarations.get("helper").getLine()).isEqualTo(21);
        assertThat(declarations.get("count").getLine()).isEqualTo(23);
    }

    @Test
    void findByName_matchesSimpleAndDottedNames() {
        assertThat(AstQueries.findByName(root, "Service.Inner.method")).get()
            .extracting(AstNode::getLine).isEqualTo(16);
        assertThat(AstQueries.findByName(root, "Inner")).get()
            .extracting(AstNode::getNodeType).isEqualTo(NodeTypes.CLASS_DECLARATION);
        assertThat(AstQueries.findByName(root, "Service.missing")).isEmpty();
        assertThat(AstQueries.findByName(root, " ")).isEmpty();
    }

    @Test
    void fullName_joinsEnclosingDeclarations() {
        AstNode inner = AstQueries.findFunction(root, "inner").orElseThrow();

        assertThat(AstQueries.fullName(inner)).isEqualTo("Service.handle.inner");
        assertThat(AstQueries.fullName(AstQueries.findFunction(root, "helper").orElseThrow())).isEqualTo("helper");
    }

    @Test
    void queries_rejectNullRoot() {
        assertThatThrownBy(() -> AstQueries.getFunctions(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("root");
    }
}

package com.codeparse.core.ast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.codeparse.core.parser.impl.python.PythonParser;

/**
 * Tests for {@link AstSerializer} and {@link AstJson}.
 */
class AstSerializerTest {

    @Test
    void toSerializable_hasNodeShapeWithoutParentLinks() {
        AstNode root = new AstNode(NodeTypes.MODULE);
        root.addChild(new AstNode(NodeTypes.FUNCTION_DECLARATION, Map.of(NodeProperties.NAME, "f", NodeProperties.LINE, 1)));

        Map<String, Object> serialized = AstSerializer.toSerializable(root);

        assertThat(serialized).containsOnlyKeys("nodeType", "properties", "children");
        assertThat(serialized.get("nodeType")).isEqualTo("Module");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> children = (List<Map<String, Object>>) serialized.get("children");
        assertThat(children).hasSize(1);
        assertThat(children.get(0)).doesNotContainKey("parent");
        assertThat(children.get(0).get("properties")).isEqualTo(Map.of("name", "f", "line", 1));
    }

    @Test
    void toSerializable_nodeReachableFromItsOwnProperty_isMarkedCircular() {
        AstNode root = new AstNode(NodeTypes.MODULE);
        AstNode function = root.addChild(new AstNode(NodeTypes.FUNCTION_DECLARATION));
        function.setProperty("owner", root);

        Map<String, Object> serialized = AstSerializer.toSerializable(root);

        @SuppressWarnings("unchecked")
        Map<String, Object> child = ((List<Map<String, Object>>) serialized.get("children")).get(0);
        @SuppressWarnings("unchecked")
        Map<String, Object> owner = (Map<String, Object>) ((Map<String, Object>) child.get("properties")).get("owner");
        assertThat(owner).containsEntry("circular", true).containsEntry("nodeType", "Module");
    }

    @Test
    void toSerializable_sharedNodeInSiblingBranches_isCopiedTwice() {
        AstNode shared = new AstNode(NodeTypes.RETURN_STATEMENT);
        AstNode root = new AstNode(NodeTypes.MODULE);
        root.setProperty("first", shared);
        root.setProperty("second", shared);

        Map<String, Object> serialized = AstSerializer.toSerializable(root);

        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) serialized.get("properties");
        assertThat(properties.get("first")).isEqualTo(properties.get("second"));
        assertThat(properties.get("first")).asString().doesNotContain("circular");
    }

    @Test
    void toSerializable_mapPropertyWithParentKey_dropsIt() {
        Map<String, Object> entry = new HashMap<>();
        entry.put("name", "x");
        entry.put("parent", new AstNode(NodeTypes.MODULE));
        AstNode node = new AstNode(NodeTypes.VARIABLE_DECLARATION).setProperty(NodeProperties.NAMES, List.of(entry));

        Map<String, Object> serialized = AstSerializer.toSerializable(node);

        assertThat(serialized.get("properties").toString()).doesNotContain("parent").contains("name=x");
    }

    @Test
    void toSerializable_selfContainingList_isMarkedCircular() {
        List<Object> values = new ArrayList<>();
        values.add("a");
        values.add(values);
        AstNode node = new AstNode(NodeTypes.EXPRESSION_STATEMENT).setProperty(NodeProperties.VALUE, values);

        Map<String, Object> serialized = AstSerializer.toSerializable(node);

        @SuppressWarnings("unchecked")
        List<Object> copy = (List<Object>) ((Map<String, Object>) serialized.get("properties")).get("value");
        assertThat(copy.get(0)).isEqualTo("a");
        assertThat(copy.get(1)).isEqualTo(Map.of("circular", true));
    }

    @Test
    void toJson_parsedTree_isValidJson() throws Exception {
        ParseResult result = new PythonParser().parse("def f(a, b=10):\n    return a * b\n");

        JsonNode json = new ObjectMapper().readTree(AstJson.toJson(result.root()));

        assertThat(json.get("nodeType").asText()).isEqualTo("Module");
        JsonNode function = json.get("children").get(0);
        assertThat(function.get("nodeType").asText()).isEqualTo("FunctionDeclaration");
        assertThat(function.get("properties").get("name").asText()).isEqualTo("f");
        assertThat(function.get("properties").get("parameters").size()).isEqualTo(2);
    }
}

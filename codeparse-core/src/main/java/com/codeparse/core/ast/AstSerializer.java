package com.codeparse.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a tree into plain nested maps and lists that any JSON writer accepts.
 *
 * <p>The copy walks only the owning direction (properties and children); the parent
 * back-reference never appears in the output. Each recursive step receives its own copy of the
 * identity set of nodes on the current path, so a node shared by two sibling branches is copied
 * twice, while a node reached again below itself is replaced by
 * {@code {"circular": true, "nodeType": ...}}.
 *
 * <p>Serialized node shape:
 * <pre>{@code
 * {"nodeType": "FunctionDeclaration", "properties": {...}, "children": [...]}
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AstSerializer {

    public static final String NODE_TYPE = "nodeType";
    public static final String PROPERTIES = "properties";
    public static final String CHILDREN = "children";
    public static final String CIRCULAR = "circular";

    private AstSerializer() {
        // Utility class
    }

    /**
     * Produces the acyclic, JSON-compatible rendition of {@code root}.
     */
    public static Map<String, Object> toSerializable(AstNode root) {
        return serializeNode(root, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Map<String, Object> serializeNode(AstNode node, Set<Object> path) {
        if (path.contains(node)) {
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put(CIRCULAR, true);
            marker.put(NODE_TYPE, node.getNodeType());
            return marker;
        }
        Set<Object> branch = copyOf(path);
        branch.add(node);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(NODE_TYPE, node.getNodeType());
        Map<String, Object> properties = new LinkedHashMap<>();
        node.getProperties().forEach((key, value) -> properties.put(key, serializeValue(value, branch)));
        result.put(PROPERTIES, properties);
        List<Object> children = new ArrayList<>();
        for (AstNode child : node.getChildren()) {
            children.add(serializeNode(child, branch));
        }
        result.put(CHILDREN, children);
        return result;
    }

    private static Object serializeValue(Object value, Set<Object> path) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof AstNode node) {
            return serializeNode(node, path);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name().toLowerCase();
        }
        if (path.contains(value)) {
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put(CIRCULAR, true);
            return marker;
        }
        if (value instanceof Map<?, ?> map) {
            Set<Object> branch = copyOf(path);
            branch.add(value);
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> {
                if (!"parent".equals(key)) {
                    copy.put(String.valueOf(key), serializeValue(item, branch));
                }
            });
            return copy;
        }
        if (value instanceof Iterable<?> items) {
            Set<Object> branch = copyOf(path);
            branch.add(value);
            List<Object> copy = new ArrayList<>();
            for (Object item : items) {
                copy.add(serializeValue(item, branch));
            }
            return copy;
        }
        return value.toString();
    }

    private static Set<Object> copyOf(Set<Object> path) {
        Set<Object> copy = Collections.newSetFromMap(new IdentityHashMap<>());
        copy.addAll(path);
        return copy;
    }
}

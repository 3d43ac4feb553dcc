package com.codeparse.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A node of the language-neutral syntax tree.
 *
 * <p>A node is a type name plus an ordered property map plus owned children. Construct-specific
 * data (names, parameters, modifiers, decorators) lives in the property map under the keys listed
 * in {@link NodeProperties}; the node class itself never changes shape per language.
 *
 * <p>The {@code parent} link is a non-owning back-reference set by {@link #addChild(AstNode)}. It
 * exists for upward navigation only and is never part of the serialized form
 * (see {@link AstSerializer}).
 *
 * @since 1.0.0
 */
public class AstNode {

    private final String nodeType;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<AstNode> children = new ArrayList<>();
    private AstNode parent;

    public AstNode(String nodeType) {
        this.nodeType = Objects.requireNonNull(nodeType, "nodeType must not be null");
    }

    public AstNode(String nodeType, Map<String, Object> properties) {
        this(nodeType);
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public String getNodeType() {
        return nodeType;
    }

    public boolean isType(String type) {
        return nodeType.equals(type);
    }

    /**
     * Appends an owned child and points its parent link at this node.
     *
     * @return the child, for chaining
     */
    public AstNode addChild(AstNode child) {
        Objects.requireNonNull(child, "child must not be null");
        children.add(child);
        child.parent = this;
        return child;
    }

    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public AstNode getParent() {
        return parent;
    }

    public AstNode setProperty(String key, Object value) {
        properties.put(key, value);
        return this;
    }

    public Object getProperty(String key) {
        return properties.get(key);
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    /**
     * Returns a property as a string, or empty if absent or not a string.
     */
    public Optional<String> getString(String key) {
        Object value = properties.get(key);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    /**
     * Returns the {@link NodeProperties#NAME} property, or null.
     */
    public String getName() {
        return getString(NodeProperties.NAME).orElse(null);
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Returns the line the construct starts on, or 0 if unknown.
     */
    public int getLine() {
        Object line = properties.get(NodeProperties.LINE);
        return line instanceof Number number ? number.intValue() : 0;
    }

    /**
     * Returns the last line of the construct, or its start line if unknown.
     */
    public int getEndLine() {
        Object line = properties.get(NodeProperties.END_LINE);
        return line instanceof Number number ? number.intValue() : getLine();
    }

    public boolean isUnterminated() {
        return Boolean.TRUE.equals(properties.get(NodeProperties.UNTERMINATED));
    }

    /**
     * Collects this node's descendants (pre-order, excluding this node) matching {@code filter}.
     */
    public List<AstNode> findAll(Predicate<AstNode> filter) {
        List<AstNode> result = new ArrayList<>();
        collect(this, filter, result);
        return result;
    }

    /**
     * Collects all descendants of the given node type in pre-order.
     */
    public List<AstNode> findAll(String type) {
        return findAll(node -> node.isType(type));
    }

    private static void collect(AstNode node, Predicate<AstNode> filter, List<AstNode> result) {
        for (AstNode child : node.children) {
            if (filter.test(child)) {
                result.add(child);
            }
            collect(child, filter, result);
        }
    }

    public Optional<AstNode> firstChild(String type) {
        return children.stream().filter(child -> child.isType(type)).findFirst();
    }

    @Override
    public String toString() {
        String name = getName();
        return nodeType + (name != null ? "(" + name + ")" : "") + "@" + getLine();
    }
}

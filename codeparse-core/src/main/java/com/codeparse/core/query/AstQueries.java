package com.codeparse.core.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;

/**
 * Lookups over a parsed tree.
 *
 * <p>All queries walk the tree in pre-order, so "first" means first in source order. Nothing is
 * cached; callers that query a large tree repeatedly should keep the results.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ParseResult result = parser.parse(source);
 * AstQueries.findFunctionAtLine(result.root(), 42)
 *     .map(AstQueries::fullName)
 *     .ifPresent(System.out::println);   // e.g. "Service.handle"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AstQueries {

    private AstQueries() {
        // Utility class
    }

    /**
     * Returns the first function or method named {@code name}.
     */
    public static Optional<AstNode> findFunction(AstNode root, String name) {
        Objects.requireNonNull(root, "root must not be null");
        return getFunctions(root).stream()
            .filter(function -> name != null && name.equals(function.getName()))
            .findFirst();
    }

    /**
     * Returns the innermost function whose line range contains {@code line}.
     *
     * <p>Anonymous functions (arrow functions, lambdas) count, so a line inside a callback yields
     * the callback rather than its enclosing function.
     */
    public static Optional<AstNode> findFunctionAtLine(AstNode root, int line) {
        Objects.requireNonNull(root, "root must not be null");
        AstNode innermost = null;
        for (AstNode function : getFunctions(root)) {
            if (function.getLine() <= line && line <= function.getEndLine()) {
                // pre-order: a later match that contains the line is nested in the earlier one
                innermost = function;
            }
        }
        return Optional.ofNullable(innermost);
    }

    /**
     * Returns every callable in the tree, nested ones included.
     */
    public static List<AstNode> getFunctions(AstNode root) {
        Objects.requireNonNull(root, "root must not be null");
        return root.findAll(node -> NodeTypes.FUNCTION_TYPES.contains(node.getNodeType()));
    }

    /**
     * Returns the declarations directly under the module, keyed by the names they bind.
     *
     * <p>Variable declarations contribute one entry per declared name and imports one entry per
     * local binding. When a name is bound twice the later declaration wins, as it would at
     * runtime.
     */
    public static Map<String, AstNode> getTopLevelDeclarations(AstNode root) {
        Objects.requireNonNull(root, "root must not be null");
        Map<String, AstNode> declarations = new LinkedHashMap<>();
        for (AstNode child : root.getChildren()) {
            if (!NodeTypes.DECLARATION_TYPES.contains(child.getNodeType())) {
                continue;
            }
            for (String name : boundNames(child)) {
                declarations.remove(name);
                declarations.put(name, child);
            }
        }
        return declarations;
    }

    /**
     * Returns the first declaration named {@code name}. A dotted name such as
     * {@code Outer.Inner.method} is matched against {@link #fullName(AstNode)}.
     */
    public static Optional<AstNode> findByName(AstNode root, String name) {
        Objects.requireNonNull(root, "root must not be null");
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        boolean qualified = name.indexOf('.') > 0;
        List<AstNode> matches = root.findAll(node -> isNamedDeclaration(node)
            && (qualified ? name.equals(fullName(node)) : name.equals(node.getName())));
        return matches.stream().findFirst();
    }

    /**
     * Returns the dotted name of a declaration including the names of its enclosing
     * declarations, e.g. {@code Outer.Inner.method}. Anonymous enclosing constructs are skipped.
     */
    public static String fullName(AstNode node) {
        Objects.requireNonNull(node, "node must not be null");
        Deque<String> parts = new ArrayDeque<>();
        for (AstNode current = node; current != null; current = current.getParent()) {
            if (isNamedDeclaration(current)) {
                parts.addFirst(current.getName());
            }
        }
        return String.join(".", parts);
    }

    private static boolean isNamedDeclaration(AstNode node) {
        return node.getName() != null
            && (NodeTypes.DECLARATION_TYPES.contains(node.getNodeType())
                || node.isType(NodeTypes.FIELD_DECLARATION)
                || NodeTypes.FUNCTION_TYPES.contains(node.getNodeType()));
    }

    private static List<String> boundNames(AstNode declaration) {
        List<String> names = new ArrayList<>();
        if (declaration.getName() != null) {
            names.add(declaration.getName());
            return names;
        }
        Object listed = declaration.getProperty(NodeProperties.NAMES);
        if (listed instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof String text) {
                    names.add(text);
                } else if (entry instanceof Map<?, ?> map) {
                    Object bound = map.get(NodeProperties.ALIAS) != null ? map.get(NodeProperties.ALIAS) : map.get(NodeProperties.NAME);
                    if (bound != null) {
                        names.add(bound.toString());
                    }
                }
            }
        }
        return names;
    }
}

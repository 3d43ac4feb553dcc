package com.codeparse.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.symbol.SymbolTable;

/**
 * Everything one parse call produces.
 *
 * @param root tree root, a {@link NodeTypes#MODULE} node
 * @param symbolTable declarations found, by scope
 * @param warnings recoverable problems, also attached to the root as {@link NodeProperties#WARNINGS}
 * @since 1.0.0
 */
public record ParseResult(
    AstNode root,
    SymbolTable symbolTable,
    List<ParseWarning> warnings
) {
    public ParseResult {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(symbolTable, "symbolTable must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<ParseWarning> warningsOfKind(WarningKind kind) {
        return warnings.stream().filter(warning -> warning.kind() == kind).toList();
    }

    /**
     * Returns a result with {@code warning} added in front of the existing warnings. The root's
     * {@link NodeProperties#WARNINGS} property is updated to match.
     */
    public ParseResult withLeadingWarning(ParseWarning warning) {
        Objects.requireNonNull(warning, "warning must not be null");
        List<ParseWarning> merged = new ArrayList<>();
        merged.add(warning);
        merged.addAll(warnings);
        List<Map<String, Object>> maps = new ArrayList<>();
        for (ParseWarning each : merged) {
            maps.add(each.toMap());
        }
        root.setProperty(NodeProperties.WARNINGS, maps);
        return new ParseResult(root, symbolTable, merged);
    }
}

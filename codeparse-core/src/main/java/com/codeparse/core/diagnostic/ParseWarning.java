package com.codeparse.core.diagnostic;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A recoverable problem found while parsing.
 *
 * @param kind warning category
 * @param message human readable description
 * @param line line number where the problem starts (1-based)
 * @param column column number where the problem starts (1-based)
 * @since 1.0.0
 */
public record ParseWarning(
    WarningKind kind,
    String message,
    int line,
    int column
) {
    public ParseWarning {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : kind.label();
    }

    /**
     * Converts this warning to a JSON-compatible map.
     *
     * @return map with {@code kind}, {@code message}, {@code line} and {@code column}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", kind.label());
        map.put("message", message);
        map.put("line", line);
        map.put("column", column);
        return map;
    }
}

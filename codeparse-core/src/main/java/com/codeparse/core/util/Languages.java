package com.codeparse.core.util;

import java.util.Locale;

/**
 * Constants for supported language identifiers.
 * <p>
 * These are the canonical identifiers returned by
 * {@link com.codeparse.core.parser.LanguageParser#getLanguage()}. Aliases such as {@code py}
 * or {@code ts} are declared by each parser.
 * </p>
 */
public final class Languages {
    /** Language identifier for Python. */
    public static final String PYTHON = "python";

    /** Language identifier for JavaScript (including JSX and ES modules). */
    public static final String JAVASCRIPT = "javascript";

    /** Language identifier for TypeScript. */
    public static final String TYPESCRIPT = "typescript";

    /** Language identifier for C. */
    public static final String C = "c";

    /** Language identifier for C++. */
    public static final String CPP = "cpp";

    /** Language identifier for Java. */
    public static final String JAVA = "java";

    /** Language identifier for Rust. */
    public static final String RUST = "rust";

    private Languages() {
        // Prevent instantiation
    }

    /**
     * Normalizes a user supplied identifier or extension for registry lookups.
     *
     * @param identifier identifier such as {@code "Python"} or {@code ".ts"}
     * @return trimmed lowercase form without a leading dot, or null for null/blank input
     */
    public static String normalize(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return null;
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith(".") ? normalized.substring(1) : normalized;
    }
}

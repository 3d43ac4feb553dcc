package com.codeparse.core.block;

/**
 * Measures the visual width of leading whitespace.
 */
public final class IndentationWidth {

    /** Tab width used when no configuration overrides it. */
    public static final int DEFAULT_TAB_WIDTH = 8;

    private IndentationWidth() {
        // Utility class
    }

    /**
     * Expands tabs to the next multiple of {@code tabWidth}; a form feed resets the width.
     *
     * @param whitespace leading whitespace of a line
     * @param tabWidth tab stop distance (at least 1)
     * @return column width of the whitespace
     */
    public static int measure(String whitespace, int tabWidth) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        int width = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            char c = whitespace.charAt(i);
            if (c == '\t') {
                width = (width / tabWidth + 1) * tabWidth;
            } else if (c == '\f') {
                width = 0;
            } else {
                width++;
            }
        }
        return width;
    }
}

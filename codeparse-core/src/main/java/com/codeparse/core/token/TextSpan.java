package com.codeparse.core.token;

/**
 * Half-open character range {@code [start, end)} in source text.
 *
 * @param start first character offset (inclusive)
 * @param end last character offset (exclusive)
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String slice(String source) {
        return source.substring(start, Math.min(end, source.length()));
    }
}

package com.codeparse.core.lexical;

import java.util.List;

import com.codeparse.core.token.TextSpan;

/**
 * Result of scanning one exclusion zone.
 *
 * @param kind literal kind
 * @param delimiter opening delimiter (without any string prefix)
 * @param start offset of the first character, including any string prefix
 * @param end offset just past the literal
 * @param terminated whether the closing delimiter was found
 * @param interpolations spans of {@code ${...}} expressions (template literals only)
 */
public record LiteralScan(
    ExclusionKind kind,
    String delimiter,
    int start,
    int end,
    boolean terminated,
    List<TextSpan> interpolations
) {
    public LiteralScan {
        interpolations = interpolations != null ? List.copyOf(interpolations) : List.of();
    }
}

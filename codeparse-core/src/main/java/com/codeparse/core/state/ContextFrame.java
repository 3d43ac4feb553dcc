package com.codeparse.core.state;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of the context stack.
 *
 * <p><b>Recognized metadata keys:</b></p>
 * <ul>
 *   <li>{@link #NAME} - declared name of a function, class or other named construct</li>
 *   <li>{@link #KEYWORD} - introducing keyword of a block construct (e.g. {@code if}, {@code while})</li>
 * </ul>
 *
 * @param type frame type
 * @param metadata per-construct data, immutable
 * @param startIndex index of the token that opened the frame
 * @param scopeId id of the scope this frame belongs to (its own scope if it introduces one)
 */
public record ContextFrame(
    ContextType type,
    Map<String, Object> metadata,
    int startIndex,
    String scopeId
) {
    public static final String NAME = "name";
    public static final String KEYWORD = "keyword";

    public ContextFrame {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(scopeId, "scopeId must not be null");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Returns the declared name recorded in metadata, if any.
     */
    public String name() {
        Object name = metadata.get(NAME);
        return name != null ? name.toString() : null;
    }
}

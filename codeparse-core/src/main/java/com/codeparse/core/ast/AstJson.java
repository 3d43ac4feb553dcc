package com.codeparse.core.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON output of serialized trees.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * String json = AstJson.toJson(result.root());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AstJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private AstJson() {
        // Utility class
    }

    /**
     * Serializes the tree rooted at {@code root} to pretty-printed JSON.
     */
    public static String toJson(AstNode root) {
        return toJson(AstSerializer.toSerializable(root));
    }

    /**
     * Serializes any JSON-compatible value.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tree to JSON", e);
        }
    }
}

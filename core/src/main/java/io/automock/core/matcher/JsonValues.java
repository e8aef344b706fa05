package io.automock.core.matcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.automock.core.error.JsonValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Shared JSON parsing helpers.
 *
 * <p>
 * Parsing is strict: trailing tokens after the first value are rejected and
 * blank input is not JSON. Numeric, boolean and null values keep their JSON
 * node types.
 *
 * <p>
 * Thread-safe: the underlying {@link ObjectMapper} is configured once and only
 * read afterwards.
 */
public final class JsonValues {

    /** Mapper used across the engine for structured body values. */
    public static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonValues() {}

    /**
     * Parses {@code text} as a JSON value.
     *
     * @param text    the JSON text
     * @param context where the text is used, e.g. "request body"
     * @return the parsed tree
     * @throws JsonValidationException if the text is blank or malformed
     */
    public static JsonNode parse(String text, String context) {
        if (text == null || text.isBlank()) {
            throw new JsonValidationException(context, text, null);
        }
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new JsonValidationException(context, text, null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new JsonValidationException(context, text, e);
        }
    }

    /** True if {@code text} is exactly one well-formed JSON value. */
    public static boolean isValid(String text) {
        return text != null && isValid(text.getBytes(StandardCharsets.UTF_8));
    }

    /** True if {@code bytes} hold exactly one well-formed JSON value. */
    public static boolean isValid(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return false;
        }
        try {
            JsonNode node = MAPPER.readTree(bytes);
            return node != null && !node.isMissingNode();
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Serializes a tree to compact UTF-8 JSON.
     *
     * @throws JsonProcessingException if the tree holds a value Jackson cannot
     *                                 write
     */
    public static byte[] toBytes(JsonNode node) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(node);
    }
}

package io.automock.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Request-body matcher or response body, as a sealed tagged union.
 *
 * <p>
 * Each variant carries exactly the payload its {@link BodyType} names, so a
 * body with two populated payloads cannot be expressed. {@code REGEX} and
 * {@code PARAMETERS} only make sense on the request side; {@code BINARY} is
 * produced for responses by the compression transform.
 *
 * <p>
 * All variants except {@link Json} are deeply immutable. {@link Json} wraps a
 * Jackson tree, which is mutable; copy it with {@link Json#deepCopy()} before
 * handing it to another owner.
 */
public sealed interface Body {

    /** The variant tag. */
    BodyType type();

    /**
     * Structured JSON value, matched strictly or as a subset.
     *
     * @param json      the parsed value; numeric, boolean and null nodes keep
     *                  their JSON types
     * @param matchType strictness, or {@code null} to leave the engine default
     */
    record Json(JsonNode json, MatchType matchType) implements Body {
        public Json {
            Objects.requireNonNull(json, "json must not be null");
        }

        @Override
        public BodyType type() {
            return BodyType.JSON;
        }

        /** Returns a structurally independent copy of this body. */
        public Json deepCopy() {
            return new Json(json.deepCopy(), matchType);
        }
    }

    /**
     * Regular-expression match over the raw body text.
     *
     * @param regex    the pattern
     * @param verified {@code false} when the pattern failed to compile and the
     *                 operator accepted it anyway
     */
    record Regex(String regex, boolean verified) implements Body {
        public Regex {
            Objects.requireNonNull(regex, "regex must not be null");
        }

        @Override
        public BodyType type() {
            return BodyType.REGEX;
        }
    }

    /** Exact text match, or a plain-text response body. */
    record Text(String string) implements Body {
        public Text {
            Objects.requireNonNull(string, "string must not be null");
        }

        @Override
        public BodyType type() {
            return BodyType.STRING;
        }
    }

    /** Form-style parameter set match. */
    record Parameters(List<NameValue> parameters) implements Body {
        public Parameters {
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
        }

        @Override
        public BodyType type() {
            return BodyType.PARAMETERS;
        }
    }

    /**
     * Raw bytes, base64-encoded.
     *
     * @param base64Bytes standard base64 of the payload
     * @param contentType declared content type, or {@code null}
     */
    record Binary(String base64Bytes, String contentType) implements Body {
        public Binary {
            Objects.requireNonNull(base64Bytes, "base64Bytes must not be null");
        }

        /** Encodes {@code bytes} into a binary body. */
        public static Binary of(byte[] bytes, String contentType) {
            return new Binary(Base64.getEncoder().encodeToString(bytes), contentType);
        }

        @Override
        public BodyType type() {
            return BodyType.BINARY;
        }

        /** Decodes the payload. */
        public byte[] bytes() {
            return Base64.getDecoder().decode(base64Bytes);
        }
    }
}

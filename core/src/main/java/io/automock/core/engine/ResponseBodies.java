package io.automock.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.automock.core.error.CompressionException;
import io.automock.core.matcher.JsonValues;
import io.automock.core.model.Body;
import java.nio.charset.StandardCharsets;

/**
 * Turns response bodies into the bytes a client would receive, and infers a
 * {@code Content-Type} for them.
 */
public final class ResponseBodies {

    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    public static final String OCTET_STREAM = "application/octet-stream";

    private ResponseBodies() {
        // utility class
    }

    /** Body bytes together with the content type they should be served as. */
    public record Rendered(byte[] bytes, String contentType) {}

    /**
     * Infers a content type.
     *
     * <ul>
     * <li>JSON body, or no body → {@code application/json}</li>
     * <li>text that parses as JSON → {@code application/json}, otherwise
     * {@code text/plain; charset=utf-8}</li>
     * <li>binary → its declared type, else {@code application/json} if the
     * bytes parse as JSON, else {@code application/octet-stream}</li>
     * </ul>
     */
    public static String inferContentType(Body body) {
        if (body == null || body instanceof Body.Json) {
            return APPLICATION_JSON;
        }
        if (body instanceof Body.Text text) {
            return JsonValues.isValid(text.string().trim()) ? APPLICATION_JSON : TEXT_PLAIN_UTF8;
        }
        if (body instanceof Body.Binary binary) {
            if (binary.contentType() != null && !binary.contentType().isBlank()) {
                return binary.contentType();
            }
            return JsonValues.isValid(decode(binary)) ? APPLICATION_JSON : OCTET_STREAM;
        }
        return TEXT_PLAIN_UTF8;
    }

    /**
     * Renders a response body to bytes. A missing body renders as zero bytes.
     *
     * @throws CompressionException for request-only variants (regex, parameters)
     *                              or an undecodable binary payload
     */
    public static Rendered render(Body body) {
        if (body == null) {
            return new Rendered(new byte[0], APPLICATION_JSON);
        }
        if (body instanceof Body.Json json) {
            try {
                return new Rendered(JsonValues.toBytes(json.json()), APPLICATION_JSON);
            } catch (JsonProcessingException e) {
                throw new CompressionException("cannot serialize JSON body: " + e.getOriginalMessage(), e);
            }
        }
        if (body instanceof Body.Text text) {
            return new Rendered(text.string().getBytes(StandardCharsets.UTF_8), inferContentType(body));
        }
        if (body instanceof Body.Binary binary) {
            return new Rendered(decode(binary), inferContentType(body));
        }
        throw new CompressionException("cannot render " + body.type() + " body as response bytes");
    }

    private static byte[] decode(Body.Binary binary) {
        try {
            return binary.bytes();
        } catch (IllegalArgumentException e) {
            throw new CompressionException("binary body is not valid base64: " + e.getMessage(), e);
        }
    }
}

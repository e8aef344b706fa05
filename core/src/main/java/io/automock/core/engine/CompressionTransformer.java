package io.automock.core.engine;

import io.automock.core.model.Body;
import io.automock.core.model.Expectation;
import io.automock.core.model.NameValues;
import io.automock.core.model.ResponseDefinition;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a content coding to an expectation's response.
 *
 * <p>
 * In {@link CompressionMode#HEADERS_ONLY} mode only {@code Content-Encoding},
 * {@code Vary} and (when absent) {@code Content-Type} change; any coding name
 * is accepted. In {@link CompressionMode#PRE_COMPRESS} mode the body is
 * rendered, compressed and replaced by a binary payload; {@code Content-Type}
 * is set to the rendered body's type, and {@code Content-Length} and
 * {@code ETag} are recomputed from the compressed bytes.
 *
 * <p>
 * The transform is all-or-nothing: headers and body are computed on copies
 * and committed only once every step has succeeded.
 */
public final class CompressionTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(CompressionTransformer.class);

    static final String CONTENT_ENCODING = "Content-Encoding";
    static final String CONTENT_TYPE = "Content-Type";
    static final String CONTENT_LENGTH = "Content-Length";
    static final String VARY = "Vary";
    static final String ETAG = "ETag";
    static final String ACCEPT_ENCODING = "Accept-Encoding";

    private CompressionTransformer() {
        // utility class
    }

    /** Applies a known algorithm. */
    public static void apply(Expectation expectation, CompressionAlgorithm algorithm, CompressionMode mode) {
        apply(expectation, algorithm.token(), mode);
    }

    /**
     * Applies the coding named {@code algorithm}.
     *
     * @throws io.automock.core.error.CompressionException if pre-compressing with
     *         an unsupported algorithm or an unrenderable body; the expectation
     *         is then left unchanged
     */
    public static void apply(Expectation expectation, String algorithm, CompressionMode mode) {
        ResponseDefinition response = expectation.response();
        NameValues headers = response != null ? response.headers().copy() : new NameValues();
        Body body = response != null ? response.body() : null;
        String token = algorithm == null ? "" : algorithm.trim().toLowerCase(Locale.ROOT);

        Body newBody = body;
        if (mode == CompressionMode.HEADERS_ONLY) {
            advertise(headers, token, body);
        } else {
            CompressionAlgorithm resolved = CompressionAlgorithm.fromName(token);
            if (resolved == CompressionAlgorithm.IDENTITY) {
                headers.delete(CONTENT_ENCODING);
            } else {
                newBody = precompress(headers, resolved, body);
            }
        }

        ResponseDefinition target = expectation.ensureResponse();
        target.headers().replaceWith(headers);
        target.body(newBody);
        LOG.debug("Applied {} compression ({}) to {}", token, mode.configName(), expectation.id());
    }

    private static void advertise(NameValues headers, String token, Body body) {
        if (CompressionAlgorithm.IDENTITY.token().equals(token) || token.isEmpty()) {
            headers.delete(CONTENT_ENCODING);
        } else {
            headers.upsert(CONTENT_ENCODING, token);
            headers.mergeToken(VARY, ACCEPT_ENCODING);
        }
        if (!headers.contains(CONTENT_TYPE)) {
            headers.upsert(CONTENT_TYPE, ResponseBodies.inferContentType(body));
        }
    }

    private static Body precompress(NameValues headers, CompressionAlgorithm algorithm, Body body) {
        ResponseBodies.Rendered rendered = ResponseBodies.render(body);
        byte[] compressed = algorithm.compress(rendered.bytes());

        headers.upsert(CONTENT_ENCODING, algorithm.token());
        headers.mergeToken(VARY, ACCEPT_ENCODING);
        headers.upsert(CONTENT_TYPE, rendered.contentType());
        headers.upsert(CONTENT_LENGTH, Integer.toString(compressed.length));
        String etag = headers.first(ETAG);
        if (etag != null && !etag.isBlank()) {
            headers.upsert(ETAG, EntityTags.strong(compressed));
        }
        LOG.debug("Pre-compressed body with {}: {} -> {} bytes", algorithm.token(), rendered.bytes().length,
                compressed.length);
        return Body.Binary.of(compressed, rendered.contentType());
    }
}

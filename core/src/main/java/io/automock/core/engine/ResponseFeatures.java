package io.automock.core.engine;

import io.automock.core.error.InputValidationException;
import io.automock.core.model.ConnectionOptions;
import io.automock.core.model.Delay;
import io.automock.core.model.Expectation;
import io.automock.core.model.ProgressivePolicy;
import io.automock.core.model.ResponseDefinition;
import io.automock.core.model.Times;

/**
 * Single-purpose edits of an expectation's response behaviour.
 *
 * <p>
 * Every operation validates its input before touching the expectation: an
 * {@link InputValidationException} leaves it unchanged. Operations that
 * configure the response create it on demand.
 */
public final class ResponseFeatures {

    static final String CACHE_CONTROL = "Cache-Control";
    static final String CONNECTION = "Connection";
    static final String TRANSFER_ENCODING = "Transfer-Encoding";

    private ResponseFeatures() {
        // utility class
    }

    // ── Matching behaviour ──

    /** Sets a fixed response delay in milliseconds ({@code >= 0}). */
    public static void fixedDelay(Expectation expectation, long millis) {
        if (millis < 0) {
            throw new InputValidationException("delay", Long.toString(millis), "a non-negative number of milliseconds");
        }
        expectation.ensureResponse().delay(Delay.millis(millis));
    }

    /** Limits the expectation to {@code count > 0} matches. */
    public static void limitTimes(Expectation expectation, int count) {
        if (count <= 0) {
            throw new InputValidationException("times", Integer.toString(count), "a positive number");
        }
        expectation.times(Times.exactly(count));
    }

    /** Lets the expectation match any number of times. */
    public static void unlimitedTimes(Expectation expectation) {
        expectation.times(Times.unlimited());
    }

    /** Sets the evaluation priority ({@code >= 0}; lower values are evaluated first). */
    public static void priority(Expectation expectation, int priority) {
        if (priority < 0) {
            throw new InputValidationException("priority", Integer.toString(priority), "a non-negative number");
        }
        expectation.priority(priority);
    }

    /**
     * Attaches a progressive delay policy. The expectation itself starts at the
     * base delay and matches once; {@link ProgressiveExpander} generates the ramp.
     */
    public static void progressiveDelay(Expectation expectation, int base, int step, int cap) {
        progressiveDelay(expectation, new ProgressivePolicy(base, step, cap));
    }

    /** As {@link #progressiveDelay(Expectation, int, int, int)}, from a policy value. */
    public static void progressiveDelay(Expectation expectation, ProgressivePolicy policy) {
        if (!policy.isValid()) {
            throw new InputValidationException(
                    "progressive delay", policy.toString(), "base >= 0, step > 0, cap >= base");
        }
        expectation.ensureResponse().delay(Delay.millis(policy.base()));
        expectation.times(Times.exactly(1));
        expectation.progressive(policy);
        String label = "[progressive delay: " + policy + "]";
        String description = expectation.description();
        expectation.description(description == null || description.isEmpty() ? label : description + " " + label);
    }

    // ── Headers ──

    /**
     * Upserts {@code Cache-Control}; optionally also sets a strong {@code ETag}
     * computed over the rendered response body.
     */
    public static void cacheControl(Expectation expectation, String value, boolean generateEtag) {
        if (value == null || value.isBlank()) {
            throw new InputValidationException("cache control", String.valueOf(value), "a non-empty directive list");
        }
        String etag = generateEtag ? computeEtag(expectation.response()) : null;
        ResponseDefinition response = expectation.ensureResponse();
        response.headers().upsert(CACHE_CONTROL, value.trim());
        if (etag != null) {
            response.headers().upsert(CompressionTransformer.ETAG, etag);
        }
    }

    /** Sets a strong {@code ETag} computed over the rendered response body. */
    public static void etag(Expectation expectation) {
        String etag = computeEtag(expectation.response());
        expectation.ensureResponse().headers().upsert(CompressionTransformer.ETAG, etag);
    }

    private static String computeEtag(ResponseDefinition response) {
        return EntityTags.strong(ResponseBodies.render(response != null ? response.body() : null).bytes());
    }

    // ── Connection behaviour ──

    /**
     * Serves the body in chunks of {@code size} bytes. {@code Content-Length} and
     * any explicit {@code Transfer-Encoding} are removed so the engine frames the
     * body itself. A size of zero leaves the expectation as it is.
     */
    public static void chunked(Expectation expectation, int size) {
        if (size < 0) {
            throw new InputValidationException("chunk size", Integer.toString(size), "a non-negative number of bytes");
        }
        if (size == 0) {
            return;
        }
        ResponseDefinition response = expectation.ensureResponse();
        response.ensureConnectionOptions().chunkSize(size);
        response.headers().delete(CompressionTransformer.CONTENT_LENGTH);
        response.headers().delete(TRANSFER_ENCODING);
    }

    /** Keeps the connection open after the response and drops any explicit {@code Connection} header. */
    public static void keepAlive(Expectation expectation) {
        ResponseDefinition response = expectation.ensureResponse();
        response.ensureConnectionOptions().keepAliveOverride(true).closeSocket(false);
        response.headers().delete(CONNECTION);
    }

    /**
     * Closes the socket after responding, optionally after {@code delayMillis}.
     *
     * @param delayMillis delay before closing, or {@code null} to close immediately
     */
    public static void closeSocket(Expectation expectation, Long delayMillis) {
        if (delayMillis != null && delayMillis < 0) {
            throw new InputValidationException(
                    "close socket delay", Long.toString(delayMillis), "a non-negative number of milliseconds");
        }
        ConnectionOptions options = expectation.ensureResponse().ensureConnectionOptions();
        options.closeSocket(true);
        options.closeSocketDelay(delayMillis != null ? Delay.millis(delayMillis) : null);
    }

    /** Tells the engine not to emit a {@code Connection} header. */
    public static void suppressConnectionHeader(Expectation expectation) {
        expectation.ensureResponse().ensureConnectionOptions().suppressConnectionHeader(true);
    }

    /** Forces the {@code Content-Length} value. Clears any suppression. */
    public static void contentLengthOverride(Expectation expectation, int length) {
        if (length < 0) {
            throw new InputValidationException("content length", Integer.toString(length), "a non-negative number");
        }
        expectation.ensureResponse()
                .ensureConnectionOptions()
                .contentLengthHeaderOverride(length)
                .suppressContentLengthHeader(false);
    }

    /** Omits the {@code Content-Length} header. Clears any override. */
    public static void suppressContentLength(Expectation expectation) {
        expectation.ensureResponse()
                .ensureConnectionOptions()
                .suppressContentLengthHeader(true)
                .contentLengthHeaderOverride(null);
    }

    /** Drops the connection instead of answering. */
    public static void dropConnection(Expectation expectation) {
        expectation.ensureResponse().ensureConnectionOptions().dropConnection(true);
    }
}

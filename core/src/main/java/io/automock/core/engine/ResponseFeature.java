package io.automock.core.engine;

import io.automock.core.error.InputValidationException;
import io.automock.core.model.Expectation;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named response features that can be applied from configuration, each taking
 * a single text argument.
 *
 * <p>
 * The key is the configuration name (e.g. {@code chunked}); {@link #apply}
 * parses the argument and dispatches to {@link ResponseFeatures}.
 */
public enum ResponseFeature {
    DELAY("delay"),
    PROGRESSIVE_DELAY("progressive-delay"),
    LIMITS("limits"),
    PRIORITY("priority"),
    CACHE_CONTROL("cache-control"),
    ETAG("etag"),
    COMPRESSION("compression"),
    CHUNKED("chunked"),
    KEEP_ALIVE("keep-alive"),
    CLOSE_SOCKET("close-socket"),
    SUPPRESS_CONNECTION_HEADER("suppress-connection-header"),
    CONTENT_LENGTH("content-length"),
    DROP_CONNECTION("drop-connection");

    /** Applies a feature to one expectation. */
    @FunctionalInterface
    public interface Applier {
        void apply(Expectation expectation, String argument);
    }

    private static final Map<ResponseFeature, Applier> APPLIERS = appliers();

    private final String key;

    ResponseFeature(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Applies this feature.
     *
     * @throws InputValidationException if the argument is malformed or out of range
     */
    public void apply(Expectation expectation, String argument) {
        APPLIERS.get(this).apply(expectation, argument == null ? "" : argument.trim());
    }

    /**
     * Resolves a feature by key, case-insensitively.
     *
     * @throws InputValidationException if the key is unknown
     */
    public static ResponseFeature fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (ResponseFeature feature : values()) {
            if (feature.key.equals(normalized)) {
                return feature;
            }
        }
        throw new InputValidationException("response feature", key, "one of " + keys());
    }

    private static String keys() {
        StringBuilder sb = new StringBuilder();
        for (ResponseFeature feature : values()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(feature.key);
        }
        return sb.toString();
    }

    private static Map<ResponseFeature, Applier> appliers() {
        Map<ResponseFeature, Applier> map = new EnumMap<>(ResponseFeature.class);
        map.put(DELAY, (exp, arg) -> ResponseFeatures.fixedDelay(exp, parseLong("delay", arg)));
        map.put(PROGRESSIVE_DELAY, ResponseFeature::applyProgressive);
        map.put(LIMITS, (exp, arg) -> {
            if ("unlimited".equalsIgnoreCase(arg)) {
                ResponseFeatures.unlimitedTimes(exp);
            } else {
                ResponseFeatures.limitTimes(exp, parseInt("times", arg));
            }
        });
        map.put(PRIORITY, (exp, arg) -> ResponseFeatures.priority(exp, parseInt("priority", arg)));
        map.put(CACHE_CONTROL, (exp, arg) -> ResponseFeatures.cacheControl(exp, arg, false));
        map.put(ETAG, (exp, arg) -> ResponseFeatures.etag(exp));
        map.put(COMPRESSION, ResponseFeature::applyCompression);
        map.put(CHUNKED, (exp, arg) -> ResponseFeatures.chunked(exp, parseInt("chunk size", arg)));
        map.put(KEEP_ALIVE, (exp, arg) -> ResponseFeatures.keepAlive(exp));
        map.put(CLOSE_SOCKET, (exp, arg) ->
                ResponseFeatures.closeSocket(exp, arg.isEmpty() ? null : parseLong("close socket delay", arg)));
        map.put(SUPPRESS_CONNECTION_HEADER, (exp, arg) -> ResponseFeatures.suppressConnectionHeader(exp));
        map.put(CONTENT_LENGTH, (exp, arg) -> {
            if ("suppress".equalsIgnoreCase(arg)) {
                ResponseFeatures.suppressContentLength(exp);
            } else {
                ResponseFeatures.contentLengthOverride(exp, parseInt("content length", arg));
            }
        });
        map.put(DROP_CONNECTION, (exp, arg) -> ResponseFeatures.dropConnection(exp));
        return Collections.unmodifiableMap(map);
    }

    // "base,step,cap"
    private static void applyProgressive(Expectation exp, String arg) {
        String[] parts = arg.split(",");
        if (parts.length != 3) {
            throw new InputValidationException("progressive delay", arg, "base,step,cap in milliseconds");
        }
        ResponseFeatures.progressiveDelay(
                exp,
                parseInt("progressive delay", parts[0].trim()),
                parseInt("progressive delay", parts[1].trim()),
                parseInt("progressive delay", parts[2].trim()));
    }

    // "gzip" or "gzip:pre-compress"
    private static void applyCompression(Expectation exp, String arg) {
        int colon = arg.indexOf(':');
        String algorithm = colon < 0 ? arg : arg.substring(0, colon);
        CompressionMode mode =
                colon < 0 ? CompressionMode.HEADERS_ONLY : CompressionMode.fromName(arg.substring(colon + 1));
        if (algorithm.isBlank()) {
            throw new InputValidationException("compression", arg, "algorithm[:mode]");
        }
        CompressionTransformer.apply(exp, algorithm, mode);
    }

    private static int parseInt(String inputType, String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new InputValidationException(inputType, text, "an integer", e);
        }
    }

    private static long parseLong(String inputType, String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InputValidationException(inputType, text, "an integer", e);
        }
    }
}

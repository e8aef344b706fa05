package io.automock.core.engine;

import io.automock.core.model.Body;
import io.automock.core.model.Expectation;
import io.automock.core.model.RequestMatcher;
import io.automock.core.model.ResponseDefinition;

/**
 * Produces fully independent copies of an {@link Expectation}.
 *
 * <p>
 * The copy is equal to the source by value, but no mutation of either is
 * observable through the other: every mutable container (headers, query and
 * path parameters, connection options, JSON body trees) is reallocated.
 * Immutable values ({@link io.automock.core.model.Times},
 * {@link io.automock.core.model.Delay},
 * {@link io.automock.core.model.ProgressivePolicy} and the non-JSON body
 * variants) are shared, since nothing can change them.
 *
 * <p>
 * Callers take a clone before any edit they may need to revert.
 */
public final class ExpectationCloner {

    private ExpectationCloner() {
        // utility class
    }

    /**
     * Deep-copies {@code source}.
     *
     * @return the copy, or {@code null} if {@code source} is {@code null}
     */
    public static Expectation deepClone(Expectation source) {
        if (source == null) {
            return null;
        }
        Expectation copy = new Expectation(cloneRequest(source.request()), cloneResponse(source.response()));
        copy.id(source.id())
                .description(source.description())
                .priority(source.priority())
                .times(source.times())
                .progressive(source.progressive());
        return copy;
    }

    /** Deep-copies a request matcher. */
    public static RequestMatcher cloneRequest(RequestMatcher source) {
        return RequestMatcher.of(
                source.method(),
                source.path(),
                source.pathParameters(),
                source.queryParameters(),
                source.headers(),
                cloneBody(source.body()));
    }

    /** Deep-copies a response definition; {@code null} stays {@code null}. */
    public static ResponseDefinition cloneResponse(ResponseDefinition source) {
        if (source == null) {
            return null;
        }
        return ResponseDefinition.of(
                source.statusCode(),
                cloneBody(source.body()),
                source.headers(),
                source.delay(),
                source.connectionOptions());
    }

    /** Copies the JSON tree of a JSON body; other variants are immutable and returned as-is. */
    public static Body cloneBody(Body body) {
        if (body instanceof Body.Json json) {
            return json.deepCopy();
        }
        return body;
    }
}

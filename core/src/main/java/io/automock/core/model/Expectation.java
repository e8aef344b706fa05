package io.automock.core.model;

import java.util.Objects;

/**
 * One mock rule: a {@link RequestMatcher} paired with a
 * {@link ResponseDefinition} plus scheduling metadata.
 *
 * <p>
 * Priorities follow one convention throughout this code base: a lower number
 * is evaluated earlier. The wire writer translates to the target engine's
 * convention on export.
 *
 * <p>
 * The aggregate owns its request, response and all their collections by
 * value. Two live expectations never share a backing collection as long as
 * copies are made through the clone engine. Mutable and not thread-safe; a
 * single editing session owns each instance.
 */
public final class Expectation {

    private String id;
    private String description;
    private int priority;
    private Times times;
    private ProgressivePolicy progressive;
    private RequestMatcher request;
    private ResponseDefinition response;

    public Expectation() {
        this(new RequestMatcher(), new ResponseDefinition());
    }

    public Expectation(RequestMatcher request, ResponseDefinition response) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.response = response;
    }

    /** Optional identifier forwarded to the target engine. */
    public String id() {
        return id;
    }

    public Expectation id(String id) {
        this.id = id;
        return this;
    }

    /** Human-readable label; used for display and progressive-clone labeling. */
    public String description() {
        return description;
    }

    public Expectation description(String description) {
        this.description = description;
        return this;
    }

    public int priority() {
        return priority;
    }

    public Expectation priority(int priority) {
        this.priority = priority;
        return this;
    }

    /** Match-count policy, or {@code null} for the engine default (unlimited). */
    public Times times() {
        return times;
    }

    public Expectation times(Times times) {
        this.times = times;
        return this;
    }

    /** Escalating-delay policy, or {@code null} if the operator did not opt in. */
    public ProgressivePolicy progressive() {
        return progressive;
    }

    public Expectation progressive(ProgressivePolicy progressive) {
        this.progressive = progressive;
        return this;
    }

    public RequestMatcher request() {
        return request;
    }

    public Expectation request(RequestMatcher request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        return this;
    }

    /** The response definition, or {@code null} if not configured yet. */
    public ResponseDefinition response() {
        return response;
    }

    public Expectation response(ResponseDefinition response) {
        this.response = response;
        return this;
    }

    /** Returns the response definition, creating a default one on first use. */
    public ResponseDefinition ensureResponse() {
        if (response == null) {
            response = new ResponseDefinition();
        }
        return response;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expectation that)) return false;
        return priority == that.priority
                && Objects.equals(id, that.id)
                && Objects.equals(description, that.description)
                && Objects.equals(times, that.times)
                && Objects.equals(progressive, that.progressive)
                && request.equals(that.request)
                && Objects.equals(response, that.response);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, priority, times, progressive, request, response);
    }

    @Override
    public String toString() {
        return "Expectation[" + (description != null ? description + ", " : "") + request + ", priority="
                + priority + "]";
    }
}

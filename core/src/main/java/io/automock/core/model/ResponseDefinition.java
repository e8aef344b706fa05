package io.automock.core.model;

import java.util.Objects;

/**
 * Response side of an expectation. Mutable and not thread-safe; the headers
 * accessor returns the live collection.
 */
public final class ResponseDefinition {

    private int statusCode;
    private Body body;
    private final NameValues headers;
    private Delay delay;
    private ConnectionOptions connectionOptions;

    public ResponseDefinition() {
        this(200, new NameValues());
    }

    private ResponseDefinition(int statusCode, NameValues headers) {
        this.statusCode = statusCode;
        this.headers = headers;
    }

    /**
     * Creates a response whose headers and connection options are independent
     * copies of the supplied ones.
     */
    public static ResponseDefinition of(
            int statusCode, Body body, NameValues headers, Delay delay, ConnectionOptions connectionOptions) {
        ResponseDefinition response =
                new ResponseDefinition(statusCode, headers != null ? headers.copy() : new NameValues());
        response.body = body;
        response.delay = delay;
        response.connectionOptions = connectionOptions != null ? connectionOptions.copy() : null;
        return response;
    }

    public int statusCode() {
        return statusCode;
    }

    public ResponseDefinition statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    /** Response body, or {@code null} for an empty body. */
    public Body body() {
        return body;
    }

    public ResponseDefinition body(Body body) {
        this.body = body;
        return this;
    }

    /** Live response-header collection. */
    public NameValues headers() {
        return headers;
    }

    public Delay delay() {
        return delay;
    }

    public ResponseDefinition delay(Delay delay) {
        this.delay = delay;
        return this;
    }

    /** Connection options, or {@code null} when none were configured. */
    public ConnectionOptions connectionOptions() {
        return connectionOptions;
    }

    public ResponseDefinition connectionOptions(ConnectionOptions connectionOptions) {
        this.connectionOptions = connectionOptions;
        return this;
    }

    /** Returns the connection options, creating them on first use. */
    public ConnectionOptions ensureConnectionOptions() {
        if (connectionOptions == null) {
            connectionOptions = new ConnectionOptions();
        }
        return connectionOptions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseDefinition that)) return false;
        return statusCode == that.statusCode
                && Objects.equals(body, that.body)
                && headers.equals(that.headers)
                && Objects.equals(delay, that.delay)
                && Objects.equals(connectionOptions, that.connectionOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statusCode, body, headers, delay, connectionOptions);
    }

    @Override
    public String toString() {
        return "ResponseDefinition[" + statusCode + ", " + (body != null ? body.type() : "no body") + "]";
    }
}

package io.automock.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request side of an expectation: which incoming requests it applies to.
 *
 * <p>
 * The path is either a literal, a path template ({@code /users/{id}}) whose
 * parameters are constrained through {@link #pathParameters()}, or a regular
 * expression. Header, query and path-parameter values may themselves be
 * regular expressions; the target engine decides per value.
 *
 * <p>
 * Mutable and not thread-safe. Collections returned by the accessors are the
 * live backing collections of this matcher.
 */
public final class RequestMatcher {

    private String method;
    private String path;
    private final Map<String, List<String>> pathParameters;
    private final NameValues queryParameters;
    private final NameValues headers;
    private Body body;

    public RequestMatcher() {
        this(new LinkedHashMap<>(), new NameValues(), new NameValues());
    }

    private RequestMatcher(
            Map<String, List<String>> pathParameters, NameValues queryParameters, NameValues headers) {
        this.pathParameters = pathParameters;
        this.queryParameters = queryParameters;
        this.headers = headers;
    }

    /**
     * Creates a matcher whose collections are fresh copies of the supplied ones.
     * Used by the clone engine and the wire reader.
     */
    public static RequestMatcher of(
            String method,
            String path,
            Map<String, List<String>> pathParameters,
            NameValues queryParameters,
            NameValues headers,
            Body body) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (pathParameters != null) {
            pathParameters.forEach((name, values) -> params.put(name, new ArrayList<>(values)));
        }
        RequestMatcher matcher = new RequestMatcher(
                params,
                queryParameters != null ? queryParameters.copy() : new NameValues(),
                headers != null ? headers.copy() : new NameValues());
        matcher.method = method;
        matcher.path = path;
        matcher.body = body;
        return matcher;
    }

    public String method() {
        return method;
    }

    public RequestMatcher method(String method) {
        this.method = method;
        return this;
    }

    public String path() {
        return path;
    }

    public RequestMatcher path(String path) {
        this.path = path;
        return this;
    }

    /** Live, ordered map of path-parameter name → accepted alternatives. */
    public Map<String, List<String>> pathParameters() {
        return pathParameters;
    }

    /** Live query-parameter collection. */
    public NameValues queryParameters() {
        return queryParameters;
    }

    /** Live request-header collection. */
    public NameValues headers() {
        return headers;
    }

    /** The body matcher, or {@code null} to match any body. */
    public Body body() {
        return body;
    }

    public RequestMatcher body(Body body) {
        this.body = body;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestMatcher that)) return false;
        return Objects.equals(method, that.method)
                && Objects.equals(path, that.path)
                && pathParameters.equals(that.pathParameters)
                && queryParameters.equals(that.queryParameters)
                && headers.equals(that.headers)
                && Objects.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, pathParameters, queryParameters, headers, body);
    }

    @Override
    public String toString() {
        return "RequestMatcher[" + method + " " + path + "]";
    }
}

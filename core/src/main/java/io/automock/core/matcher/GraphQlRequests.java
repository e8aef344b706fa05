package io.automock.core.matcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.automock.core.error.JsonValidationException;
import io.automock.core.model.Body;
import io.automock.core.model.MatchType;
import io.automock.core.model.RequestMatcher;
import io.automock.core.model.ResponseDefinition;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds request matchers and responses for GraphQL operations.
 *
 * <p>
 * POST operations are matched on the JSON envelope
 * {@code {query, variables, operationName}}; GET operations carry the same
 * fields as query parameters, with {@code variables} JSON-encoded.
 */
public final class GraphQlRequests {

    private static final Pattern OPERATION =
            Pattern.compile("(?m)^\\s*(query|mutation|subscription)\\s+([_A-Za-z][_0-9A-Za-z]*)");

    private static final List<String> OPERATION_TYPES = List.of("query", "mutation", "subscription");

    private GraphQlRequests() {}

    /**
     * Operation type and name of a GraphQL document.
     *
     * @param type lower-cased {@code query}, {@code mutation} or
     *             {@code subscription}; empty if not recognised
     * @param name operation name; empty for anonymous operations
     */
    public record Operation(String type, String name) {

        public boolean isNamed() {
            return !name.isEmpty();
        }
    }

    /** Extracts the operation type and name from {@code query}. */
    public static Operation operation(String query) {
        String trimmed = query != null ? query.trim() : "";
        Matcher m = OPERATION.matcher(trimmed);
        if (m.find()) {
            return new Operation(m.group(1).toLowerCase(Locale.ROOT), m.group(2));
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String type : OPERATION_TYPES) {
            if (lower.startsWith(type)) {
                return new Operation(type, "");
            }
        }
        return new Operation("", "");
    }

    /**
     * Configures {@code request} to match a POSTed GraphQL envelope.
     *
     * @param variables parsed variables object, or {@code null}
     * @param matchType strictness; {@code null} defaults to
     *                  {@link MatchType#ONLY_MATCHING_FIELDS}
     */
    public static void applyPost(RequestMatcher request, String query, JsonNode variables, MatchType matchType) {
        ObjectNode envelope = JsonValues.MAPPER.createObjectNode();
        envelope.put("query", query);
        if (variables != null && !variables.isNull()) {
            envelope.set("variables", variables.deepCopy());
        }
        Operation op = operation(query);
        if (op.isNamed()) {
            envelope.put("operationName", op.name());
        }
        request.headers().upsert("Content-Type", "application/json");
        request.body(new Body.Json(envelope, matchType != null ? matchType : MatchType.ONLY_MATCHING_FIELDS));
    }

    /**
     * Configures {@code request} to match a GraphQL GET whose operation travels
     * in the query string.
     */
    public static void applyGet(RequestMatcher request, String query, JsonNode variables) {
        request.queryParameters().upsert("query", query);
        Operation op = operation(query);
        if (op.isNamed()) {
            request.queryParameters().upsert("operationName", op.name());
        }
        if (variables != null && !variables.isNull()) {
            try {
                request.queryParameters().upsert("variables", JsonValues.MAPPER.writeValueAsString(variables));
            } catch (JsonProcessingException e) {
                throw new JsonValidationException("graphql variables", variables.toString(), e);
            }
        }
    }

    /**
     * Sets a GraphQL JSON response ({@code data} / {@code errors} payload).
     *
     * @throws JsonValidationException if {@code payload} is not JSON
     */
    public static void applyResponse(ResponseDefinition response, String payload) {
        JsonNode value = JsonValues.parse(payload != null ? payload.trim() : null, "graphql response");
        response.headers().upsert("Content-Type", "application/json");
        response.body(new Body.Json(value, null));
    }

    /** Parses operator-supplied variables text; blank text means no variables. */
    public static JsonNode parseVariables(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return JsonValues.parse(text.trim(), "graphql variables");
    }
}

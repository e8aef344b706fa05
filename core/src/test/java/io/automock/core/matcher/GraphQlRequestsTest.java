package io.automock.core.matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.automock.core.error.JsonValidationException;
import io.automock.core.model.Body;
import io.automock.core.model.MatchType;
import io.automock.core.model.RequestMatcher;
import io.automock.core.model.ResponseDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link GraphQlRequests}. */
class GraphQlRequestsTest {

    private static final String NAMED_QUERY = "query GetUser($id: ID!) {\n  user(id: $id) { name }\n}";

    @Nested
    @DisplayName("Operation detection")
    class OperationDetection {

        @Test
        void extractsTypeAndName() {
            assertThat(GraphQlRequests.operation(NAMED_QUERY))
                    .isEqualTo(new GraphQlRequests.Operation("query", "GetUser"));
        }

        @Test
        void findsOperationOnLaterLine() {
            String doc = "# comment\nmutation CreateUser { createUser { id } }";
            assertThat(GraphQlRequests.operation(doc))
                    .isEqualTo(new GraphQlRequests.Operation("mutation", "CreateUser"));
        }

        @Test
        void anonymousOperationHasNoName() {
            GraphQlRequests.Operation op = GraphQlRequests.operation("subscription { ticks }");
            assertThat(op.type()).isEqualTo("subscription");
            assertThat(op.isNamed()).isFalse();
        }

        @Test
        void shorthandQueryIsUnrecognised() {
            assertThat(GraphQlRequests.operation("{ me { id } }")).isEqualTo(new GraphQlRequests.Operation("", ""));
        }
    }

    @Nested
    @DisplayName("POST envelope")
    class Post {

        @Test
        void buildsEnvelopeWithOperationNameAndVariables() {
            RequestMatcher request = new RequestMatcher().method("POST").path("/graphql");
            JsonNode variables = GraphQlRequests.parseVariables("{\"id\": \"42\"}");

            GraphQlRequests.applyPost(request, NAMED_QUERY, variables, null);

            assertThat(request.headers().first("content-type")).isEqualTo("application/json");
            Body.Json body = (Body.Json) request.body();
            assertThat(body.matchType()).isEqualTo(MatchType.ONLY_MATCHING_FIELDS);
            assertThat(body.json().get("query").asText()).isEqualTo(NAMED_QUERY);
            assertThat(body.json().get("operationName").asText()).isEqualTo("GetUser");
            assertThat(body.json().get("variables").get("id").asText()).isEqualTo("42");
        }

        @Test
        void omitsAbsentVariablesAndAnonymousName() {
            RequestMatcher request = new RequestMatcher();
            GraphQlRequests.applyPost(request, "{ me { id } }", null, MatchType.STRICT);

            Body.Json body = (Body.Json) request.body();
            assertThat(body.json().has("variables")).isFalse();
            assertThat(body.json().has("operationName")).isFalse();
            assertThat(body.matchType()).isEqualTo(MatchType.STRICT);
        }
    }

    @Nested
    @DisplayName("GET query string")
    class Get {

        @Test
        void putsOperationIntoQueryParameters() {
            RequestMatcher request = new RequestMatcher().method("GET").path("/graphql");
            GraphQlRequests.applyGet(request, NAMED_QUERY, GraphQlRequests.parseVariables("{\"id\":1}"));

            assertThat(request.queryParameters().first("query")).isEqualTo(NAMED_QUERY);
            assertThat(request.queryParameters().first("operationName")).isEqualTo("GetUser");
            assertThat(request.queryParameters().first("variables")).isEqualTo("{\"id\":1}");
            assertThat(request.body()).isNull();
        }
    }

    @Test
    void blankVariablesMeanNone() {
        assertThat(GraphQlRequests.parseVariables("  ")).isNull();
    }

    @Test
    void malformedVariablesAreRejected() {
        assertThatThrownBy(() -> GraphQlRequests.parseVariables("{id:"))
                .isInstanceOf(JsonValidationException.class)
                .hasMessageContaining("graphql variables");
    }

    @Test
    void responsePayloadBecomesJsonBody() {
        ResponseDefinition response = new ResponseDefinition();
        GraphQlRequests.applyResponse(response, "{\"data\":{\"user\":null}}");
        assertThat(response.headers().first("Content-Type")).isEqualTo("application/json");
        assertThat(((Body.Json) response.body()).json().get("data").has("user")).isTrue();
    }
}

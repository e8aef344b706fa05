package io.automock.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.automock.core.error.ExportException;
import io.automock.core.matcher.BodyMatchers;
import io.automock.core.matcher.JsonValues;
import io.automock.core.model.Body;
import io.automock.core.model.BodyType;
import io.automock.core.model.ConnectionOptions;
import io.automock.core.model.Delay;
import io.automock.core.model.Expectation;
import io.automock.core.model.MatchType;
import io.automock.core.model.NameValue;
import io.automock.core.model.NameValues;
import io.automock.core.model.ProgressivePolicy;
import io.automock.core.model.RequestMatcher;
import io.automock.core.model.ResponseDefinition;
import io.automock.core.model.Times;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads expectation drafts: the wire format produced by
 * {@link ExpectationJsonWriter}, written as JSON or YAML, plus the draft-only
 * keys {@code description} and {@code progressive}.
 *
 * <p>
 * A document is either a single expectation object or an array of them. It
 * is validated against {@code schemas/expectation-draft.schema.json} before
 * it is mapped, so structural mistakes are reported together and by path.
 * Headers may be given as {@code [{name, values}]} or as an object of name
 * to value(s). Priorities are read as they are: lower is evaluated first.
 *
 * <p>
 * Thread-safe.
 */
public final class ExpectationJsonReader {

    private static final Logger LOG = LoggerFactory.getLogger(ExpectationJsonReader.class);

    static final String SCHEMA_RESOURCE = "/schemas/expectation-draft.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchema DRAFT_SCHEMA = loadSchema();

    /**
     * Reads a draft file. Files ending in {@code .json} are parsed as JSON,
     * everything else as YAML.
     *
     * @throws ExportException if the file cannot be read, parsed or mapped
     */
    public List<Expectation> read(Path path) {
        String source = path.toString();
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExportException("Failed to read draft: " + e.getMessage(), e, source);
        }
        return read(text, source);
    }

    /**
     * Reads draft text. Text starting with {@code [} or <code>{</code> is parsed
     * as JSON, anything else as YAML.
     *
     * @param source label used in error messages, e.g. a file name; may be null
     * @throws ExportException if the text cannot be parsed or does not match the
     *                         draft schema
     */
    public List<Expectation> read(String text, String source) {
        JsonNode root = parse(text, source);
        validate(root, source);

        List<Expectation> result = new ArrayList<>();
        if (root.isArray()) {
            int index = 0;
            for (JsonNode element : root) {
                result.add(expectation(element, source, "[" + index++ + "]."));
            }
        } else {
            result.add(expectation(root, source, ""));
        }
        LOG.debug("Read {} expectation(s) from {}", result.size(), source != null ? source : "<text>");
        return result;
    }

    // ── Parsing and validation ──

    private static JsonNode parse(String text, String source) {
        if (text == null || text.isBlank()) {
            throw new ExportException("Draft is empty", source);
        }
        String trimmed = text.stripLeading();
        ObjectMapper mapper =
                trimmed.startsWith("[") || trimmed.startsWith("{") ? JsonValues.MAPPER : YAML_MAPPER;
        try {
            JsonNode root = mapper.readTree(text);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ExportException("Draft is empty", source);
            }
            return root;
        } catch (IOException e) {
            throw new ExportException("Failed to parse draft: " + e.getMessage(), e, source);
        }
    }

    private static void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = DRAFT_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ExportException("Draft does not match the expectation schema: " + details, source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ExpectationJsonReader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            JsonNode schema = JsonValues.MAPPER.readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schema);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + SCHEMA_RESOURCE, e);
        }
    }

    // ── Mapping ──

    private Expectation expectation(JsonNode node, String source, String where) {
        RequestMatcher request = request(node.get("httpRequest"), source, where);
        ResponseDefinition response = null;
        if (node.hasNonNull("httpResponse")) {
            response = response(node.get("httpResponse"), source, where);
        }
        JsonNode error = node.get("httpError");
        if (error != null && error.path("dropConnection").asBoolean(false)) {
            if (response == null) {
                response = new ResponseDefinition();
            }
            response.ensureConnectionOptions().dropConnection(true);
        }

        Expectation exp = new Expectation(request, response);
        exp.id(text(node, "id"));
        exp.description(text(node, "description"));
        exp.priority(node.path("priority").asInt(0));
        exp.times(times(node.get("times")));

        JsonNode progressive = node.get("progressive");
        if (progressive != null && !progressive.isNull()) {
            ProgressivePolicy policy = new ProgressivePolicy(
                    progressive.get("base").asInt(),
                    progressive.get("step").asInt(),
                    progressive.get("cap").asInt());
            if (!policy.isValid()) {
                throw new ExportException(
                        where + "progressive: base >= 0, step > 0 and cap >= base required, got " + policy, source);
            }
            exp.progressive(policy);
        }
        return exp;
    }

    private RequestMatcher request(JsonNode node, String source, String where) {
        Body body = node.hasNonNull("body") ? body(node.get("body"), source, where + "httpRequest.body") : null;
        return RequestMatcher.of(
                text(node, "method"),
                text(node, "path"),
                multiMap(node.get("pathParameters")),
                NameValues.fromMap(multiMap(node.get("queryStringParameters"))),
                headers(node.get("headers")),
                body);
    }

    private ResponseDefinition response(JsonNode node, String source, String where) {
        ResponseDefinition response = new ResponseDefinition();
        if (node.has("statusCode")) {
            response.statusCode(node.get("statusCode").asInt());
        }
        response.headers().replaceWith(headers(node.get("headers")));
        if (node.hasNonNull("body")) {
            response.body(body(node.get("body"), source, where + "httpResponse.body"));
        }
        if (node.hasNonNull("delay")) {
            response.delay(delay(node.get("delay")));
        }
        JsonNode options = node.get("connectionOptions");
        if (options != null && !options.isNull()) {
            response.connectionOptions(connectionOptions(options));
        }
        return response;
    }

    private static Body body(JsonNode node, String source, String where) {
        if (node.isTextual()) {
            return BodyMatchers.text(node.asText());
        }
        BodyType type = bodyType(node);
        if (type == null) {
            return BodyMatchers.json(node, null);
        }
        switch (type) {
            case JSON -> {
                MatchType matchType =
                        node.hasNonNull("matchType") ? matchType(node.get("matchType"), source, where) : null;
                JsonNode json = node.get("json");
                if (json == null) {
                    throw new ExportException(where + ": JSON body requires 'json'", source);
                }
                return json.isTextual()
                        ? BodyMatchers.json(json.asText(), matchType)
                        : BodyMatchers.json(json, matchType);
            }
            case REGEX -> {
                return BodyMatchers.regex(requireText(node, "regex", source, where));
            }
            case STRING -> {
                return BodyMatchers.text(requireText(node, "string", source, where));
            }
            case PARAMETERS -> {
                List<NameValue> parameters = new ArrayList<>();
                for (JsonNode parameter : node.path("parameters")) {
                    parameters.add(
                            new NameValue(parameter.path("name").asText(), stringList(parameter.get("values"))));
                }
                return BodyMatchers.parameters(parameters);
            }
            case BINARY -> {
                Body.Binary binary = new Body.Binary(
                        requireText(node, "base64Bytes", source, where), text(node, "contentType"));
                try {
                    binary.bytes();
                } catch (IllegalArgumentException e) {
                    throw new ExportException(where + ": 'base64Bytes' is not valid base64", e, source);
                }
                return binary;
            }
            default -> throw new ExportException(where + ": unsupported body type " + type, source);
        }
    }

    // A plain object whose "type" is not a body tag is itself the JSON body.
    private static BodyType bodyType(JsonNode node) {
        JsonNode type = node.get("type");
        if (!node.isObject() || type == null || !type.isTextual()) {
            return null;
        }
        for (BodyType candidate : BodyType.values()) {
            if (candidate.name().equals(type.asText())) {
                return candidate;
            }
        }
        return null;
    }

    private static MatchType matchType(JsonNode node, String source, String where) {
        try {
            return MatchType.valueOf(node.asText());
        } catch (IllegalArgumentException e) {
            throw new ExportException(
                    where + ": unknown matchType '" + node.asText() + "' (expected STRICT or ONLY_MATCHING_FIELDS)",
                    e,
                    source);
        }
    }

    private static NameValues headers(JsonNode node) {
        NameValues headers = new NameValues();
        if (node == null || node.isNull()) {
            return headers;
        }
        if (node.isArray()) {
            for (JsonNode entry : node) {
                headers.upsert(entry.path("name").asText(), stringList(entry.get("values")));
            }
            return headers;
        }
        multiMap(node).forEach(headers::upsert);
        return headers;
    }

    private static Map<String, List<String>> multiMap(JsonNode node) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return map;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), stringList(field.getValue()));
        }
        return map;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(value -> values.add(value.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private static Times times(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.path("unlimited").asBoolean(false) || !node.has("remainingTimes")) {
            return Times.unlimited();
        }
        return Times.exactly(node.get("remainingTimes").asInt());
    }

    private static Delay delay(JsonNode node) {
        TimeUnit unit = node.hasNonNull("timeUnit")
                ? TimeUnit.valueOf(node.get("timeUnit").asText())
                : TimeUnit.MILLISECONDS;
        return new Delay(unit, node.get("value").asLong());
    }

    private static ConnectionOptions connectionOptions(JsonNode node) {
        ConnectionOptions options = new ConnectionOptions();
        options.suppressContentLengthHeader(node.path("suppressContentLengthHeader").asBoolean(false));
        options.suppressConnectionHeader(node.path("suppressConnectionHeader").asBoolean(false));
        options.closeSocket(node.path("closeSocket").asBoolean(false));
        if (node.hasNonNull("contentLengthHeaderOverride")) {
            options.contentLengthHeaderOverride(node.get("contentLengthHeaderOverride").asInt());
        }
        if (node.hasNonNull("chunkSize")) {
            options.chunkSize(node.get("chunkSize").asInt());
        }
        if (node.hasNonNull("keepAliveOverride")) {
            options.keepAliveOverride(node.get("keepAliveOverride").asBoolean());
        }
        if (node.hasNonNull("closeSocketDelay")) {
            options.closeSocketDelay(delay(node.get("closeSocketDelay")));
        }
        return options;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requireText(JsonNode node, String field, String source, String where) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ExportException(where + ": missing '" + field + "'", source);
        }
        return value.asText();
    }
}

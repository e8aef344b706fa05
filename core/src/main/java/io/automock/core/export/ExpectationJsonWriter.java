package io.automock.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.automock.core.error.ExportException;
import io.automock.core.matcher.JsonValues;
import io.automock.core.model.Body;
import io.automock.core.model.ConnectionOptions;
import io.automock.core.model.Delay;
import io.automock.core.model.Expectation;
import io.automock.core.model.NameValue;
import io.automock.core.model.NameValues;
import io.automock.core.model.RequestMatcher;
import io.automock.core.model.ResponseDefinition;
import io.automock.core.model.Times;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes expectations into the mock server's JSON array format.
 *
 * <p>
 * Draft-only state ({@code description}, progressive policies) is not part of
 * the wire format and is never written. Optional fields are omitted rather
 * than written as {@code null}; collections are written in insertion order.
 *
 * <p>
 * Thread-safe: instances hold only immutable settings.
 */
public final class ExpectationJsonWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ExpectationJsonWriter.class);

    private final PriorityOrder priorityOrder;
    private final boolean pretty;

    /** Writer with lower-first priorities and pretty printing. */
    public ExpectationJsonWriter() {
        this(PriorityOrder.LOWER_FIRST, true);
    }

    public ExpectationJsonWriter(PriorityOrder priorityOrder, boolean pretty) {
        this.priorityOrder = Objects.requireNonNull(priorityOrder, "priorityOrder must not be null");
        this.pretty = pretty;
    }

    /**
     * Serializes {@code expectations} to JSON text.
     *
     * @throws ExportException if the tree cannot be serialized
     */
    public String write(List<Expectation> expectations) {
        ArrayNode tree = toJson(expectations);
        try {
            return pretty
                    ? JsonValues.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : JsonValues.MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new ExportException("Failed to serialize expectations: " + e.getOriginalMessage(), e, null);
        }
    }

    /**
     * Serializes {@code expectations} and writes them to {@code target} (UTF-8),
     * replacing any existing file.
     */
    public void write(List<Expectation> expectations, Path target) {
        String json = write(expectations);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExportException("Failed to write expectations: " + e.getMessage(), e, target.toString());
        }
    }

    /** Builds the JSON tree without rendering it. */
    public ArrayNode toJson(List<Expectation> expectations) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (Expectation exp : expectations) {
            min = Math.min(min, exp.priority());
            max = Math.max(max, exp.priority());
        }

        ArrayNode array = JsonValues.MAPPER.createArrayNode();
        for (Expectation exp : expectations) {
            int priority = priorityOrder == PriorityOrder.HIGHER_FIRST ? max + min - exp.priority() : exp.priority();
            array.add(expectationNode(exp, priority));
        }
        return array;
    }

    // ── Expectation ──

    private ObjectNode expectationNode(Expectation exp, int priority) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        if (exp.id() != null && !exp.id().isEmpty()) {
            node.put("id", exp.id());
        }
        node.put("priority", priority);
        node.set("httpRequest", requestNode(exp.request()));

        ResponseDefinition response = exp.response();
        ConnectionOptions options = response != null ? response.connectionOptions() : null;
        if (options != null && options.dropConnection()) {
            node.set("httpError", JsonValues.MAPPER.createObjectNode().put("dropConnection", true));
        } else if (response != null) {
            node.set("httpResponse", responseNode(response));
        }

        Times times = exp.times();
        if (times != null) {
            ObjectNode timesNode = node.putObject("times");
            if (times.isUnlimited()) {
                timesNode.put("unlimited", true);
            } else {
                timesNode.put("remainingTimes", times.remainingTimes());
            }
        }
        return node;
    }

    private ObjectNode requestNode(RequestMatcher request) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        putIfPresent(node, "method", request.method());
        putIfPresent(node, "path", request.path());
        if (!request.pathParameters().isEmpty()) {
            node.set("pathParameters", multiMapNode(request.pathParameters()));
        }
        if (!request.queryParameters().isEmpty()) {
            node.set("queryStringParameters", multiMapNode(request.queryParameters().toMultiValueMap()));
        }
        if (!request.headers().isEmpty()) {
            node.set("headers", headersNode(request.headers()));
        }
        if (request.body() != null) {
            node.set("body", bodyNode(request.body()));
        }
        return node;
    }

    private ObjectNode responseNode(ResponseDefinition response) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("statusCode", response.statusCode());
        if (!response.headers().isEmpty()) {
            node.set("headers", headersNode(response.headers()));
        }
        if (response.body() != null) {
            node.set("body", bodyNode(response.body()));
        }
        if (response.delay() != null) {
            node.set("delay", delayNode(response.delay()));
        }
        ConnectionOptions options = response.connectionOptions();
        if (options != null && !options.isEmpty()) {
            node.set("connectionOptions", connectionOptionsNode(options));
        }
        return node;
    }

    // ── Parts ──

    static ObjectNode bodyNode(Body body) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("type", body.type().name());
        if (body instanceof Body.Json json) {
            node.set("json", json.json().deepCopy());
            if (json.matchType() != null) {
                node.put("matchType", json.matchType().name());
            }
        } else if (body instanceof Body.Regex regex) {
            if (!regex.verified()) {
                LOG.warn("Writing unverified regex body matcher '{}'; the target engine may reject it", regex.regex());
            }
            node.put("regex", regex.regex());
        } else if (body instanceof Body.Text text) {
            node.put("string", text.string());
        } else if (body instanceof Body.Parameters parameters) {
            ArrayNode array = node.putArray("parameters");
            parameters.parameters().forEach(parameter -> array.add(nameValueNode(parameter)));
        } else if (body instanceof Body.Binary binary) {
            node.put("base64Bytes", binary.base64Bytes());
            putIfPresent(node, "contentType", binary.contentType());
        }
        return node;
    }

    private static ArrayNode headersNode(NameValues headers) {
        ArrayNode array = JsonValues.MAPPER.createArrayNode();
        headers.entries().forEach(entry -> array.add(nameValueNode(entry)));
        return array;
    }

    private static ObjectNode nameValueNode(NameValue entry) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("name", entry.name());
        ArrayNode values = node.putArray("values");
        entry.values().forEach(values::add);
        return node;
    }

    private static ObjectNode multiMapNode(Map<String, List<String>> map) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        map.forEach((name, values) -> {
            ArrayNode array = node.putArray(name);
            values.forEach(array::add);
        });
        return node;
    }

    private static ObjectNode delayNode(Delay delay) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("timeUnit", delay.timeUnit().name());
        node.put("value", delay.value());
        return node;
    }

    private static ObjectNode connectionOptionsNode(ConnectionOptions options) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        if (options.suppressContentLengthHeader()) {
            node.put("suppressContentLengthHeader", true);
        }
        if (options.contentLengthHeaderOverride() != null) {
            node.put("contentLengthHeaderOverride", options.contentLengthHeaderOverride());
        }
        if (options.suppressConnectionHeader()) {
            node.put("suppressConnectionHeader", true);
        }
        if (options.chunkSize() != null) {
            node.put("chunkSize", options.chunkSize());
        }
        if (options.keepAliveOverride() != null) {
            node.put("keepAliveOverride", options.keepAliveOverride());
        }
        if (options.closeSocket()) {
            node.put("closeSocket", true);
        }
        if (options.closeSocketDelay() != null) {
            node.set("closeSocketDelay", delayNode(options.closeSocketDelay()));
        }
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isEmpty()) {
            node.put(field, value);
        }
    }
}

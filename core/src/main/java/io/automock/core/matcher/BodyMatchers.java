package io.automock.core.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import io.automock.core.error.JsonValidationException;
import io.automock.core.error.MatcherConstructionException;
import io.automock.core.error.RegexValidationException;
import io.automock.core.model.Body;
import io.automock.core.model.MatchType;
import io.automock.core.model.NameValue;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constructors for request-body matchers and response bodies.
 *
 * <p>
 * Each factory either returns a well-formed {@link Body} variant or throws a
 * validation/construction exception. Degraded results (JSON stored as text,
 * an uncompiled regex) are only produced by the explicitly named factories.
 */
public final class BodyMatchers {

    private static final Logger LOG = LoggerFactory.getLogger(BodyMatchers.class);

    /** Context used in error messages for request-body matchers. */
    public static final String REQUEST_BODY = "request body";

    private BodyMatchers() {
        // utility class
    }

    // ── JSON ──

    /**
     * Parses {@code text} into a JSON matcher.
     *
     * @param matchType strictness, or {@code null} for the engine default
     * @throws JsonValidationException if the text is not JSON
     */
    public static Body.Json json(String text, MatchType matchType) {
        return new Body.Json(JsonValues.parse(text != null ? text.trim() : null, REQUEST_BODY), matchType);
    }

    /** Wraps an already parsed value; the tree is copied. */
    public static Body.Json json(JsonNode value, MatchType matchType) {
        return new Body.Json(value.deepCopy(), matchType);
    }

    /**
     * Parses {@code text} into a JSON matcher, or falls back to an exact
     * {@code STRING} match of the literal text when it is not JSON. Callers use
     * this only after the operator agreed to the fallback.
     */
    public static Body jsonOrLiteral(String text, MatchType matchType) {
        String trimmed = text != null ? text.trim() : "";
        if (JsonValues.isValid(trimmed)) {
            return json(trimmed, matchType);
        }
        LOG.debug("Body is not valid JSON, storing as exact string match");
        return new Body.Text(trimmed);
    }

    // ── REGEX ──

    /**
     * Builds a regex matcher after compiling the pattern.
     *
     * @throws RegexValidationException if the pattern does not compile
     */
    public static Body.Regex regex(String pattern) {
        RegexValidator.validate(pattern, REQUEST_BODY);
        return new Body.Regex(pattern, true);
    }

    /**
     * Accepts a pattern without requiring it to compile. The result is tagged
     * {@code verified=false} when compilation fails so exporters and reviewers
     * can flag it.
     */
    public static Body.Regex regexUnchecked(String pattern) {
        boolean verified = RegexValidator.isValid(pattern);
        if (!verified) {
            LOG.warn("Accepting regex pattern that does not compile: {}", pattern);
        }
        return new Body.Regex(pattern, verified);
    }

    // ── STRING ──

    /** Exact text match; the text is kept verbatim. */
    public static Body.Text text(String text) {
        return new Body.Text(text != null ? text : "");
    }

    // ── PARAMETERS ──

    /**
     * Builds one parameter from a name and comma-separated values. Values are
     * trimmed and blank ones dropped.
     *
     * @throws MatcherConstructionException if the name is blank or no value
     *                                      remains
     */
    public static NameValue parameter(String name, String commaSeparatedValues) {
        String trimmedName = name != null ? name.trim() : "";
        if (trimmedName.isEmpty()) {
            throw new MatcherConstructionException("parameter name must not be empty", REQUEST_BODY);
        }
        List<String> values = splitValues(commaSeparatedValues);
        if (values.isEmpty()) {
            throw new MatcherConstructionException(
                    "parameter '" + trimmedName + "' needs at least one value", REQUEST_BODY);
        }
        return new NameValue(trimmedName, values);
    }

    /**
     * Parses a {@code name=value[,value2]} line.
     *
     * @throws MatcherConstructionException if the line has no {@code =} or the
     *                                      entry is incomplete
     */
    public static NameValue parameterLine(String line) {
        String trimmed = line != null ? line.trim() : "";
        int eq = trimmed.indexOf('=');
        if (eq < 0) {
            throw new MatcherConstructionException(
                    "expected name=value[,value2], got '" + trimmed + "'", REQUEST_BODY);
        }
        return parameter(trimmed.substring(0, eq), trimmed.substring(eq + 1));
    }

    /**
     * Builds a parameter-set matcher. Names and values are trimmed and blank
     * values dropped, as in {@link #parameter(String, String)}.
     *
     * @throws MatcherConstructionException if no parameters are supplied, or an
     *                                      entry has a blank name or no
     *                                      non-blank value
     */
    public static Body.Parameters parameters(List<NameValue> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            throw new MatcherConstructionException("no parameters provided", REQUEST_BODY);
        }
        List<NameValue> normalized = new ArrayList<>(parameters.size());
        for (NameValue entry : parameters) {
            String name = entry.name() != null ? entry.name().trim() : "";
            if (name.isEmpty()) {
                throw new MatcherConstructionException("parameter name must not be empty", REQUEST_BODY);
            }
            List<String> values = new ArrayList<>();
            for (String value : entry.values()) {
                if (value != null && !value.isBlank()) {
                    values.add(value.trim());
                }
            }
            if (values.isEmpty()) {
                throw new MatcherConstructionException(
                        "parameter '" + name + "' needs at least one value", REQUEST_BODY);
            }
            normalized.add(new NameValue(name, values));
        }
        return new Body.Parameters(normalized);
    }

    // ── BINARY ──

    /** Wraps raw bytes; only used for response bodies. */
    public static Body.Binary binary(byte[] bytes, String contentType) {
        return Body.Binary.of(bytes, contentType);
    }

    /** Splits comma-separated input, trimming and dropping blank values. */
    public static List<String> splitValues(String commaSeparated) {
        List<String> values = new ArrayList<>();
        if (commaSeparated == null) {
            return values;
        }
        for (String part : commaSeparated.split(",")) {
            String value = part.trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}

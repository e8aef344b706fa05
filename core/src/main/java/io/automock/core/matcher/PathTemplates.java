package io.automock.core.matcher;

import io.automock.core.model.NameValues;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Helpers for request paths: query splitting, template parameters, literal regexes. */
public final class PathTemplates {

    private static final Pattern TEMPLATE_PARAM = Pattern.compile("\\{([^}/]+)}");

    private PathTemplates() {}

    /**
     * A path separated from its query string.
     *
     * @param path            the path, always starting with {@code /}
     * @param queryParameters decoded query parameters in order of appearance
     */
    public record SplitPath(String path, NameValues queryParameters) {}

    /**
     * Splits {@code fullPath} into path and query parameters. Repeated
     * parameters keep all their values. Input with a malformed percent-escape
     * is returned as-is with no parameters.
     */
    public static SplitPath split(String fullPath) {
        String input = fullPath != null ? fullPath.trim() : "";
        if (!input.startsWith("/")) {
            input = "/" + input;
        }
        NameValues query = new NameValues();
        int q = input.indexOf('?');
        if (q < 0) {
            return new SplitPath(input, query);
        }
        String rawPath = input.substring(0, q);
        String rawQuery = input.substring(q + 1);
        try {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String name = decode(eq >= 0 ? pair.substring(0, eq) : pair);
                String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
                List<String> values = new ArrayList<>(query.all(name));
                values.add(value);
                query.upsert(name, values);
            }
        } catch (IllegalArgumentException e) {
            // malformed percent-escape
            return new SplitPath(input, new NameValues());
        }
        return new SplitPath(rawPath, query);
    }

    /** Distinct {@code {name}} template parameters in order of appearance. */
    public static List<String> parameterNames(String path) {
        Set<String> names = new LinkedHashSet<>();
        if (path != null) {
            Matcher m = TEMPLATE_PARAM.matcher(path);
            while (m.find()) {
                names.add(m.group(1));
            }
        }
        return List.copyOf(names);
    }

    /** True if {@code path} contains at least one {@code {name}} parameter. */
    public static boolean isTemplate(String path) {
        return !parameterNames(path).isEmpty();
    }

    /** An anchored regex matching {@code path} literally. */
    public static String literalRegex(String path) {
        return "^" + Pattern.quote(path) + "$";
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}

package io.automock.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, case-insensitively keyed multi-value collection used for request
 * headers, query parameters and response headers.
 *
 * <p>
 * At most one entry exists per case-folded name: {@link #upsert} replaces the
 * values of an existing entry in place (keeping its position and its original
 * spelling) and only appends when the name is new. Lookups never throw; an
 * absent name is reported as an empty list or {@code null}.
 *
 * <p>
 * Not thread-safe. Each instance is owned by exactly one
 * {@link RequestMatcher} or {@link ResponseDefinition}; use {@link #copy()}
 * to hand an independent collection to another owner.
 */
public final class NameValues {

    private final List<NameValue> entries;

    public NameValues() {
        this.entries = new ArrayList<>();
    }

    private NameValues(List<NameValue> entries) {
        this.entries = entries;
    }

    // ── Factory methods ──

    /** Creates a collection holding a single entry. */
    public static NameValues of(String name, String... values) {
        NameValues result = new NameValues();
        result.upsert(name, List.of(values));
        return result;
    }

    /**
     * Creates a collection from an ordered map. Map keys that collide after case
     * folding collapse into one entry; the later key's values win.
     */
    public static NameValues fromMap(Map<String, List<String>> map) {
        NameValues result = new NameValues();
        if (map != null) {
            map.forEach(result::upsert);
        }
        return result;
    }

    // ── Lookup ──

    /**
     * All values for a name (case-insensitive).
     *
     * @return an unmodifiable list, empty if the name is absent
     */
    public List<String> all(String name) {
        int index = indexOf(name);
        return index >= 0 ? entries.get(index).values() : List.of();
    }

    /**
     * First value for a name (case-insensitive).
     *
     * @return the first value, or {@code null} if absent or valueless
     */
    public String first(String name) {
        List<String> values = all(name);
        return values.isEmpty() ? null : values.get(0);
    }

    /** True if an entry with this name exists (case-insensitive). */
    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    // ── Mutation ──

    /**
     * Replaces the values of the entry named {@code name} (case-insensitive), or
     * appends a new entry when none exists. The position and spelling of an
     * existing entry are kept.
     */
    public void upsert(String name, List<String> values) {
        int index = indexOf(name);
        if (index >= 0) {
            NameValue existing = entries.get(index);
            entries.set(index, new NameValue(existing.name(), values));
        } else {
            entries.add(new NameValue(name, values));
        }
    }

    /** Single-value shorthand for {@link #upsert(String, List)}. */
    public void upsert(String name, String value) {
        upsert(name, List.of(value));
    }

    /**
     * Removes the entry named {@code name} (case-insensitive).
     *
     * @return {@code true} if an entry was removed
     */
    public boolean delete(String name) {
        int index = indexOf(name);
        if (index < 0) {
            return false;
        }
        entries.remove(index);
        return true;
    }

    /**
     * Treats the values of {@code name} as one comma-separated token set and adds
     * {@code token} unless an equal token (case-insensitive) is already present.
     * The entry is always written back as a single {@code ", "}-joined value, so
     * {@code Vary: Origin} plus {@code Accept-Encoding} yields
     * {@code Vary: Origin, Accept-Encoding}.
     */
    public void mergeToken(String name, String token) {
        List<String> tokens = new ArrayList<>();
        for (String value : all(name)) {
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty() && !containsIgnoreCase(tokens, trimmed)) {
                    tokens.add(trimmed);
                }
            }
        }
        if (!containsIgnoreCase(tokens, token)) {
            tokens.add(token);
        }
        upsert(name, List.of(String.join(", ", tokens)));
    }

    // ── Views ──

    /** Unmodifiable, ordered view of the entries. */
    public List<NameValue> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Ordered name → values view. Keys keep their original spelling. */
    public Map<String, List<String>> toMultiValueMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.name(), entry.values()));
        return Collections.unmodifiableMap(result);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Returns an independent copy; the two collections share no mutable state. */
    public NameValues copy() {
        return new NameValues(new ArrayList<>(entries));
    }

    /** Replaces every entry with the entries of {@code source}, in order. */
    public void replaceWith(NameValues source) {
        if (source == this) {
            return;
        }
        entries.clear();
        entries.addAll(source.entries);
    }

    // ── Internals ──

    private int indexOf(String name) {
        if (name == null) {
            return -1;
        }
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).hasName(name)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean containsIgnoreCase(List<String> tokens, String needle) {
        for (String token : tokens) {
            if (token.equalsIgnoreCase(needle)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameValues that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "NameValues" + entries;
    }
}

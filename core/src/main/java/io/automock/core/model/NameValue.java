package io.automock.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One named entry of a {@link NameValues} collection: a header, a query
 * parameter or a form parameter of a {@code PARAMETERS} body matcher.
 *
 * <p>
 * Immutable. The values list is copied on construction and never exposed
 * mutably.
 *
 * @param name   entry name as supplied by the operator (case preserved)
 * @param values one or more values, in insertion order
 */
public record NameValue(String name, List<String> values) {

    /** Canonical constructor with defensive copy. */
    public NameValue {
        Objects.requireNonNull(name, "name must not be null");
        values = values != null ? List.copyOf(values) : List.of();
    }

    /** Convenience factory for literal values. */
    public static NameValue of(String name, String... values) {
        return new NameValue(name, List.of(values));
    }

    /** True if this entry's name equals {@code other}, ignoring case. */
    public boolean hasName(String other) {
        return other != null && name.equalsIgnoreCase(other);
    }
}

package io.automock.core.model;

/**
 * Strictness of a JSON body match.
 *
 * <ul>
 * <li>{@link #STRICT}: every field of the incoming body must match, extra
 * fields fail the match.
 * <li>{@link #ONLY_MATCHING_FIELDS}: fields not named in the expectation are
 * ignored ("subset" match).
 * </ul>
 */
public enum MatchType {
    STRICT,
    ONLY_MATCHING_FIELDS
}

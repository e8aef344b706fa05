package io.automock.core.error;

/** Thrown when a body matcher cannot be built because required parts are missing. */
public final class MatcherConstructionException extends ExpectationException {

    private static final long serialVersionUID = 1L;

    public MatcherConstructionException(String message, String context) {
        super(message, context, Kind.CONSTRUCTION);
    }
}

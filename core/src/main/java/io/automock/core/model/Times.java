package io.automock.core.model;

/**
 * Match-count policy of an expectation: unlimited, or a positive number of
 * remaining matches. Immutable.
 *
 * @param isUnlimited    {@code true} for no limit
 * @param remainingTimes remaining matches; {@code 0} when unlimited
 */
public record Times(boolean isUnlimited, int remainingTimes) {

    private static final Times UNLIMITED = new Times(true, 0);

    public Times {
        if (isUnlimited && remainingTimes != 0) {
            throw new IllegalArgumentException("Unlimited times must not carry a remaining count");
        }
        if (!isUnlimited && remainingTimes <= 0) {
            throw new IllegalArgumentException("Remaining times must be positive, got: " + remainingTimes);
        }
    }

    public static Times unlimited() {
        return UNLIMITED;
    }

    public static Times exactly(int remainingTimes) {
        return new Times(false, remainingTimes);
    }
}

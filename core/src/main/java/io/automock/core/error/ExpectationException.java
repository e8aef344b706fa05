package io.automock.core.error;

/**
 * Abstract base for all expectation-engine exceptions. Never thrown directly;
 * use the concrete subclasses under {@link ExpectationValidationException},
 * {@link MatcherConstructionException} or
 * {@link ExpectationTransformException}.
 *
 * <p>
 * No exception of this hierarchy is fatal. Every operation that throws one
 * leaves the expectation it was working on in its last-known-good state.
 */
public abstract class ExpectationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Category of the failure, which decides how a caller recovers. */
    public enum Kind {
        /** Malformed operator input; re-prompt or revert to a snapshot. */
        VALIDATION,
        /** A required part is missing; retry the construction. */
        CONSTRUCTION,
        /** A transform or serialization failed; the input is untouched. */
        TRANSFORM
    }

    private final String context;
    private final Kind kind;

    protected ExpectationException(String message, String context, Kind kind) {
        super(message);
        this.context = context;
        this.kind = kind;
    }

    protected ExpectationException(String message, Throwable cause, String context, Kind kind) {
        super(message, cause);
        this.context = context;
        this.kind = kind;
    }

    /** Where the failing input was used, e.g. "request body", or {@code null}. */
    public String context() {
        return context;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Kind kind() {
        return kind;
    }
}

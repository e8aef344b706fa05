package io.automock.core.error;

/** Abstract parent for malformed operator input: JSON, regex patterns, counts and bounds. */
public abstract class ExpectationValidationException extends ExpectationException {

    private static final long serialVersionUID = 1L;

    protected ExpectationValidationException(String message, String context) {
        super(message, context, Kind.VALIDATION);
    }

    protected ExpectationValidationException(String message, Throwable cause, String context) {
        super(message, cause, context, Kind.VALIDATION);
    }
}

package io.automock.core.error;

/** Thrown when a regular expression does not compile. */
public final class RegexValidationException extends ExpectationValidationException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    public RegexValidationException(String pattern, String context, Throwable cause) {
        super(
                "invalid regex pattern '" + pattern + "' for " + context
                        + (cause != null ? ": " + cause.getMessage() : ""),
                cause,
                context);
        this.pattern = pattern;
    }

    /** The pattern that failed to compile. */
    public String pattern() {
        return pattern;
    }
}

package io.automock.core.error;

/**
 * Thrown for out-of-range scalar input: non-positive counts, negative delays,
 * inconsistent progressive bounds.
 */
public final class InputValidationException extends ExpectationValidationException {

    private static final long serialVersionUID = 1L;

    private final String value;
    private final String expected;

    /**
     * @param inputType what was being set, e.g. "priority" (also used as context)
     * @param value     the rejected value as text
     * @param expected  description of the accepted range
     */
    public InputValidationException(String inputType, String value, String expected) {
        super("invalid " + inputType + " value '" + value + "' (expected: " + expected + ")", inputType);
        this.value = value;
        this.expected = expected;
    }

    /** As above, keeping the parse failure that caused the rejection. */
    public InputValidationException(String inputType, String value, String expected, Throwable cause) {
        super("invalid " + inputType + " value '" + value + "' (expected: " + expected + ")", cause, inputType);
        this.value = value;
        this.expected = expected;
    }

    public String value() {
        return value;
    }

    public String expected() {
        return expected;
    }
}

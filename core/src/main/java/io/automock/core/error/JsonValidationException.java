package io.automock.core.error;

/** Thrown when text supplied as JSON does not parse. */
public final class JsonValidationException extends ExpectationValidationException {

    private static final long serialVersionUID = 1L;

    private static final int MAX_CONTENT = 100;

    private final String content;

    public JsonValidationException(String context, String content, Throwable cause) {
        super(
                "JSON validation failed for " + context + ": " + (cause != null ? cause.getMessage() : "empty input")
                        + "\nContent: " + truncate(content),
                cause,
                context);
        this.content = content;
    }

    /** The rejected text, untruncated. */
    public String content() {
        return content;
    }

    private static String truncate(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > MAX_CONTENT ? content.substring(0, MAX_CONTENT) + "..." : content;
    }
}

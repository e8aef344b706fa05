package io.automock.core.error;

/** Thrown when a response body cannot be compressed: unknown codec, unrenderable body, I/O failure. */
public final class CompressionException extends ExpectationTransformException {

    private static final long serialVersionUID = 1L;

    public CompressionException(String message) {
        super(message, "response compression");
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause, "response compression");
    }
}

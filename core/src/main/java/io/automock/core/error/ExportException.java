package io.automock.core.error;

/** Thrown when expectations cannot be written to or read from the wire format. */
public final class ExportException extends ExpectationTransformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ExportException(String message, String source) {
        super(message, "wire format");
        this.source = source;
    }

    public ExportException(String message, Throwable cause, String source) {
        super(message, cause, "wire format");
        this.source = source;
    }

    /** The file or resource involved, or {@code null} for in-memory text. */
    public String source() {
        return source;
    }
}

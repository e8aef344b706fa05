package io.automock.cli.config;

/**
 * Thrown when the exporter configuration cannot be loaded: missing file,
 * invalid YAML, or a missing or malformed setting. The message is written for
 * startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

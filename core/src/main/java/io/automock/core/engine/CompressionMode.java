package io.automock.core.engine;

import io.automock.core.error.InputValidationException;
import java.util.Locale;

/** How {@link CompressionTransformer} applies an algorithm to a response. */
public enum CompressionMode {

    /** Only advertise the encoding in headers; the body is left untouched. */
    HEADERS_ONLY("headers-only"),

    /** Compress the body ahead of time and store it as a binary payload. */
    PRE_COMPRESS("pre-compress");

    private final String configName;

    CompressionMode(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves a mode by its configuration name ({@code headers-only},
     * {@code pre-compress}), case-insensitively.
     *
     * @throws InputValidationException if the name is unknown
     */
    public static CompressionMode fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (CompressionMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new InputValidationException("compression mode", name, "headers-only or pre-compress");
    }
}

package io.automock.core.export;

import io.automock.core.error.InputValidationException;
import java.util.Locale;

/** Priority convention of the engine that consumes the exported file. */
public enum PriorityOrder {

    /** Lower numbers are evaluated first; priorities are emitted as they are. */
    LOWER_FIRST("lower-first"),

    /** Higher numbers are evaluated first; priorities are mirrored on export. */
    HIGHER_FIRST("higher-first");

    private final String configName;

    PriorityOrder(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves an order by configuration name, case-insensitively.
     *
     * @throws InputValidationException if the name is unknown
     */
    public static PriorityOrder fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (PriorityOrder order : values()) {
            if (order.configName.equals(normalized)) {
                return order;
            }
        }
        throw new InputValidationException("priority order", name, "lower-first or higher-first");
    }
}

package io.automock.core.model;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A response or socket-close delay. Immutable.
 *
 * @param timeUnit unit of {@code value}; serialized by enum name
 *                 ({@code MILLISECONDS})
 * @param value    non-negative magnitude
 */
public record Delay(TimeUnit timeUnit, long value) {

    public Delay {
        Objects.requireNonNull(timeUnit, "timeUnit must not be null");
        if (value < 0) {
            throw new IllegalArgumentException("Delay must not be negative, got: " + value);
        }
    }

    /** Creates a delay in milliseconds. */
    public static Delay millis(long value) {
        return new Delay(TimeUnit.MILLISECONDS, value);
    }

    /** The delay converted to milliseconds. */
    public long toMillis() {
        return timeUnit.toMillis(value);
    }
}

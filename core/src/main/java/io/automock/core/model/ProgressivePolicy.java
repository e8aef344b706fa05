package io.automock.core.model;

/**
 * Escalating response delay: clones are generated with delays
 * {@code base + step, base + 2·step, …} up to and including {@code cap}.
 *
 * <p>
 * The record accepts any values so that drafts can carry an inconsistent
 * policy; {@link #isValid()} decides whether expansion honours it.
 *
 * @param base starting delay in milliseconds
 * @param step increment per hit in milliseconds
 * @param cap  highest delay in milliseconds
 */
public record ProgressivePolicy(int base, int step, int cap) {

    /** {@code step > 0}, {@code base >= 0} and {@code cap >= base}. */
    public boolean isValid() {
        return step > 0 && base >= 0 && cap >= base;
    }

    /** Number of clones expansion produces for this policy, or 0 if invalid. */
    public int stepCount() {
        return isValid() ? (cap - base) / step : 0;
    }

    @Override
    public String toString() {
        return "base=" + base + ", step=" + step + ", cap=" + cap;
    }
}

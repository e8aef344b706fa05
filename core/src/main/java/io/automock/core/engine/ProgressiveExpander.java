package io.automock.core.engine;

import io.automock.core.model.Delay;
import io.automock.core.model.Expectation;
import io.automock.core.model.ProgressivePolicy;
import io.automock.core.model.Times;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands expectations that carry a {@link ProgressivePolicy} into a ramp of
 * clones with escalating response delays.
 *
 * <p>
 * Processing order:
 * <ol>
 * <li>Find the highest priority in the batch (0 if the batch is empty).</li>
 * <li>Give every original, in order, the next priority above that maximum,
 * unless its own priority is already higher.</li>
 * <li>For each original with a valid policy, append clones with delays
 * {@code base + step, base + 2·step, …, ≤ cap}. Each clone gets the next
 * priority, is limited to one match, and the last clone of a ramp is
 * unlimited so steady-state traffic keeps being served at the capped
 * delay.</li>
 * </ol>
 *
 * <p>
 * Lower priorities are evaluated first, so the resulting order is: all
 * originals in their input order, then each original's ramp by ascending
 * delay. Clones carry no policy of their own, so expanding an already
 * expanded batch does not ramp the clones again.
 */
public final class ProgressiveExpander {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressiveExpander.class);

    private ProgressiveExpander() {
        // utility class
    }

    /**
     * Expands a batch. The originals are kept (their priorities may be raised in
     * place) and the clones are appended after them.
     *
     * @param expectations the batch, in evaluation order
     * @return a new list: the originals followed by all generated clones
     */
    public static List<Expectation> expand(List<Expectation> expectations) {
        List<Expectation> result = new ArrayList<>(expectations);

        int maxPriority = 0;
        for (Expectation exp : expectations) {
            maxPriority = Math.max(maxPriority, exp.priority());
        }

        for (Expectation exp : expectations) {
            maxPriority++;
            if (exp.priority() < maxPriority) {
                exp.priority(maxPriority);
            } else {
                maxPriority = exp.priority();
            }
        }

        int added = 0;
        for (Expectation exp : expectations) {
            ProgressivePolicy policy = exp.progressive();
            if (policy == null) {
                continue;
            }
            if (!policy.isValid()) {
                LOG.warn("Skipping invalid progressive policy ({}) on {}", policy, exp);
                continue;
            }
            for (long delay = (long) policy.base() + policy.step(); delay <= policy.cap(); delay += policy.step()) {
                Expectation clone = rampClone(exp, delay, delay + policy.step() <= policy.cap(), ++maxPriority);
                result.add(clone);
                added++;
            }
        }

        LOG.info("Added {} progressive expectations; total: {}", added, result.size());
        return result;
    }

    private static Expectation rampClone(Expectation original, long delay, boolean moreSteps, int priority) {
        Expectation clone = ExpectationCloner.deepClone(original);
        String label = "Progressive delay: " + delay + " ms";
        String description = original.description();
        clone.description(description != null && !description.isEmpty() ? description + " [" + label + "]" : label);
        clone.times(moreSteps ? Times.exactly(1) : Times.unlimited());
        clone.ensureResponse().delay(Delay.millis(delay));
        clone.priority(priority);
        clone.progressive(null);
        LOG.debug("Progressive clone: delay={}ms, priority={}, times={}", delay, priority, clone.times());
        return clone;
    }
}

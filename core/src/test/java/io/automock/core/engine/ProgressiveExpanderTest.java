package io.automock.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.automock.core.model.Expectation;
import io.automock.core.model.ProgressivePolicy;
import io.automock.core.model.Times;
import io.automock.core.testkit.TestExpectations;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ProgressiveExpander}. */
class ProgressiveExpanderTest {

    private static Expectation slowSearch() {
        Expectation exp = TestExpectations.textResponse("/search", "results");
        exp.description("Slow search");
        ResponseFeatures.progressiveDelay(exp, 100, 50, 300);
        return exp;
    }

    @Nested
    @DisplayName("Ramp generation")
    class Ramp {

        @Test
        @DisplayName("{base=100, step=50, cap=300} yields clones at 150, 200, 250 and 300 ms")
        void generatesOneClonePerStep() {
            Expectation original = slowSearch();

            List<Expectation> result = ProgressiveExpander.expand(List.of(original));

            assertThat(result).hasSize(5);
            assertThat(result.get(0)).isSameAs(original);
            assertThat(result.subList(1, 5))
                    .extracting(exp -> exp.response().delay().toMillis())
                    .containsExactly(150L, 200L, 250L, 300L);
        }

        @Test
        @DisplayName("Only the last clone of a ramp is unlimited")
        void lastCloneIsUnlimited() {
            List<Expectation> result = ProgressiveExpander.expand(List.of(slowSearch()));

            assertThat(result.subList(1, 5))
                    .extracting(Expectation::times)
                    .containsExactly(Times.exactly(1), Times.exactly(1), Times.exactly(1), Times.unlimited());
        }

        @Test
        void clonesAreLabelled() {
            List<Expectation> result = ProgressiveExpander.expand(List.of(slowSearch()));

            assertThat(result.get(1).description())
                    .isEqualTo("Slow search [progressive delay: base=100, step=50, cap=300]"
                            + " [Progressive delay: 150 ms]");
        }

        @Test
        void undescribedOriginalGivesBareLabel() {
            Expectation exp = TestExpectations.textResponse("/x", "x");
            exp.progressive(new ProgressivePolicy(0, 10, 10));

            List<Expectation> result = ProgressiveExpander.expand(List.of(exp));
            assertThat(result).hasSize(2);
            assertThat(result.get(1).description()).isEqualTo("Progressive delay: 10 ms");
        }

        @Test
        void clonesCarryNoPolicyAndShareNoState() {
            Expectation original = slowSearch();
            List<Expectation> result = ProgressiveExpander.expand(List.of(original));

            Expectation clone = result.get(1);
            assertThat(clone.progressive()).isNull();
            assertThat(original.progressive()).isNotNull();

            clone.response().headers().upsert("X-Clone", "1");
            assertThat(original.response().headers().contains("X-Clone")).isFalse();
        }

        @Test
        void capEqualToBaseYieldsNoClones() {
            Expectation exp = TestExpectations.textResponse("/x", "x");
            exp.progressive(new ProgressivePolicy(100, 50, 100));

            assertThat(ProgressiveExpander.expand(List.of(exp))).hasSize(1);
        }

        @Test
        void unevenStepStopsBelowCap() {
            Expectation exp = TestExpectations.textResponse("/x", "x");
            exp.progressive(new ProgressivePolicy(100, 70, 300));

            List<Expectation> result = ProgressiveExpander.expand(List.of(exp));
            assertThat(result.subList(1, result.size()))
                    .extracting(e -> e.response().delay().toMillis())
                    .containsExactly(170L, 240L);
            assertThat(result.get(2).times()).isEqualTo(Times.unlimited());
        }

        @Test
        void invalidPolicyIsSkipped() {
            Expectation exp = TestExpectations.textResponse("/x", "x");
            exp.progressive(new ProgressivePolicy(100, 0, 300));

            assertThat(ProgressiveExpander.expand(List.of(exp))).containsExactly(exp);
        }
    }

    @Nested
    @DisplayName("Priorities")
    class Priorities {

        @Test
        @DisplayName("Originals are raised above the batch maximum, clones follow in ramp order")
        void prioritiesAreDistinctAndOrdered() {
            Expectation plain = TestExpectations.textResponse("/plain", "ok");
            plain.priority(7);
            Expectation slow = slowSearch();
            slow.priority(3);

            List<Expectation> result = ProgressiveExpander.expand(List.of(plain, slow));

            assertThat(result).extracting(Expectation::priority).containsExactly(8, 9, 10, 11, 12, 13);
            assertThat(result).extracting(Expectation::priority).doesNotHaveDuplicates();
        }

        @Test
        void emptyBatchStaysEmpty() {
            assertThat(ProgressiveExpander.expand(List.of())).isEmpty();
        }

        @Test
        void inputListIsNotModified() {
            List<Expectation> input = new ArrayList<>(List.of(slowSearch()));
            ProgressiveExpander.expand(input);
            assertThat(input).hasSize(1);
        }
    }
}

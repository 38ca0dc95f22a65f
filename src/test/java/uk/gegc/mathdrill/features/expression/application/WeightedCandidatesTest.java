package uk.gegc.mathdrill.features.expression.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mathdrill.BaseUnitTest;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WeightedCandidates Tests")
class WeightedCandidatesTest extends BaseUnitTest {

    @Test
    @DisplayName("empty intervals and zero weights produce an empty set")
    void emptyCandidates() {
        WeightedCandidates candidates = WeightedCandidates.builder()
                .addRange(5, 4, 1)
                .add(3, 0)
                .build();

        assertThat(candidates.isEmpty()).isTrue();
        assertThat(candidates.totalWeight()).isZero();
        assertThat(WeightedCandidates.uniform(2, 1).isEmpty()).isTrue();
        assertThatThrownBy(() -> candidates.draw(new Random(1L))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("uniform interval draws stay inside the interval and cover it")
    void uniform_drawsWithinBounds() {
        WeightedCandidates candidates = WeightedCandidates.uniform(-3, 3);
        Random random = new Random(42L);
        int[] hits = new int[7];

        for (int i = 0; i < 7_000; i++) {
            int value = candidates.draw(random);
            assertThat(value).isBetween(-3, 3);
            hits[value + 3]++;
        }

        assertThat(candidates.distinctCount()).isEqualTo(7);
        assertThat(candidates.values()).containsExactly(-3, -2, -1, 0, 1, 2, 3);
        for (int count : hits) {
            assertThat(count).isBetween(800, 1200);
        }
    }

    @Test
    @DisplayName("draws follow the per-value weights")
    void weightedDraws_followWeights() {
        WeightedCandidates candidates = WeightedCandidates.builder()
                .add(5, 1)
                .add(7, 3)
                .build();
        Random random = new Random(2024L);
        int sevens = 0;

        for (int i = 0; i < 40_000; i++) {
            if (candidates.draw(random) == 7) {
                sevens++;
            }
        }

        assertThat(candidates.totalWeight()).isEqualTo(4);
        assertThat(candidates.weightOf(7)).isEqualTo(3);
        assertThat(candidates.weightOf(6)).isZero();
        assertThat(sevens).isBetween(29_000, 31_000);
    }

    @Test
    @DisplayName("a single candidate is always drawn")
    void singleCandidate() {
        WeightedCandidates candidates = WeightedCandidates.builder().add(11, 9).build();
        Random random = new Random(3L);

        for (int i = 0; i < 20; i++) {
            assertThat(candidates.draw(random)).isEqualTo(11);
        }
        assertThat(candidates.contains(11)).isTrue();
        assertThat(candidates.contains(10)).isFalse();
    }
}

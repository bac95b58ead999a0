package io.github.riemr.pm.scheduler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadDateSelectorTest {

    private final SpreadDateSelector selector = new SpreadDateSelector();

    private static List<Integer> range(int size) {
        return IntStream.range(0, size).boxed().toList();
    }

    @Test
    void select_single_picksFirstCandidate() {
        assertThat(selector.select(range(60), 1)).containsExactly(0);
    }

    @Test
    void select_all_picksEveryCandidateInOrder() {
        assertThat(selector.select(range(60), 60)).isEqualTo(range(60));
    }

    @Test
    void select_two_spansWholeHorizon() {
        assertThat(selector.select(range(60), 2)).containsExactly(0, 59);
    }

    @Test
    void select_roundsHalfUp() {
        // 1 * 59 / 2 = 29.5 → 30
        assertThat(selector.select(range(60), 3)).containsExactly(0, 30, 59);
        // i * 4 / 3 = 0, 1.33, 2.67, 4
        assertThat(selector.select(range(5), 4)).containsExactly(0, 1, 3, 4);
        // 1 * 5 / 2 = 2.5 → 3（偶数丸めや切り捨てなら 2）
        assertThat(SpreadDateSelector.spreadIndices(6, 3)).containsExactly(0, 3, 5);
    }

    @Test
    void select_moreThanAvailable_isCappedAtCandidateCount() {
        assertThat(selector.select(range(3), 10)).containsExactly(0, 1, 2);
    }

    @Test
    void select_emptyCandidatesOrZeroCount_isEmpty() {
        assertThat(selector.select(List.of(), 5)).isEmpty();
        assertThat(selector.select(range(10), 0)).isEmpty();
    }

    @Test
    void spreadIndices_areStrictlyIncreasing() {
        for (int size = 1; size <= 60; size++) {
            for (int n = 1; n <= size; n++) {
                int[] idx = SpreadDateSelector.spreadIndices(size, n);
                assertThat(idx).hasSize(n);
                assertThat(idx[0]).isZero();
                if (n > 1) {
                    assertThat(idx[n - 1]).isEqualTo(size - 1);
                }
                for (int i = 1; i < n; i++) {
                    assertThat(idx[i]).isGreaterThan(idx[i - 1]);
                }
            }
        }
    }

    @Test
    void spreadIndices_rejectsMoreThanSize() {
        assertThatThrownBy(() -> SpreadDateSelector.spreadIndices(3, 4))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.giftbattle.backend.service.loot;

import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightedSelectorTest {

    private record Prize(String name, double weight) {}

    private final Prize common = new Prize("common", 1);
    private final Prize rare = new Prize("rare", 1);
    private final Prize epic = new Prize("epic", 2);

    @Test
    @DisplayName("the draw point picks the first candidate whose running weight exceeds it")
    void walksCumulativeWeights() {
        WeightedSelector selector = new WeightedSelector(fixed(0.0, 0.24, 0.25, 0.49, 0.5, 0.999));
        List<Prize> pool = List.of(common, rare, epic);

        assertThat(selector.select(pool, Prize::weight)).isEqualTo(common);
        assertThat(selector.select(pool, Prize::weight)).isEqualTo(common);
        assertThat(selector.select(pool, Prize::weight)).isEqualTo(rare);
        assertThat(selector.select(pool, Prize::weight)).isEqualTo(rare);
        assertThat(selector.select(pool, Prize::weight)).isEqualTo(epic);
        assertThat(selector.select(pool, Prize::weight)).isEqualTo(epic);
    }

    @Test
    @DisplayName("empirical frequencies converge to weight / total")
    void frequenciesFollowWeights() {
        WeightedSelector selector = new WeightedSelector(RandomSource.seeded(20240917L));
        List<Prize> pool = List.of(common, rare, epic);
        int draws = 100_000;

        Map<Prize, Integer> counts = new HashMap<>();
        for (int i = 0; i < draws; i++) {
            counts.merge(selector.select(pool, Prize::weight), 1, Integer::sum);
        }

        assertThat(counts.get(epic) / (double) draws).isCloseTo(0.50, within(0.01));
        assertThat(counts.get(common) / (double) draws).isCloseTo(0.25, within(0.01));
        assertThat(counts.get(rare) / (double) draws).isCloseTo(0.25, within(0.01));
    }

    @Test
    @DisplayName("only relative weights matter")
    void scaleOfWeightsIsIrrelevant() {
        List<Prize> tiny = List.of(new Prize("a", 0.01), new Prize("b", 0.03));
        List<Prize> large = List.of(new Prize("a", 10), new Prize("b", 30));
        double[] draws = {0.1, 0.24, 0.26, 0.8};

        WeightedSelector tinySelector = new WeightedSelector(fixed(draws));
        WeightedSelector largeSelector = new WeightedSelector(fixed(draws));
        for (int i = 0; i < draws.length; i++) {
            assertThat(tinySelector.select(tiny, Prize::weight).name())
                    .isEqualTo(largeSelector.select(large, Prize::weight).name());
        }
    }

    @Test
    @DisplayName("a single candidate is always drawn")
    void singleCandidate() {
        WeightedSelector selector = new WeightedSelector(RandomSource.seeded(1L));

        for (int i = 0; i < 100; i++) {
            assertThat(selector.select(List.of(epic), Prize::weight)).isEqualTo(epic);
        }
    }

    @Test
    @DisplayName("a draw just below 1 still returns a candidate")
    void upperEdgeReturnsLastCandidate() {
        WeightedSelector selector = new WeightedSelector(() -> Math.nextDown(1.0));

        assertThat(selector.select(List.of(new Prize("x", 0.1), new Prize("y", 0.2), new Prize("z", 0.3)), Prize::weight).name())
                .isEqualTo("z");
    }

    @Test
    @DisplayName("an empty pool fails with EMPTY_POOL")
    void emptyPoolFails() {
        WeightedSelector selector = new WeightedSelector(RandomSource.seeded(1L));

        assertThatThrownBy(() -> selector.select(List.<Prize>of(), Prize::weight))
                .isInstanceOf(EconomyException.class)
                .extracting(ex -> ((EconomyException) ex).getCode())
                .isEqualTo(EconomyErrorCode.EMPTY_POOL);
        assertThatThrownBy(() -> selector.select(null, Prize::weight))
                .isInstanceOf(EconomyException.class);
    }

    @Test
    @DisplayName("zero, negative and NaN weights are rejected")
    void nonPositiveWeightsAreRejected() {
        WeightedSelector selector = new WeightedSelector(RandomSource.seeded(1L));

        assertThatThrownBy(() -> selector.select(List.of(common, new Prize("zero", 0)), Prize::weight))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(List.of(new Prize("negative", -1)), Prize::weight))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(List.of(new Prize("nan", Double.NaN)), Prize::weight))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("finite weights whose sum overflows are rejected instead of always drawing the last one")
    void overflowingTotalIsRejected() {
        WeightedSelector selector = new WeightedSelector(fixed(0.0));
        List<Prize> pool = List.of(new Prize("huge", Double.MAX_VALUE), new Prize("huger", Double.MAX_VALUE));

        assertThatThrownBy(() -> selector.select(pool, Prize::weight))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflows");
    }

    private static RandomSource fixed(double... values) {
        Deque<Double> queue = new ArrayDeque<>();
        for (double value : values) {
            queue.add(value);
        }
        return () -> queue.isEmpty() ? 0.0 : queue.removeFirst();
    }
}

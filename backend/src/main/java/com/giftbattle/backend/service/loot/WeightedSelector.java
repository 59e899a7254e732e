package com.giftbattle.backend.service.loot;

import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Draws one candidate with probability proportional to its weight.
 * Weights are relative; they do not need to sum to any particular total.
 */
@Component
public class WeightedSelector {

    private final RandomSource randomSource;

    public WeightedSelector(RandomSource randomSource) {
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
    }

    public <T> T select(List<T> candidates, ToDoubleFunction<? super T> weightOf) {
        if (candidates == null || candidates.isEmpty()) {
            throw new EconomyException(EconomyErrorCode.EMPTY_POOL, "Nothing to draw from");
        }
        double total = 0;
        for (T candidate : candidates) {
            double weight = weightOf.applyAsDouble(candidate);
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Weight must be positive and finite, got " + weight);
            }
            total += weight;
        }
        if (Double.isInfinite(total)) {
            throw new IllegalArgumentException("Total weight overflows: " + candidates.size() + " candidates");
        }

        double point = randomSource.nextUnit() * total;
        double running = 0;
        for (T candidate : candidates) {
            running += weightOf.applyAsDouble(candidate);
            if (running > point) {
                return candidate;
            }
        }
        // rounding can leave the running sum a hair under the draw point
        return candidates.get(candidates.size() - 1);
    }
}

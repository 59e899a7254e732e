package com.giftbattle.backend.service.loot;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform draws for {@link WeightedSelector}.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return a uniformly distributed value in {@code [0, 1)}
     */
    double nextUnit();

    static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextDouble;
    }
}

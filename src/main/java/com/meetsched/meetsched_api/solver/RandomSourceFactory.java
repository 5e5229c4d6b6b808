package com.meetsched.meetsched_api.solver;

import java.util.Random;

/**
 * Supplies the random source for one annealing run. A fixed seed makes runs reproducible.
 */
@FunctionalInterface
public interface RandomSourceFactory {

    Random newSource();

    static RandomSourceFactory seeded(long seed) {
        return () -> new Random(seed);
    }

    static RandomSourceFactory unseeded() {
        return Random::new;
    }
}

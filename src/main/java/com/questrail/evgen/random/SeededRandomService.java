package com.questrail.evgen.random;

import java.util.SplittableRandom;

/**
 * Production {@link RandomService} backed by {@link SplittableRandom}.
 *
 * <h2>Thread Safety</h2>
 * <p>{@code SplittableRandom} is not thread-safe, so every draw is serialized
 * on this instance. A fixed seed gives a reproducible draw sequence as long as
 * draws happen in a fixed order.</p>
 */
public final class SeededRandomService implements RandomService
{
    private final long seed;
    private final SplittableRandom random;

    public SeededRandomService(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    public long seed() {
        return seed;
    }

    @Override
    public synchronized int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive (was " + bound + ")");
        }
        return random.nextInt(bound);
    }

    @Override
    public synchronized double nextDouble() {
        return random.nextDouble();
    }
}

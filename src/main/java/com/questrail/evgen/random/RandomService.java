package com.questrail.evgen.random;

/**
 * RandomService
 * =============================================================================
 * Source of random draws for interaction selection.
 *
 * <p>Selection correctness depends only on the contracts below, never on the
 * underlying algorithm. Implementations shared between threads must serialize
 * their draws.</p>
 *
 * <p>For deterministic testing, substitute a scripted implementation.</p>
 */
public interface RandomService
{
    /**
     * Draws an integer uniformly from {@code [0, bound)}.
     *
     * @throws IllegalArgumentException if {@code bound <= 0}
     */
    int nextInt(int bound);

    /**
     * Draws a double uniformly from {@code [0, 1)}.
     */
    double nextDouble();
}

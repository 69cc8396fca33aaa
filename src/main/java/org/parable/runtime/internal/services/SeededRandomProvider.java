package org.parable.runtime.internal.services;

import org.parable.runtime.spi.IRandomProvider;
import org.apache.commons.math3.random.Well19937c;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * The same seed always yields the same sequence, so a message with random case blocks replays
 * identically.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("Bound must be positive, got " + bound);
        }
        return rng.nextInt(bound);
    }

    /**
     * @return the seed this provider was created with
     */
    public long getSeed() {
        return seed;
    }
}

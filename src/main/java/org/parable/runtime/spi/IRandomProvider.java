package org.parable.runtime.spi;

/**
 * Provides deterministic randomness for case dispatch and for hosts.
 * Implementations should be pure with respect to the provided seed.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);
}

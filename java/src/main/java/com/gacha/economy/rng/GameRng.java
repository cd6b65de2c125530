package com.gacha.economy.rng;

import java.security.SecureRandom;
import java.util.List;

/**
 * Seeded random number generator for draws, reward rolls and battle outcomes.
 * Uses the Mulberry32 PRNG so a fixed seed replays the same sequence in tests.
 * Safe to share between threads; each call advances one shared state.
 */
public class GameRng {
    private long state;

    /**
     * Create a new GameRng with the specified seed. Only the lower 32 bits are used.
     */
    public GameRng(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Generate next random number in [0, 1).
     */
    public synchronized double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (next() * bound);
    }

    /**
     * Generate a random integer in range [min, max], both ends included.
     */
    public int nextIntInclusive(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max " + max + " < min " + min);
        }
        return min + nextInt(max - min + 1);
    }

    /**
     * True with the given probability.
     */
    public boolean chance(double probability) {
        return next() < probability;
    }

    /**
     * Uniformly pick one element of a non-empty list.
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public synchronized long getState() {
        return state;
    }
}

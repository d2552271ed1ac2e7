package com.multirpg.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seedable random source for every stochastic game rule.
 * <p>
 * Game logic never calls {@code Math.random()} or a shared {@link Random};
 * it is handed one of these so tests can fix the seed and replay a tick.
 * Not thread-safe on its own; only used under the player table lock.
 */
public class GameRandom {

    private final Random random;
    private final long seed;

    public GameRandom(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /** Uniform in [0, bound). */
    public int nextInt(int bound) { return random.nextInt(bound); }

    /** Uniform in [lo, hi], both inclusive. */
    public int randInt(int lo, int hi) {
        if (hi <= lo) return lo;
        return lo + random.nextInt(hi - lo + 1);
    }

    public double nextDouble() { return random.nextDouble(); }

    /** True with probability {@code p}. */
    public boolean chance(double p) {
        return random.nextDouble() < p;
    }

    /** Uniform pick from a non-empty list. */
    public <T> T pick(List<T> items) {
        return items.get(random.nextInt(items.size()));
    }

    /**
     * Pick {@code count} distinct elements (partial Fisher-Yates).
     * Caller guarantees {@code count <= items.size()}.
     */
    public <T> List<T> sample(List<T> items, int count) {
        List<T> pool = new ArrayList<>(items);
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(pool.size() - i);
            T tmp = pool.get(i);
            pool.set(i, pool.get(j));
            pool.set(j, tmp);
        }
        return new ArrayList<>(pool.subList(0, count));
    }

    public long getSeed() { return seed; }
}

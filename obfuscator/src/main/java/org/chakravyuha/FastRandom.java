package org.chakravyuha;

/**
 * Lightweight non-cryptographic random generator (SplitMix64). Every instance
 * is driven by an explicit seed, so a run can be replayed by passing the same
 * seed again.
 */
public final class FastRandom {

    private static final long GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;
    private long state;

    public FastRandom(long seed) {
        this.seed = seed;
        this.state = seed;
    }

    public static FastRandom fromClock() {
        return new FastRandom(System.nanoTime() ^ GAMMA);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return an independent generator derived from this one's seed and {@code salt}
     */
    public FastRandom fork(long salt) {
        return new FastRandom(mix(seed ^ (salt * GAMMA)));
    }

    private long nextRaw() {
        state += GAMMA;
        return mix(state);
    }

    private static long mix(long x) {
        x ^= x >>> 30;
        x *= 0xBF58476D1CE4E5B9L;
        x ^= x >>> 27;
        x *= 0x94D049BB133111EBL;
        x ^= x >>> 31;
        return x;
    }

    public long nextLong() {
        return nextRaw();
    }

    public int nextInt() {
        return (int) nextRaw();
    }

    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive");
        }
        return (int) Long.remainderUnsigned(nextRaw(), bound);
    }

    /**
     * @return a value in {@code [origin, bound]}, both inclusive
     */
    public int nextIntInclusive(int origin, int bound) {
        if (bound < origin) {
            throw new IllegalArgumentException("bound must not be below origin");
        }
        return origin + nextInt(bound - origin + 1);
    }
}

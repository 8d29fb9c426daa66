package by.radioegor146.cobfuscator;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight non-cryptographic random generator shared by every transform.
 * <p>
 * The state is process-wide, so a pipeline seeds it once with {@link #setSeed(long)} and
 * every unit that runs afterwards draws from the same sequence. Replaying a pipeline with
 * the same seed over the same input therefore yields the same output.
 */
public final class FastRandom {

    private static final long GAMMA = 0x9E3779B97F4A7C15L;
    private static final AtomicLong STATE = new AtomicLong(System.nanoTime() ^ GAMMA);

    private FastRandom() {
    }

    public static void setSeed(long seed) {
        STATE.set(seed ^ GAMMA);
    }

    private static long nextRaw() {
        long x = STATE.getAndAdd(GAMMA);
        x ^= x >>> 30;
        x *= 0xBF58476D1CE4E5B9L;
        x ^= x >>> 27;
        x *= 0x94D049BB133111EBL;
        x ^= x >>> 31;
        return x;
    }

    public static long nextLong() {
        return nextRaw();
    }

    public static int nextInt() {
        return (int) nextRaw();
    }

    public static int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive");
        }
        long r = Long.remainderUnsigned(nextRaw(), bound);
        return (int) r;
    }

    /**
     * Returns a value in {@code [origin, bound)}.
     */
    public static long nextLong(long origin, long bound) {
        if (origin >= bound) {
            throw new IllegalArgumentException("bound must be greater than origin");
        }
        return origin + Long.remainderUnsigned(nextRaw(), bound - origin);
    }

    /**
     * Returns a value in {@code [origin, bound]}, both ends inclusive.
     */
    public static int nextIntInclusive(int origin, int bound) {
        return (int) nextLong(origin, (long) bound + 1);
    }

    public static boolean nextBoolean() {
        return (nextRaw() & 1L) != 0;
    }

    public static double nextDouble() {
        return (nextRaw() >>> 11) * 0x1.0p-53;
    }

    public static <T> T choice(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("cannot choose from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    public static <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            Collections.swap(items, i, nextInt(i + 1));
        }
    }
}

package io.retryloop.interval;

import java.time.Duration;
import java.util.Random;

/** Floating-point helpers for the random range computations of the calculators. */
final class Durations {
    private static final double MAX_NANOS = (double) Long.MAX_VALUE;

    private Durations() {}

    static double nanos(Duration d) {
        return d.getSeconds() * 1_000_000_000.0 + d.getNano();
    }

    /** Converts back to a Duration, clamping negatives and NaN to zero and saturating on overflow. */
    static Duration fromNanos(double nanos) {
        if (Double.isNaN(nanos) || nanos <= 0) return Duration.ZERO;
        if (nanos >= MAX_NANOS) return Duration.ofNanos(Long.MAX_VALUE);
        return Duration.ofNanos((long) nanos);
    }

    /** Uniform value in [lo, hi). */
    static double uniform(Random random, double lo, double hi) {
        return lo + random.nextDouble() * (hi - lo);
    }

    static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}

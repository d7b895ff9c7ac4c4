package io.retryloop.interval;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with full jitter. For the n-th call (n starting at 1) the upper bound is base * 2^n and the
 * wait is drawn uniformly from [bound / 2, bound), capped at max.
 */
public final class ExponentialBackoffInterval implements IntervalCalculator {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(64);

    private final Duration base;
    private final Duration max;
    private final Random random;
    private int attempt; // private to the calculator, independent of the driver's counter

    public ExponentialBackoffInterval(Duration base, Duration max, Random random) {
        this.base = Objects.requireNonNull(base, "base");
        this.max = Objects.requireNonNull(max, "max");
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Duration calc() {
        attempt++;
        double temp = Durations.nanos(base) * Math.pow(2, attempt);
        if (Double.isInfinite(temp)) temp = Double.MAX_VALUE; // keeps hi - lo finite
        Duration candidate = Durations.fromNanos(Durations.uniform(random, temp / 2, temp));
        Duration result = Durations.min(max, candidate);
        return result.isNegative() ? Duration.ZERO : result;
    }

    public Duration base() { return base; }
    public Duration max() { return max; }
    public int attempt() { return attempt; }

    @Override
    public String toString() {
        return "ExponentialBackoffInterval{base=" + base + ", max=" + max + ", attempt=" + attempt + "}";
    }
}

package io.retryloop.interval;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Decorrelated jitter: each wait is drawn uniformly from [base, 3 * previous wait) and capped at max.
 * The previous wait starts out as base.
 */
public final class JitterInterval implements IntervalCalculator {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(15);

    private final Duration base;
    private final Duration max;
    private final Random random;
    private Duration current;

    public JitterInterval(Duration base, Duration max, Random random) {
        this.base = Objects.requireNonNull(base, "base");
        this.max = Objects.requireNonNull(max, "max");
        this.random = Objects.requireNonNull(random, "random");
        this.current = base;
    }

    @Override
    public Duration calc() {
        double lo = Durations.nanos(base);
        double hi = Durations.nanos(current) * 3;
        Duration candidate = Durations.fromNanos(Durations.uniform(random, lo, hi));
        current = Durations.min(max, candidate);
        return current.isNegative() ? Duration.ZERO : current;
    }

    public Duration base() { return base; }
    public Duration max() { return max; }

    @Override
    public String toString() {
        return "JitterInterval{base=" + base + ", max=" + max + ", current=" + current + "}";
    }
}

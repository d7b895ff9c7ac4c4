package io.retryloop.interval;

import java.time.Duration;
import java.util.Objects;

/** Waits the same interval before every retry. */
public final class ConstantInterval implements IntervalCalculator {
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    private final Duration interval;

    public ConstantInterval(Duration interval) {
        Duration d = Objects.requireNonNull(interval, "interval");
        this.interval = d.isNegative() ? Duration.ZERO : d;
    }

    @Override
    public Duration calc() {
        return interval;
    }

    @Override
    public String toString() {
        return "ConstantInterval{interval=" + interval + "}";
    }
}

package io.retryloop.config;

import io.retryloop.interval.ConstantInterval;
import io.retryloop.interval.IntervalCalculator;
import io.retryloop.signal.CancellationSignal;

import java.time.Duration;
import java.util.Random;

/**
 * Constant interval retries. A null or zero interval resolves to {@link ConstantInterval#DEFAULT_INTERVAL}.
 */
public record ConstantOptions(CancellationSignal signal, Duration interval, int maxAttempts) implements RetryOptions {
    /** One second between attempts, stopping after the default timeout. */
    public static final ConstantOptions DEFAULT = new ConstantOptions(null, null, 0);

    public ConstantOptions {
        if (interval == null || interval.isZero()) interval = ConstantInterval.DEFAULT_INTERVAL;
    }

    @Override
    public IntervalCalculator newCalculator(Random random) {
        return new ConstantInterval(interval);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private CancellationSignal signal;
        private Duration interval;
        private int maxAttempts;

        private Builder() {}

        public Builder signal(CancellationSignal s) { this.signal = s; return this; }
        public Builder interval(Duration d) { this.interval = d; return this; }
        public Builder maxAttempts(int n) { this.maxAttempts = n; return this; }

        public ConstantOptions build() { return new ConstantOptions(signal, interval, maxAttempts); }
    }
}

package io.retryloop.config;

import io.retryloop.interval.IntervalCalculator;
import io.retryloop.interval.JitterInterval;
import io.retryloop.signal.CancellationSignal;

import java.time.Duration;
import java.util.Random;

/**
 * Decorrelated jitter retries. Null or zero durations resolve to {@link JitterInterval#DEFAULT_BASE} and
 * {@link JitterInterval#DEFAULT_MAX}.
 */
public record JitterOptions(CancellationSignal signal, Duration base, Duration max, int maxAttempts) implements RetryOptions {
    public static final JitterOptions DEFAULT = new JitterOptions(null, null, null, 0);

    public JitterOptions {
        if (base == null || base.isZero()) base = JitterInterval.DEFAULT_BASE;
        if (max == null || max.isZero()) max = JitterInterval.DEFAULT_MAX;
    }

    @Override
    public IntervalCalculator newCalculator(Random random) {
        return new JitterInterval(base, max, random);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private CancellationSignal signal;
        private Duration base;
        private Duration max;
        private int maxAttempts;

        private Builder() {}

        public Builder signal(CancellationSignal s) { this.signal = s; return this; }
        public Builder base(Duration d) { this.base = d; return this; }
        public Builder max(Duration d) { this.max = d; return this; }
        public Builder maxAttempts(int n) { this.maxAttempts = n; return this; }

        public JitterOptions build() { return new JitterOptions(signal, base, max, maxAttempts); }
    }
}

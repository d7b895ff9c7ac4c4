package io.retryloop.config;

import io.retryloop.interval.ExponentialBackoffInterval;
import io.retryloop.interval.IntervalCalculator;
import io.retryloop.signal.CancellationSignal;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff retries.
 *
 * @param base controls the growth rate: the n-th wait is drawn from [base * 2^n / 2, base * 2^n)
 * @param max  upper bound of a single wait
 */
public record ExponentialBackoffOptions(CancellationSignal signal, Duration base, Duration max, int maxAttempts) implements RetryOptions {
    /** One second base, 64 seconds cap, stopping after the default timeout. */
    public static final ExponentialBackoffOptions DEFAULT = new ExponentialBackoffOptions(null, null, null, 0);

    public ExponentialBackoffOptions {
        if (base == null || base.isZero()) base = ExponentialBackoffInterval.DEFAULT_BASE;
        if (max == null || max.isZero()) max = ExponentialBackoffInterval.DEFAULT_MAX;
    }

    @Override
    public IntervalCalculator newCalculator(Random random) {
        return new ExponentialBackoffInterval(base, max, random);
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

        public ExponentialBackoffOptions build() { return new ExponentialBackoffOptions(signal, base, max, maxAttempts); }
    }
}

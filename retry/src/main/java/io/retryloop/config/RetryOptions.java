package io.retryloop.config;

import io.retryloop.interval.IntervalCalculator;
import io.retryloop.signal.CancellationSignal;

import java.util.Random;

/**
 * Immutable configuration of one backoff strategy. A single instance may back any number of retriers;
 * each retrier gets a fresh calculator from {@link #newCalculator(Random)}.
 */
public interface RetryOptions {
    /** Caller supplied signal, or null to let the retrier create one on its first call. */
    CancellationSignal signal();

    /** 0 means no bound, the deadline governs. */
    int maxAttempts();

    IntervalCalculator newCalculator(Random random);
}

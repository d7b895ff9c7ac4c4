package io.retryloop.core;

import java.time.Duration;

/**
 * Observes a retrier's decisions. Callbacks run on the thread calling {@link Retrier#next()} and must not block.
 */
public interface RetryListener {
    RetryListener NOOP = new RetryListener() {};

    /** A retry is about to start. attempt is 1-based, so the first retry is attempt 2. */
    default void onRetry(int attempt, Duration waited) {}

    /** The retrier stopped after making the given number of attempts. */
    default void onStop(StopReason reason, int attempts) {}
}

package io.retryloop.interval;

import java.time.Duration;

/**
 * IntervalCalculator decides how long a retry loop waits before the next attempt.
 * Implementations may keep state between calls but must never block and never return a negative duration.
 */
public interface IntervalCalculator {
    Duration calc();
}

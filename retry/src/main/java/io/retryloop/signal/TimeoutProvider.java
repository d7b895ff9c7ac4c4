package io.retryloop.signal;

import java.time.Duration;
import java.util.Objects;

/**
 * Supplies the timeout of the deadline a retrier creates for itself when it was given neither a signal nor a
 * max-attempts bound.
 */
@FunctionalInterface
public interface TimeoutProvider {
    Duration DEFAULT_TIMEOUT = Duration.ofMinutes(1);

    Duration defaultTimeout();

    static TimeoutProvider standard() { return () -> DEFAULT_TIMEOUT; }

    static TimeoutProvider fixed(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return () -> timeout;
    }
}

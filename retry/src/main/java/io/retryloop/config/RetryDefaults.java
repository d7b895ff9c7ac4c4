package io.retryloop.config;

import io.retryloop.signal.TimeoutProvider;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Process defaults. The timeout accepts an ISO-8601 duration (PT30S) or plain milliseconds.
 */
public record RetryDefaults(Duration defaultTimeout) implements TimeoutProvider {
    public static final String TIMEOUT_PROPERTY = "retryloop.default.timeout";
    public static final String TIMEOUT_ENV = "RETRYLOOP_DEFAULT_TIMEOUT";

    public RetryDefaults {
        if (defaultTimeout == null || defaultTimeout.isZero()) defaultTimeout = DEFAULT_TIMEOUT;
    }

    public static RetryDefaults standard() { return new RetryDefaults(DEFAULT_TIMEOUT); }

    public static RetryDefaults fromEnv() {
        String timeout = System.getProperty(TIMEOUT_PROPERTY, System.getenv().getOrDefault(TIMEOUT_ENV, ""));
        return new RetryDefaults(parseDuration(timeout));
    }

    static Duration parseDuration(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        try {
            if (s.startsWith("P") || s.startsWith("p")) return Duration.parse(s);
            return Duration.ofMillis(Long.parseLong(s));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("invalid duration for " + TIMEOUT_PROPERTY + ": " + raw, e);
        }
    }
}

package io.retryloop.examples;

import io.retryloop.core.StopReason;

public class RetryExhaustedException extends Exception {
    private final int attempts;
    private final StopReason reason;

    public RetryExhaustedException(String key, int attempts, StopReason reason, Throwable lastFailure) {
        super("giving up on " + key + " after " + attempts + " attempts (" + reason + ")", lastFailure);
        this.attempts = attempts;
        this.reason = reason;
    }

    public int attempts() { return attempts; }
    public StopReason reason() { return reason; }
}

package io.retryloop.core;

public enum StopReason {
    MAX_ATTEMPTS,
    /** deadline passed or cancelled */
    CANCELLED,
    /** the interrupt flag is left set */
    INTERRUPTED
}

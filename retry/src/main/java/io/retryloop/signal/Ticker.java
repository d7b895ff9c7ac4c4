package io.retryloop.signal;

/** Monotonic nanosecond time source, swappable in tests. */
@FunctionalInterface
public interface Ticker {
    long read();

    static Ticker system() { return System::nanoTime; }
}

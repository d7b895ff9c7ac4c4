package io.retryloop.signal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Fired by {@link #cancel()} or by an optional deadline read from the ticker. No timer thread. */
public final class CancellationToken implements CancellationSignal {
    private final CountDownLatch fired = new CountDownLatch(1);
    private final Ticker ticker;
    private final boolean hasDeadline;
    private final long deadlineNanos;

    private CancellationToken(Ticker ticker, boolean hasDeadline, long deadlineNanos) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken create() {
        return new CancellationToken(Ticker.system(), false, 0L);
    }

    public static CancellationToken never() {
        return create();
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Ticker.system());
    }

    public static CancellationToken withTimeout(Duration timeout, Ticker ticker) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(ticker, "ticker");
        return new CancellationToken(ticker, true, ticker.read() + Math.max(0L, toNanos(timeout)));
    }

    public static CancellationToken withDeadline(long deadlineNanos, Ticker ticker) {
        return new CancellationToken(ticker, true, deadlineNanos);
    }

    public void cancel() {
        fired.countDown();
    }

    @Override
    public boolean isCancelled() {
        return fired.getCount() == 0 || remainingNanos() <= 0;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        if (isCancelled()) return true;
        long waitNanos = toNanos(timeout);
        long left = remainingNanos();
        if (hasDeadline && left <= waitNanos) {
            if (fired.await(left, TimeUnit.NANOSECONDS) || isCancelled()) return true;
            // the ticker has not caught up with real time; wait out the rest of the timeout
            return fired.await(waitNanos - left, TimeUnit.NANOSECONDS) || isCancelled();
        }
        if (waitNanos <= 0) return false;
        return fired.await(waitNanos, TimeUnit.NANOSECONDS);
    }

    public boolean hasDeadline() { return hasDeadline; }

    /** {@code Long.MAX_VALUE} without a deadline. */
    public long remainingNanos() {
        if (!hasDeadline) return Long.MAX_VALUE;
        return deadlineNanos - ticker.read();
    }

    private static long toNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException overflow) {
            return d.isNegative() ? 0L : Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + isCancelled() + (hasDeadline ? ", remainingNanos=" + remainingNanos() : "") + "}";
    }
}

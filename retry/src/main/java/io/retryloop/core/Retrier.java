package io.retryloop.core;

import io.retryloop.interval.IntervalCalculator;
import io.retryloop.signal.CancellationSignal;
import io.retryloop.signal.CancellationToken;
import io.retryloop.signal.Ticker;
import io.retryloop.signal.TimeoutProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Retry loop driver, used as {@code while (retrier.next())}. The first call returns true at once, later calls wait
 * for the calculator's interval. Not thread-safe.
 */
public final class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final IntervalCalculator calculator;
    private final int maxAttempts;
    private final TimeoutProvider timeoutProvider;
    private final Ticker ticker;
    private final RetryListener listener;

    private CancellationSignal signal; // created lazily when null
    private int attempts;
    private StopReason stopReason;

    Retrier(CancellationSignal signal,
            int maxAttempts,
            IntervalCalculator calculator,
            TimeoutProvider timeoutProvider,
            Ticker ticker,
            RetryListener listener) {
        this.signal = signal;
        this.maxAttempts = Math.max(0, maxAttempts);
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.timeoutProvider = Objects.requireNonNull(timeoutProvider, "timeoutProvider");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public boolean next() {
        if (signal == null) signal = defaultSignal();
        try {
            if (stopReason != null) return false;
            if (attempts == 0) return true;
            if (maxAttempts > 0 && attempts >= maxAttempts) return stop(StopReason.MAX_ATTEMPTS);
            if (signal.isCancelled()) return stop(StopReason.CANCELLED);

            Duration wait = calculator.calc();
            if (wait.isNegative() || wait.isZero()) {
                wait = Duration.ZERO;
            } else {
                log.debug("retry attempt {} waiting {}", attempts + 1, wait);
                if (signal.await(wait)) return stop(StopReason.CANCELLED);
            }
            listener.onRetry(attempts + 1, wait);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return stop(StopReason.INTERRUPTED);
        } finally {
            attempts++;
        }
    }

    private CancellationSignal defaultSignal() {
        if (maxAttempts > 0) return CancellationToken.never();
        Duration timeout = timeoutProvider.defaultTimeout();
        log.debug("no cancellation signal configured, stopping after {}", timeout);
        return CancellationToken.withTimeout(timeout, ticker);
    }

    private boolean stop(StopReason reason) {
        stopReason = reason;
        log.debug("retry stopped after {} attempts: {}", attempts, reason);
        listener.onStop(reason, attempts);
        return false;
    }

    public int attempts() { return attempts; }

    public int maxAttempts() { return maxAttempts; }

    public Optional<StopReason> stopReason() { return Optional.ofNullable(stopReason); }

    public boolean isStopped() { return stopReason != null; }

    @Override
    public String toString() {
        return "Retrier{calculator=" + calculator + ", maxAttempts=" + maxAttempts + ", attempts=" + attempts
                + ", signal=" + signal + ", stopReason=" + stopReason + "}";
    }
}

package io.retryloop.signal;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenTest {
    @Test
    void deadline_follows_the_ticker() {
        ManualTicker ticker = new ManualTicker(1_000);
        CancellationToken t = CancellationToken.withTimeout(Duration.ofSeconds(10), ticker);
        assertFalse(t.isCancelled());
        ticker.advance(TimeUnit.SECONDS.toNanos(9));
        assertFalse(t.isCancelled());
        assertEquals(TimeUnit.SECONDS.toNanos(1), t.remainingNanos());
        ticker.advance(TimeUnit.SECONDS.toNanos(1));
        assertTrue(t.isCancelled());
    }

    @Test
    void ticker_values_may_be_negative_or_wrap() {
        ManualTicker ticker = new ManualTicker(Long.MAX_VALUE - 5);
        CancellationToken t = CancellationToken.withTimeout(Duration.ofNanos(10), ticker);
        assertFalse(t.isCancelled());
        ticker.advance(10);
        assertTrue(t.isCancelled());
    }

    @Test
    void cancel_fires_and_is_idempotent() throws Exception {
        CancellationToken t = CancellationToken.create();
        assertFalse(t.isCancelled());
        t.cancel();
        t.cancel();
        assertTrue(t.isCancelled());
        assertTrue(t.await(Duration.ofHours(1)));
    }

    @Test
    void await_returns_false_when_timeout_elapses_first() throws Exception {
        CancellationToken t = CancellationToken.never();
        long t0 = System.nanoTime();
        assertFalse(t.await(Duration.ofMillis(20)));
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        assertTrue(ms >= 15, "returned too early: " + ms + "ms");
    }

    @Test
    void await_returns_true_when_deadline_comes_first() throws Exception {
        CancellationToken t = CancellationToken.withTimeout(Duration.ofMillis(20));
        long t0 = System.nanoTime();
        assertTrue(t.await(Duration.ofSeconds(5)));
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        assertTrue(ms < 2_000, "deadline ignored, waited " + ms + "ms");
        assertTrue(t.isCancelled());
    }

    @Test
    void cancel_from_another_thread_wakes_a_waiter() throws Exception {
        CancellationToken t = CancellationToken.create();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return t.await(Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        Thread.sleep(20);
        t.cancel();
        assertTrue(waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void zero_or_negative_await_does_not_block() throws Exception {
        CancellationToken t = CancellationToken.never();
        assertFalse(t.await(Duration.ZERO));
        assertFalse(t.await(Duration.ofMillis(-1)));
    }

    @Test
    void absurd_timeouts_do_not_overflow() {
        CancellationToken forever = CancellationToken.withTimeout(Duration.ofSeconds(Long.MAX_VALUE));
        assertFalse(forever.isCancelled());
        CancellationToken past = CancellationToken.withTimeout(Duration.ofSeconds(Long.MIN_VALUE));
        assertTrue(past.isCancelled());
    }

    @Test
    void token_without_deadline_never_fires_on_its_own() {
        CancellationToken t = CancellationToken.never();
        assertFalse(t.hasDeadline());
        assertEquals(Long.MAX_VALUE, t.remainingNanos());
        assertFalse(t.isCancelled());
    }

    @Test
    void deadline_is_a_point_on_the_ticker() {
        ManualTicker ticker = new ManualTicker(500);
        CancellationToken t = CancellationToken.withDeadline(1_500, ticker);
        assertTrue(t.hasDeadline());
        assertEquals(1_000, t.remainingNanos());
        ticker.advance(999);
        assertFalse(t.isCancelled());
        ticker.advance(1);
        assertTrue(t.isCancelled());
    }

    @Test
    void await_agrees_with_is_cancelled_when_the_ticker_lags() throws Exception {
        ManualTicker ticker = new ManualTicker(0);
        CancellationToken t = CancellationToken.withDeadline(TimeUnit.MILLISECONDS.toNanos(5), ticker);
        long t0 = System.nanoTime();
        assertFalse(t.await(Duration.ofMillis(20)));
        assertFalse(t.isCancelled());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0) >= 15);

        ticker.advance(TimeUnit.MILLISECONDS.toNanos(5));
        assertTrue(t.await(Duration.ofMillis(20)));
        assertTrue(t.isCancelled());
    }
}

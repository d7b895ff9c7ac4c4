package io.retryloop.signal;

import java.time.Duration;

/**
 * CancellationSignal tells a retry loop to stop, either because a deadline passed or because someone cancelled it.
 * Once fired a signal stays fired.
 */
public interface CancellationSignal {
    boolean isCancelled();

    /**
     * Block until the signal fires or the timeout elapses, whichever comes first.
     * @return true if the signal fired, false if the timeout elapsed first
     */
    boolean await(Duration timeout) throws InterruptedException;
}

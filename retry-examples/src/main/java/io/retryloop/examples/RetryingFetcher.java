package io.retryloop.examples;

import io.retryloop.config.RetryOptions;
import io.retryloop.core.Retrier;
import io.retryloop.core.StopReason;
import io.retryloop.module.RetrierFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a fetcher in a retry loop. Every call gets its own retrier built from the same options.
 */
public class RetryingFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    private final Fetcher delegate;
    private final RetrierFactory retriers;
    private final RetryOptions options;

    public RetryingFetcher(Fetcher delegate, RetrierFactory retriers, RetryOptions options) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.retriers = Objects.requireNonNull(retriers, "retriers");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public String fetch(String key) throws RetryExhaustedException, InterruptedException {
        Retrier retrier = retriers.create(options);
        Exception last = null;
        int attempts = 0;
        while (retrier.next()) {
            attempts++;
            try {
                return delegate.fetch(key);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                log.warn("fetch {} failed on attempt {}: {}", key, attempts, e.getMessage());
                last = e;
            }
        }
        StopReason reason = retrier.stopReason().orElse(StopReason.CANCELLED);
        if (reason == StopReason.INTERRUPTED) {
            // clear the flag the retrier restored, the exception carries it now
            Thread.interrupted();
            throw new InterruptedException("interrupted while retrying " + key);
        }
        throw new RetryExhaustedException(key, attempts, reason, last);
    }
}

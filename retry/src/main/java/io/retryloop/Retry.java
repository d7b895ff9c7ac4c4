package io.retryloop;

import io.retryloop.config.ConstantOptions;
import io.retryloop.config.ExponentialBackoffOptions;
import io.retryloop.config.RetryOptions;
import io.retryloop.core.Retrier;
import io.retryloop.core.RetrierBuilder;

/**
 * Entry points for the common cases. Use {@link RetrierBuilder} to inject a timeout provider, random source or
 * listener.
 */
public final class Retry {
    private Retry() {}

    public static Retrier of(RetryOptions options) {
        return new RetrierBuilder().options(options).build();
    }

    public static Retrier constant() { return of(ConstantOptions.DEFAULT); }

    public static Retrier exponentialBackoff() { return of(ExponentialBackoffOptions.DEFAULT); }

    public static RetrierBuilder builder() { return new RetrierBuilder(); }
}

package io.retryloop.module;

import io.retryloop.config.RetryOptions;
import io.retryloop.core.Retrier;
import io.retryloop.core.RetrierBuilder;
import io.retryloop.core.RetryListener;
import io.retryloop.signal.TimeoutProvider;

import java.util.Objects;

/** Creates retriers that share the injected timeout provider and listener. */
public class RetrierFactory {
    private final TimeoutProvider timeoutProvider;
    private final RetryListener listener;

    public RetrierFactory(TimeoutProvider timeoutProvider, RetryListener listener) {
        this.timeoutProvider = Objects.requireNonNull(timeoutProvider, "timeoutProvider");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public Retrier create(RetryOptions options) {
        return new RetrierBuilder()
                .options(options)
                .timeoutProvider(timeoutProvider)
                .listener(listener)
                .build();
    }
}

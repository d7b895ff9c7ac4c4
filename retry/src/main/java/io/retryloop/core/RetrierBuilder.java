package io.retryloop.core;

import io.retryloop.config.ConstantOptions;
import io.retryloop.config.RetryDefaults;
import io.retryloop.config.RetryOptions;
import io.retryloop.signal.Ticker;
import io.retryloop.signal.TimeoutProvider;

import java.util.Objects;
import java.util.Random;

public class RetrierBuilder {
    private RetryOptions options = ConstantOptions.DEFAULT;
    private TimeoutProvider timeoutProvider; // RetryDefaults.fromEnv() when null
    private Ticker ticker = Ticker.system();
    private RetryListener listener = RetryListener.NOOP;
    private Random random; // fresh unseeded Random per retrier when null

    public RetrierBuilder options(RetryOptions o) { this.options = o; return this; }
    public RetrierBuilder timeoutProvider(TimeoutProvider t) { this.timeoutProvider = t; return this; }
    public RetrierBuilder ticker(Ticker t) { this.ticker = t; return this; }
    public RetrierBuilder listener(RetryListener l) { this.listener = l; return this; }
    public RetrierBuilder random(Random r) { this.random = r; return this; }

    public Retrier build() {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(listener, "listener");
        Random r = random != null ? random : new Random();
        TimeoutProvider timeout = timeoutProvider != null ? timeoutProvider : RetryDefaults.fromEnv();
        return new Retrier(options.signal(), options.maxAttempts(), options.newCalculator(r), timeout, ticker, listener);
    }
}

package io.retryloop.examples;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.retryloop.config.RetryDefaults;
import io.retryloop.config.RetryOptions;
import io.retryloop.module.RetrierFactory;
import io.retryloop.module.RetryModule;

import java.util.Objects;

/**
 * Wires a {@link RetryingFetcher} around the given fetcher, on top of {@link RetryModule}.
 */
public class ExamplesModule extends AbstractModule {
    private final RetryDefaults defaults;
    private final RetryOptions options;
    private final Fetcher fetcher;

    public ExamplesModule(RetryDefaults defaults, RetryOptions options, Fetcher fetcher) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.options = Objects.requireNonNull(options, "options");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    @Override
    protected void configure() {
        install(new RetryModule(defaults));
        bind(RetryOptions.class).toInstance(options);
    }

    @Provides @Singleton RetryingFetcher retryingFetcher(RetrierFactory retriers, RetryOptions options) {
        return new RetryingFetcher(fetcher, retriers, options);
    }
}

package io.retryloop.module;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.retryloop.config.RetryDefaults;
import io.retryloop.core.RetryListener;
import io.retryloop.metrics.Metrics;
import io.retryloop.metrics.MetricsRetryListener;
import io.retryloop.signal.TimeoutProvider;

public class RetryModule extends AbstractModule {
    private final RetryDefaults defaults;

    public RetryModule(RetryDefaults defaults) { this.defaults = defaults; }

    @Override
    protected void configure() {
        bind(RetryDefaults.class).toInstance(defaults);
        bind(TimeoutProvider.class).toInstance(defaults);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton RetryListener retryListener(Metrics metrics) { return new MetricsRetryListener(metrics); }

    @Provides @Singleton RetrierFactory retrierFactory(TimeoutProvider timeoutProvider, RetryListener listener) {
        return new RetrierFactory(timeoutProvider, listener);
    }
}

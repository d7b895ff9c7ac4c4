package io.retryloop.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;

public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) { this(registry, "retry"); }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(MetricRegistry.name(prefix, name)); }
    public Meter meter(String name) { return registry.meter(MetricRegistry.name(prefix, name)); }
    public Histogram histogram(String name) { return registry.histogram(MetricRegistry.name(prefix, name)); }
}

package io.retryloop.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import io.retryloop.core.RetryListener;
import io.retryloop.core.StopReason;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Records retries and stops into a Dropwizard registry:
 * {@code retry.retries} (meter), {@code retry.wait.millis} (histogram), {@code retry.attempts} (histogram of
 * attempts per finished loop) and one {@code retry.stop.<reason>} counter per {@link StopReason}.
 */
public class MetricsRetryListener implements RetryListener {
    private final Meter retries;
    private final Histogram waitMillis;
    private final Histogram attemptsPerLoop;
    private final Map<StopReason, Counter> stops = new EnumMap<>(StopReason.class);

    public MetricsRetryListener(Metrics metrics) {
        this.retries = metrics.meter("retries");
        this.waitMillis = metrics.histogram("wait.millis");
        this.attemptsPerLoop = metrics.histogram("attempts");
        for (StopReason r : StopReason.values()) {
            stops.put(r, metrics.counter("stop." + r.name().toLowerCase(java.util.Locale.ROOT)));
        }
    }

    @Override
    public void onRetry(int attempt, Duration waited) {
        retries.mark();
        waitMillis.update(waited.toMillis());
    }

    @Override
    public void onStop(StopReason reason, int attempts) {
        stops.get(reason).inc();
        attemptsPerLoop.update(attempts);
    }
}

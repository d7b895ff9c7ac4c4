package io.retryloop.config;

import io.retryloop.interval.ConstantInterval;
import io.retryloop.interval.ExponentialBackoffInterval;
import io.retryloop.interval.IntervalCalculator;
import io.retryloop.interval.JitterInterval;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class RetryOptionsTest {
    @Test
    void unset_fields_resolve_to_defaults_at_construction() {
        assertEquals(Duration.ofSeconds(1), ConstantOptions.DEFAULT.interval());
        assertNull(ConstantOptions.DEFAULT.signal());
        assertEquals(0, ConstantOptions.DEFAULT.maxAttempts());

        assertEquals(Duration.ofSeconds(1), JitterOptions.DEFAULT.base());
        assertEquals(Duration.ofSeconds(15), JitterOptions.DEFAULT.max());

        assertEquals(Duration.ofSeconds(1), ExponentialBackoffOptions.DEFAULT.base());
        assertEquals(Duration.ofSeconds(64), ExponentialBackoffOptions.DEFAULT.max());
    }

    @Test
    void zero_durations_count_as_unset() {
        ExponentialBackoffOptions o = ExponentialBackoffOptions.builder().base(Duration.ZERO).max(Duration.ZERO).maxAttempts(3).build();
        assertEquals(ExponentialBackoffInterval.DEFAULT_BASE, o.base());
        assertEquals(ExponentialBackoffInterval.DEFAULT_MAX, o.max());
        assertEquals(3, o.maxAttempts());
    }

    @Test
    void explicit_values_are_kept() {
        JitterOptions o = JitterOptions.builder().base(Duration.ofMillis(5)).max(Duration.ofMillis(50)).build();
        assertEquals(Duration.ofMillis(5), o.base());
        assertEquals(Duration.ofMillis(50), o.max());
        assertEquals(Duration.ofMillis(7), ConstantOptions.builder().interval(Duration.ofMillis(7)).build().interval());
    }

    @Test
    void each_options_type_builds_its_own_calculator() {
        assertInstanceOf(ConstantInterval.class, ConstantOptions.DEFAULT.newCalculator(new Random()));
        assertInstanceOf(JitterInterval.class, JitterOptions.DEFAULT.newCalculator(new Random()));
        assertInstanceOf(ExponentialBackoffInterval.class, ExponentialBackoffOptions.DEFAULT.newCalculator(new Random()));
    }

    @Test
    void calculators_do_not_share_state() {
        IntervalCalculator a = ExponentialBackoffOptions.DEFAULT.newCalculator(new Random());
        a.calc();
        a.calc();
        ExponentialBackoffInterval b = (ExponentialBackoffInterval) ExponentialBackoffOptions.DEFAULT.newCalculator(new Random());
        assertEquals(0, b.attempt());
    }
}

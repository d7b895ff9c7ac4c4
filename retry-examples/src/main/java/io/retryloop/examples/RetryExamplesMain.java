package io.retryloop.examples;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.retryloop.config.ConstantOptions;
import io.retryloop.config.ExponentialBackoffOptions;
import io.retryloop.config.JitterOptions;
import io.retryloop.config.RetryDefaults;
import io.retryloop.config.RetryOptions;
import picocli.CommandLine;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs a flaky fetch through a retry loop and prints how it went.
 */
@CommandLine.Command(name = "retry-examples", mixinStandardHelpOptions = true, description = "Retry a flaky fetch with a chosen backoff strategy")
public final class RetryExamplesMain implements Callable<Integer> {
    enum Strategy { CONSTANT, JITTER, EXPONENTIAL }

    @CommandLine.Option(names = {"-s", "--strategy"}, description = "CONSTANT, JITTER or EXPONENTIAL", defaultValue = "EXPONENTIAL")
    Strategy strategy;

    @CommandLine.Option(names = {"-f", "--failures"}, description = "Failures before the fetch succeeds", defaultValue = "3")
    int failures;

    @CommandLine.Option(names = {"-b", "--base-millis"}, description = "Interval (constant) or base (jitter, exponential) in ms", defaultValue = "100")
    long baseMillis;

    @CommandLine.Option(names = {"-m", "--max-millis"}, description = "Cap of a single wait in ms", defaultValue = "10000")
    long maxMillis;

    @CommandLine.Option(names = {"-n", "--max-attempts"}, description = "Attempt bound, 0 for none", defaultValue = "10")
    int maxAttempts;

    @CommandLine.Option(names = {"-k", "--key"}, description = "Key to fetch", defaultValue = "demo")
    String key;

    public static void main(String[] args) {
        int code = new CommandLine(new RetryExamplesMain()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        RetryOptions options = options();
        FlakyFetcher flaky = new FlakyFetcher(failures);
        Injector injector = Guice.createInjector(new ExamplesModule(RetryDefaults.fromEnv(), options, flaky));
        RetryingFetcher fetcher = injector.getInstance(RetryingFetcher.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        long t0 = System.nanoTime();
        int code = 0;
        try {
            String value = fetcher.fetch(key);
            System.out.printf("fetched %s after %d calls%n", value, flaky.calls());
        } catch (RetryExhaustedException e) {
            System.err.println(e.getMessage());
            code = 1;
        }
        long ms = Duration.ofNanos(System.nanoTime() - t0).toMillis();
        System.out.printf("{\"strategy\":\"%s\",\"elapsedMs\":%d,\"retries\":%d}%n",
                strategy, ms, registry.meter("retry.retries").getCount());
        return code;
    }

    RetryOptions options() {
        Duration base = Duration.ofMillis(baseMillis);
        Duration max = Duration.ofMillis(maxMillis);
        return switch (strategy) {
            case CONSTANT -> ConstantOptions.builder().interval(base).maxAttempts(maxAttempts).build();
            case JITTER -> JitterOptions.builder().base(base).max(max).maxAttempts(maxAttempts).build();
            case EXPONENTIAL -> ExponentialBackoffOptions.builder().base(base).max(max).maxAttempts(maxAttempts).build();
        };
    }
}

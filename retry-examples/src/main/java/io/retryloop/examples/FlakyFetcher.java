package io.retryloop.examples;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/** Fails the first {@code failures} calls with an IOException, then answers. */
final class FlakyFetcher implements Fetcher {
    private final int failures;
    private final AtomicInteger calls = new AtomicInteger();

    FlakyFetcher(int failures) { this.failures = Math.max(0, failures); }

    @Override
    public String fetch(String key) throws IOException {
        int n = calls.incrementAndGet();
        if (n <= failures) throw new IOException("transient failure " + n + " for " + key);
        return key + ":ok";
    }

    int calls() { return calls.get(); }
}

package io.retryloop.examples;

public interface Fetcher {
    String fetch(String key) throws Exception;
}

package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Grants at most {@code maxRetries} retries; the delegate is never consulted once the cap
 * is reached.
 */
final class MaxAttemptsPolicy implements RetryPolicy {

    private final int maxRetries;
    private final RetryPolicy delegate;
    private int retries;

    MaxAttemptsPolicy(int maxRetries, RetryPolicy delegate) {
        this.maxRetries = maxRetries;
        this.delegate = delegate;
    }

    @Override
    public Verdict retry(HttpResponse<?> response, IOException error) {
        if (retries >= maxRetries) {
            return Verdict.Stop.exhausted("max retries (" + maxRetries + ") reached");
        }
        retries++;
        return delegate.retry(response, error);
    }

    @Override
    public void close() {
        delegate.close();
    }
}

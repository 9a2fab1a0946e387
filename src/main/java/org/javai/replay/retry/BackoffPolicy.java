package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Paces the delegate's retries with a per-request backoff ticker.
 */
final class BackoffPolicy implements RetryPolicy {

    private final BackoffTicker ticker;
    private final RetryPolicy delegate;

    BackoffPolicy(BackoffTicker ticker, RetryPolicy delegate) {
        this.ticker = ticker;
        this.delegate = delegate;
    }

    @Override
    public Verdict retry(HttpResponse<?> response, IOException error) {
        Verdict verdict = delegate.retry(response, error);
        if (verdict instanceof Verdict.Retry retry) {
            return retry.atLeast(ticker.next());
        }
        return verdict;
    }

    @Override
    public void close() {
        try {
            ticker.close();
        } finally {
            delegate.close();
        }
    }
}

package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Decides, after each attempt of one request, whether to retry.
 *
 * <p>A policy belongs to a single request: it is created by a {@link RetryPolicyFactory}
 * when the request starts and closed when the retry loop finishes, on every exit path.
 * Implementations may therefore keep mutable per-request state without synchronization.
 */
public interface RetryPolicy extends AutoCloseable {

    /**
     * Judges the outcome of the attempt that just completed.
     *
     * @param response the response, or null if the attempt failed
     * @param error the transport error, or null if a response arrived
     * @return the verdict; never null
     */
    Verdict retry(HttpResponse<?> response, IOException error);

    /**
     * Releases resources held by this policy. Safe to call more than once.
     */
    @Override
    default void close() {
    }
}

package org.javai.replay;

import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * Thrown when a bounding policy stopped retrying and the loop is configured to surface
 * exhaustion as an error rather than pass the last outcome through.
 *
 * <p>The last attempt's transport error, if any, is the cause. The last response, if any,
 * is kept so the caller can still read it.
 */
public class RetriesExhaustedException extends RetryException {

    private final int attempts;
    private final transient HttpResponse<?> lastResponse;

    public RetriesExhaustedException(int attempts, String reason, HttpResponse<?> lastResponse, Throwable lastError) {
        super(message(attempts, reason), lastError);
        this.attempts = attempts;
        this.lastResponse = lastResponse;
    }

    public int attempts() {
        return attempts;
    }

    public Optional<HttpResponse<?>> lastResponse() {
        return Optional.ofNullable(lastResponse);
    }

    private static String message(int attempts, String reason) {
        String base = "retries exhausted after " + attempts + " attempt(s)";
        return reason != null ? base + ": " + reason : base;
    }
}

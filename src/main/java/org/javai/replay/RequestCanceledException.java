package org.javai.replay;

/**
 * Thrown when a request's {@link Cancellation} fires before the retry loop completes.
 * Always terminal: a canceled request is never retried.
 */
public class RequestCanceledException extends RetryException {

    private final int attempts;

    public RequestCanceledException(int attempts) {
        this("request canceled while retrying after " + attempts + " attempt(s)", attempts);
    }

    public RequestCanceledException(String message, int attempts) {
        this(message, attempts, null);
    }

    public RequestCanceledException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * The number of attempts issued before cancellation was observed.
     * Zero when the request was canceled before it reached the transport.
     */
    public int attempts() {
        return attempts;
    }
}

package org.javai.replay.ops;

import org.javai.replay.PolicyException;
import org.javai.replay.retry.Attempt;

import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Observes the retry loop for operators.
 * Implementations might emit metrics, structured logs, or alerts.
 */
public interface OpReporter {

    /**
     * Reports that an attempt failed and will be retried.
     *
     * @param request The original request
     * @param attempt The attempt that is being retried
     * @param delay The pacing delay before the next attempt
     */
    void reportRetryAttempt(HttpRequest request, Attempt attempt, Duration delay);

    /**
     * Reports that a bounding policy stopped further retries.
     *
     * @param request The original request
     * @param attempt The final attempt
     * @param reason Why the policy stopped (may be null)
     */
    default void reportRetryExhausted(HttpRequest request, Attempt attempt, String reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the request was canceled.
     *
     * @param request The original request
     * @param attempts The number of attempts issued before cancellation
     */
    default void reportCanceled(HttpRequest request, int attempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a policy aborted the loop with an error.
     *
     * @param request The original request
     * @param attempt The attempt whose outcome the policy refused
     * @param error The policy's error
     */
    default void reportPolicyError(HttpRequest request, Attempt attempt, PolicyException error) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return (request, attempt, delay) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}

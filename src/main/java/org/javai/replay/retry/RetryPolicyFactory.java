package org.javai.replay.retry;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Objects;

/**
 * Creates a fresh {@link RetryPolicy} for each request, so that concurrent requests never
 * share mutable retry state.
 *
 * <p>The static methods build the standard policies and combine them:</p>
 * <pre>{@code
 * RetryPolicyFactory factory = RetryPolicyFactory.backoff(
 *     Backoff.defaults(),
 *     RetryPolicyFactory.max(5, RetryPolicyFactory.all(
 *         RetryPolicyFactory.temporaryErrors(ErrorClassifier.network()),
 *         RetryPolicyFactory.statusCodes(503)
 *     )));
 * }</pre>
 */
@FunctionalInterface
public interface RetryPolicyFactory {

    /**
     * Creates the policy for one request. Must be safe to call concurrently.
     *
     * @param request the request about to be sent
     * @return a new policy owned by that request
     */
    RetryPolicy create(HttpRequest request);

    /**
     * A policy that retries every outcome. Only useful under a bounding policy.
     */
    static RetryPolicyFactory always() {
        return request -> (response, error) -> Verdict.retry();
    }

    /**
     * A policy that never retries.
     */
    static RetryPolicyFactory never() {
        return request -> (response, error) -> Verdict.stop();
    }

    /**
     * Retries only if every policy agrees to retry. Policies are consulted in the order given;
     * the first that stops or aborts decides, and later policies are not consulted.
     *
     * @param factories the factories of the policies to combine
     * @return a factory combining the given policies with logical AND
     */
    static RetryPolicyFactory all(RetryPolicyFactory... factories) {
        Objects.requireNonNull(factories, "factories must not be null");
        List<RetryPolicyFactory> children = List.of(factories);
        return request -> AllPolicy.create(children, request);
    }

    /**
     * Caps the number of retries. Once {@code maxRetries} retries were granted, the
     * delegate is no longer consulted and the policy stops, marking the retries exhausted.
     *
     * @param maxRetries the number of retries allowed (0 means the first outcome is final)
     * @param factory the delegate policy factory
     * @return a factory for bounded policies
     * @throws IllegalArgumentException if maxRetries is negative
     */
    static RetryPolicyFactory max(int maxRetries, RetryPolicyFactory factory) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        Objects.requireNonNull(factory, "factory must not be null");
        return request -> new MaxAttemptsPolicy(maxRetries, factory.create(request));
    }

    /**
     * Retries errors that classify themselves as temporary through
     * {@link org.javai.replay.Temporary}.
     */
    static RetryPolicyFactory temporaryErrors() {
        return temporaryErrors(ErrorClassifier.capability());
    }

    /**
     * Retries errors the given classifier considers temporary.
     */
    static RetryPolicyFactory temporaryErrors(ErrorClassifier classifier) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        TemporaryErrorPolicy policy = new TemporaryErrorPolicy(classifier);
        return request -> policy;
    }

    /**
     * Retries responses with one of the given status codes.
     */
    static RetryPolicyFactory statusCodes(int... codes) {
        Objects.requireNonNull(codes, "codes must not be null");
        StatusCodePolicy policy = new StatusCodePolicy(codes);
        return request -> policy;
    }

    /**
     * Always retries, pacing each retry with the given backoff.
     */
    static RetryPolicyFactory backoff(Backoff backoff) {
        return backoff(backoff, always());
    }

    /**
     * Retries when the delegate does, waiting at least the next backoff delay.
     */
    static RetryPolicyFactory backoff(Backoff backoff, RetryPolicyFactory factory) {
        Objects.requireNonNull(backoff, "backoff must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        return request -> new BackoffPolicy(backoff.newTicker(), factory.create(request));
    }
}

package org.javai.replay.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.replay.Cancellation;
import org.javai.replay.RequestCanceledException;
import org.javai.replay.RetriesExhaustedException;
import org.javai.replay.RoundTrip;
import org.javai.replay.ops.OpReporter;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import static org.javai.replay.ops.OpReporterUtils.describeOutcome;

/**
 * Wraps a {@link RoundTrip} with retry logic driven by a {@link RetryPolicyFactory}.
 *
 * <p>For each request the retrier buffers the body, creates a policy, and then loops: send an
 * attempt with a fresh copy of the body, hand the outcome to the policy, and either return,
 * throw, or wait out the verdict's delay and send again. The policy is closed exactly once
 * whichever way the loop ends.
 *
 * <p>When a policy stops retrying, the last outcome is passed through as-is by default: the
 * caller sees the last response, or the last transport error is thrown. Configure
 * {@link Exhaustion#FAIL} to raise {@link RetriesExhaustedException} instead when a bounding
 * policy capped the retries.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RoundTrip<String> roundTrip = Retrier.wrap(
 *     RoundTrip.of(HttpClient.newHttpClient(), BodyHandlers.ofString()),
 *     RetryPolicyFactory.max(5, RetryPolicyFactory.temporaryErrors(ErrorClassifier.network()))
 * );
 *
 * HttpResponse<String> response = roundTrip.send(request);
 * }</pre>
 *
 * @param <T> the response body type
 */
public final class Retrier<T> implements RoundTrip<T> {

    private static final Logger LOG = LogManager.getLogger(Retrier.class);

    private final RoundTrip<T> delegate;
    private final RetryPolicyFactory factory;
    private final OpReporter reporter;
    private final Exhaustion exhaustion;
    private final Clock clock;

    private Retrier(RoundTrip<T> delegate, RetryPolicyFactory factory, OpReporter reporter,
                    Exhaustion exhaustion, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.exhaustion = Objects.requireNonNull(exhaustion, "exhaustion must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Wraps a round trip with the default reporting and exhaustion handling.
     *
     * @param delegate the round trip performing each attempt
     * @param factory creates the policy for each request
     * @return a retrying round trip with the same signature
     */
    public static <T> Retrier<T> wrap(RoundTrip<T> delegate, RetryPolicyFactory factory) {
        return builder(delegate).policy(factory).build();
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @param delegate the round trip performing each attempt
     * @return a new builder
     */
    public static <T> Builder<T> builder(RoundTrip<T> delegate) {
        return new Builder<>(delegate);
    }

    /**
     * Builder for configuring a Retrier instance.
     *
     * <p>Example usage:</p>
     * <pre>{@code
     * Retrier<String> retrier = Retrier.builder(roundTrip)
     *     .policy(RetryPolicyFactory.max(3, RetryPolicyFactory.statusCodes(502, 503)))
     *     .reporter(new Log4jOpReporter())
     *     .exhaustion(Exhaustion.FAIL)
     *     .build();
     * }</pre>
     */
    public static final class Builder<T> {
        private final RoundTrip<T> delegate;
        private RetryPolicyFactory factory;
        private OpReporter reporter = OpReporter.noOp();
        private Exhaustion exhaustion = Exhaustion.PASS_THROUGH;
        private Clock clock = Clock.systemUTC();

        private Builder(RoundTrip<T> delegate) {
            this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        }

        /**
         * Sets the retry policy factory (required).
         *
         * @param factory creates the policy for each request
         * @return this builder
         */
        public Builder<T> policy(RetryPolicyFactory factory) {
            this.factory = Objects.requireNonNull(factory, "factory must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter receiving retry lifecycle events
         * @return this builder
         */
        public Builder<T> reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets how exhausted retries surface (optional, defaults to pass-through).
         *
         * @param exhaustion what to do when a bounding policy stops retrying
         * @return this builder
         */
        public Builder<T> exhaustion(Exhaustion exhaustion) {
            this.exhaustion = Objects.requireNonNull(exhaustion, "exhaustion must not be null");
            return this;
        }

        /**
         * Sets the clock used to timestamp attempts (package-private, for testing).
         *
         * @param clock the clock stamping each attempt
         * @return this builder
         */
        Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return the configured retrier
         * @throws NullPointerException if no policy factory has been set
         */
        public Retrier<T> build() {
            Objects.requireNonNull(factory, "policy must be set");
            return new Retrier<>(delegate, factory, reporter, exhaustion, clock);
        }
    }

    @Override
    public HttpResponse<T> send(HttpRequest request, Cancellation cancellation) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        if (cancellation.isCancelled()) {
            throw canceled(request, 0);
        }
        BufferedBody body;
        try {
            body = BufferedBody.capture(request, cancellation);
        } catch (RequestCanceledException e) {
            reporter.reportCanceled(request, 0);
            throw e;
        }
        if (body.isPresent()) {
            LOG.debug("Buffered {} byte request body of {} {} for replay", body.length(), request.method(), request.uri());
        }

        try (RetryPolicy policy = factory.create(request)) {
            int attempts = 0;
            while (true) {
                if (cancellation.isCancelled()) {
                    throw canceled(request, attempts);
                }

                attempts++;
                HttpResponse<T> response = null;
                IOException error = null;
                try {
                    response = delegate.send(body.replay(request), cancellation);
                } catch (RequestCanceledException e) {
                    reporter.reportCanceled(request, attempts);
                    throw e.attempts() == attempts ? e : new RequestCanceledException(e.getMessage(), attempts, e);
                } catch (IOException e) {
                    error = e;
                }
                Attempt attempt = new Attempt(attempts, response, error, clock.instant());

                if (cancellation.isCancelled()) {
                    discard(response);
                    throw canceled(request, attempts);
                }

                Verdict verdict;
                try {
                    verdict = Objects.requireNonNull(policy.retry(response, error), "policy returned a null verdict");
                } catch (RuntimeException e) {
                    discard(response);
                    throw e;
                }
                if (verdict instanceof Verdict.Abort abort) {
                    discard(response);
                    reporter.reportPolicyError(request, attempt, abort.error());
                    throw abort.error();
                }
                if (verdict instanceof Verdict.Stop stop) {
                    return complete(request, attempt, response, stop);
                }

                Duration delay = ((Verdict.Retry) verdict).delay();
                LOG.debug("Attempt {} of {} {} failed ({}), retrying in {}",
                        attempts, request.method(), request.uri(), describeOutcome(attempt), delay);
                reporter.reportRetryAttempt(request, attempt, delay);
                discard(response);

                if (cancellation.await(delay)) {
                    throw canceled(request, attempts);
                }
            }
        }
    }

    private HttpResponse<T> complete(HttpRequest request, Attempt attempt, HttpResponse<T> response, Verdict.Stop stop)
            throws IOException {
        if (stop.exhausted()) {
            reporter.reportRetryExhausted(request, attempt, stop.reason());
            if (exhaustion == Exhaustion.FAIL) {
                throw new RetriesExhaustedException(attempt.number(), stop.reason(), response, attempt.error());
            }
        }
        if (attempt.error() != null) {
            throw attempt.error();
        }
        return response;
    }

    private RequestCanceledException canceled(HttpRequest request, int attempts) {
        reporter.reportCanceled(request, attempts);
        return new RequestCanceledException(attempts);
    }

    // A discarded response is never handed to the caller, so its body is released here.
    private static void discard(HttpResponse<?> response) {
        if (response == null || !(response.body() instanceof AutoCloseable closeable)) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            LOG.debug("Failed to close discarded response body from {}", response.uri(), e);
        }
    }
}

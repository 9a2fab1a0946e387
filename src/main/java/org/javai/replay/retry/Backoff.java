package org.javai.replay.retry;

import org.javai.replay.Settings;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff configuration.
 *
 * <p>The delay before zero-based retry {@code k} is {@code initialDelay * factor^k}, moved up or
 * down by a random deviation of at most {@code jitter} times itself, and capped at
 * {@code maxDelay}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Backoff backoff = Backoff.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .factor(2)
 *     .jitter(1)
 *     .maxDelay(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 *
 * @param initialDelay delay before the first retry
 * @param factor multiplier applied per retry (>= 1)
 * @param jitter relative random deviation, between 0 and 1
 * @param maxDelay upper bound for any delay
 */
public record Backoff(Duration initialDelay, double factor, double jitter, Duration maxDelay) {

    static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    static final double DEFAULT_FACTOR = 2;
    static final double DEFAULT_JITTER = 0;
    static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    public Backoff {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(factor >= 1)) {
            throw new IllegalArgumentException("factor must be >= 1, was: " + factor);
        }
        if (!(jitter >= 0 && jitter <= 1)) {
            throw new IllegalArgumentException("jitter must be between 0 and 1, was: " + jitter);
        }
    }

    /**
     * 100ms initial delay, factor 2, no jitter, 10s cap.
     */
    public static Backoff defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from system properties, falling back to environment variables
     * and then to {@link #defaults()} for each missing key.
     *
     * <ul>
     *   <li>{@code replay.backoff.initialDelay} / {@code REPLAY_BACKOFF_INITIAL_DELAY}</li>
     *   <li>{@code replay.backoff.factor} / {@code REPLAY_BACKOFF_FACTOR}</li>
     *   <li>{@code replay.backoff.jitter} / {@code REPLAY_BACKOFF_JITTER}</li>
     *   <li>{@code replay.backoff.maxDelay} / {@code REPLAY_BACKOFF_MAX_DELAY}</li>
     * </ul>
     *
     * @throws IllegalArgumentException if a configured value is malformed or out of range
     */
    public static Backoff fromSettings() {
        return new Backoff(
                Settings.resolveDuration("replay.backoff.initialDelay", "REPLAY_BACKOFF_INITIAL_DELAY", DEFAULT_INITIAL_DELAY),
                Settings.resolveDouble("replay.backoff.factor", "REPLAY_BACKOFF_FACTOR", DEFAULT_FACTOR),
                Settings.resolveDouble("replay.backoff.jitter", "REPLAY_BACKOFF_JITTER", DEFAULT_JITTER),
                Settings.resolveDuration("replay.backoff.maxDelay", "REPLAY_BACKOFF_MAX_DELAY", DEFAULT_MAX_DELAY)
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes the delay before zero-based retry {@code attempt}.
     *
     * @param attempt the number of retries already paced
     * @param random source for the jitter deviation
     */
    public Duration delay(int attempt, Random random) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was: " + attempt);
        }
        double nanos = initialDelay.toNanos() * Math.pow(factor, attempt);
        if (jitter > 0) {
            double r = random.nextDouble();
            double deviation = Math.floor(r * jitter * nanos);
            nanos = ((long) Math.floor(r * 10) & 1) == 0 ? nanos - deviation : nanos + deviation;
        }
        double capped = Math.max(0, Math.min(nanos, maxDelay.toNanos()));
        return Duration.ofNanos((long) capped);
    }

    /**
     * Creates a ticker for one request.
     */
    public BackoffTicker newTicker() {
        return new BackoffTicker(this, new Random());
    }

    public BackoffTicker newTicker(Random random) {
        return new BackoffTicker(this, Objects.requireNonNull(random, "random must not be null"));
    }

    /**
     * Builder for {@link Backoff}; unset values take the defaults.
     */
    public static final class Builder {
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private double factor = DEFAULT_FACTOR;
        private double jitter = DEFAULT_JITTER;
        private Duration maxDelay = DEFAULT_MAX_DELAY;

        private Builder() {}

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
            return this;
        }

        public Builder factor(double factor) {
            this.factor = factor;
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            return this;
        }

        public Backoff build() {
            return new Backoff(initialDelay, factor, jitter, maxDelay);
        }
    }
}

package org.javai.replay.retry;

import org.javai.replay.PolicyException;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a retry policy after judging an attempt's outcome.
 */
public sealed interface Verdict permits Verdict.Retry, Verdict.Stop, Verdict.Abort {

    static Retry retry() {
        return Retry.immediate();
    }

    static Stop stop() {
        return Stop.DONE;
    }

    static Abort abort(String message) {
        return new Abort(new PolicyException(message));
    }

    /**
     * Retry the request after waiting for the specified delay.
     */
    record Retry(Duration delay) implements Verdict {
        private static final Retry IMMEDIATE = new Retry(Duration.ZERO);

        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry immediate() {
            return IMMEDIATE;
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }

        /**
         * Returns the retry with the longer of the two delays.
         */
        public Retry atLeast(Duration other) {
            return other.compareTo(delay) > 0 ? new Retry(other) : this;
        }
    }

    /**
     * Do not retry; the attempt's outcome is final.
     *
     * @param exhausted {@code true} when a bounding policy capped the retries
     * @param reason optional explanation, for reporting
     */
    record Stop(boolean exhausted, String reason) implements Verdict {
        private static final Stop DONE = new Stop(false, null);

        public static Stop because(String reason) {
            return new Stop(false, reason);
        }

        public static Stop exhausted(String reason) {
            return new Stop(true, reason);
        }
    }

    /**
     * The policy raised an error; the loop terminates with it.
     */
    record Abort(PolicyException error) implements Verdict {
        public Abort {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}

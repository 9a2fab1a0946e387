package org.javai.replay.retry;

/**
 * What the retry loop does when a bounding policy stops retrying.
 */
public enum Exhaustion {
    /**
     * Return the last response, or throw the last transport error, as-is.
     */
    PASS_THROUGH,

    /**
     * Throw {@link org.javai.replay.RetriesExhaustedException} carrying the last outcome.
     */
    FAIL
}

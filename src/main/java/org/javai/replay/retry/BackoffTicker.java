package org.javai.replay.retry;

import java.time.Duration;
import java.util.Random;

/**
 * The sequence of backoff delays for one request. Not thread-safe; owned by a single policy.
 */
public final class BackoffTicker implements AutoCloseable {

    private final Backoff backoff;
    private final Random random;
    private int ticks;
    private boolean stopped;

    BackoffTicker(Backoff backoff, Random random) {
        this.backoff = backoff;
        this.random = random;
    }

    /**
     * Returns the next delay and advances the sequence.
     *
     * @throws IllegalStateException if the ticker was stopped
     */
    public Duration next() {
        if (stopped) {
            throw new IllegalStateException("ticker stopped");
        }
        return backoff.delay(ticks++, random);
    }

    /**
     * The number of delays handed out so far.
     */
    public int ticks() {
        return ticks;
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public void close() {
        stopped = true;
    }
}

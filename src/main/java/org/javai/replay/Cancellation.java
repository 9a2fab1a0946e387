package org.javai.replay;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The cancellation signal associated with one request for its whole lifetime.
 *
 * <p>Once fired, a cancellation is terminal. {@link #cancel()} may be called from any thread
 * and any number of times; registered listeners run at most once.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Cancellation cancellation = new Cancellation();
 * executor.submit(() -> retrier.send(request, cancellation));
 * // later, from another thread
 * cancellation.cancel();
 * }</pre>
 */
public final class Cancellation {

    private final CountDownLatch fired = new CountDownLatch(1);
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Fires the signal. Listeners registered so far are run on the calling thread.
     */
    public void cancel() {
        if (fired.getCount() == 0) {
            return;
        }
        fired.countDown();
        for (Listener listener : listeners) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return fired.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for the signal.
     *
     * @return {@code true} if the signal fired before the timeout elapsed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return fired.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Throws {@link RequestCanceledException} if the signal has fired.
     *
     * @param attempts the number of attempts issued so far, for the error
     */
    public void throwIfCancelled(int attempts) throws RequestCanceledException {
        if (isCancelled()) {
            throw new RequestCanceledException(attempts);
        }
    }

    /**
     * Registers an action to run when the signal fires. If it already fired, the action runs
     * immediately on the calling thread.
     *
     * @param action the action to run once
     * @return a registration that removes the action when closed
     */
    public Registration onCancel(Runnable action) {
        Listener listener = new Listener(Objects.requireNonNull(action, "action must not be null"));
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for a registered cancellation action.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }

    private static final class Listener {
        private final Runnable action;
        private final AtomicBoolean ran = new AtomicBoolean();

        Listener(Runnable action) {
            this.action = action;
        }

        void run() {
            if (ran.compareAndSet(false, true)) {
                action.run();
            }
        }
    }
}

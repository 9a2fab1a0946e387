package org.javai.replay;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CancellationTest {

    @Test
    void newSignal_isNotCancelled() {
        Cancellation cancellation = new Cancellation();

        assertThat(cancellation.isCancelled()).isFalse();
    }

    @Test
    void cancel_isTerminalAndIdempotent() {
        Cancellation cancellation = new Cancellation();
        AtomicInteger runs = new AtomicInteger();
        cancellation.onCancel(runs::incrementAndGet);

        cancellation.cancel();
        cancellation.cancel();

        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void onCancel_afterFiring_runsImmediately() {
        Cancellation cancellation = new Cancellation();
        cancellation.cancel();
        AtomicInteger runs = new AtomicInteger();

        cancellation.onCancel(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void closedRegistration_isNotRun() {
        Cancellation cancellation = new Cancellation();
        AtomicInteger runs = new AtomicInteger();

        cancellation.onCancel(runs::incrementAndGet).close();
        cancellation.cancel();

        assertThat(runs.get()).isZero();
    }

    @Test
    void await_withoutCancellation_waitsForTimeout() throws InterruptedException {
        Cancellation cancellation = new Cancellation();
        long start = System.nanoTime();

        boolean cancelled = cancellation.await(Duration.ofMillis(50));

        assertThat(cancelled).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(45));
    }

    @Test
    void await_returnsEarlyWhenCancelledFromAnotherThread() throws InterruptedException {
        Cancellation cancellation = new Cancellation();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(cancellation::cancel, 20, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();

            boolean cancelled = cancellation.await(Duration.ofSeconds(10));

            assertThat(cancelled).isTrue();
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void await_zeroTimeout_reportsCurrentState() throws InterruptedException {
        Cancellation cancellation = new Cancellation();
        assertThat(cancellation.await(Duration.ZERO)).isFalse();

        cancellation.cancel();
        assertThat(cancellation.await(Duration.ZERO)).isTrue();
    }

    @Test
    void await_interrupted_throws() {
        Cancellation cancellation = new Cancellation();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> cancellation.await(Duration.ofSeconds(1)))
                .isInstanceOf(InterruptedException.class);
    }

    @Test
    void throwIfCancelled_carriesAttemptCount() {
        Cancellation cancellation = new Cancellation();
        assertThatCode(() -> cancellation.throwIfCancelled(0)).doesNotThrowAnyException();

        cancellation.cancel();

        assertThatThrownBy(() -> cancellation.throwIfCancelled(3))
                .isInstanceOf(RequestCanceledException.class)
                .satisfies(e -> assertThat(((RequestCanceledException) e).attempts()).isEqualTo(3));
    }

    @Test
    void concurrentCancel_runsListenerOnce() throws InterruptedException {
        Cancellation cancellation = new Cancellation();
        AtomicInteger runs = new AtomicInteger();
        cancellation.onCancel(runs::incrementAndGet);
        CountDownLatch go = new CountDownLatch(1);
        Thread[] threads = new Thread[8];
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                cancellation.cancel();
            });
            threads[i].start();
        }

        go.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        assertThat(runs.get()).isEqualTo(1);
    }
}

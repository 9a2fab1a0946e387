package org.javai.replay.retry;

import org.javai.replay.Cancellation;
import org.javai.replay.RequestCanceledException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;

/**
 * A request body captured in memory so that it can be sent once per attempt.
 *
 * <p>Body publishers such as {@code BodyPublishers.ofInputStream} can be consumed only once.
 * The body is drained before the first attempt and every attempt gets its own
 * {@code ofByteArray} publisher over the same bytes.
 */
final class BufferedBody {

    private static final BufferedBody NONE = new BufferedBody(null);

    // Stream-backed publishers read on the thread that requests items.
    private static final Executor DRAINERS = Executors.newCachedThreadPool(task -> {
        Thread thread = new Thread(task, "replay-body-drainer");
        thread.setDaemon(true);
        return thread;
    });

    private final byte[] bytes;

    private BufferedBody(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Drains the request's body publisher, if it has one with content. The wait races the
     * cancellation signal; a source that stalls keeps only its draining thread blocked.
     *
     * @throws RequestCanceledException if the signal fires before the body is drained
     * @throws IOException if the publisher fails
     * @throws InterruptedException if interrupted while draining
     */
    static BufferedBody capture(HttpRequest request, Cancellation cancellation) throws IOException, InterruptedException {
        Optional<HttpRequest.BodyPublisher> publisher = request.bodyPublisher();
        if (publisher.isEmpty() || publisher.get().contentLength() == 0) {
            return NONE;
        }
        Collector collector = new Collector();
        try (Cancellation.Registration ignored = cancellation.onCancel(collector::cancel)) {
            DRAINERS.execute(() -> publisher.get().subscribe(collector));
            return new BufferedBody(collector.result.get());
        } catch (CancellationException e) {
            throw new RequestCanceledException("request canceled while buffering its body", 0, e);
        } catch (InterruptedException e) {
            collector.cancel();
            throw e;
        } catch (ExecutionException e) {
            throw new IOException("Unable to buffer request body for " + request.method() + " " + request.uri(), e.getCause());
        }
    }

    boolean isPresent() {
        return bytes != null;
    }

    int length() {
        return bytes != null ? bytes.length : 0;
    }

    /**
     * Returns the request to send for one attempt, carrying a fresh copy of the body.
     */
    HttpRequest replay(HttpRequest original) {
        if (!isPresent()) {
            return original;
        }
        return HttpRequest.newBuilder(original, (name, value) -> true)
                .method(original.method(), HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
    }

    private static final class Collector implements Flow.Subscriber<ByteBuffer> {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final CompletableFuture<byte[]> result = new CompletableFuture<>();
        private volatile Flow.Subscription subscription;

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (result.isDone()) {
                subscription.cancel();
                return;
            }
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(ByteBuffer item) {
            byte[] chunk = new byte[item.remaining()];
            item.get(chunk);
            synchronized (out) {
                out.write(chunk, 0, chunk.length);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            result.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            synchronized (out) {
                result.complete(out.toByteArray());
            }
        }

        void cancel() {
            result.cancel(false);
            Flow.Subscription current = subscription;
            if (current != null) {
                current.cancel();
            }
        }
    }
}

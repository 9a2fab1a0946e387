package org.javai.replay;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Reads what a request's body publisher emits, the way a transport would.
 */
public final class RequestBodies {

    private RequestBodies() {
    }

    /**
     * @return the body as UTF-8 text, or null if the request has no body publisher
     */
    public static String read(HttpRequest request) {
        if (request.bodyPublisher().isEmpty()) {
            return null;
        }
        CompletableFuture<String> text = new CompletableFuture<>();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        request.bodyPublisher().get().subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] chunk = new byte[item.remaining()];
                item.get(chunk);
                out.write(chunk, 0, chunk.length);
            }

            @Override
            public void onError(Throwable throwable) {
                text.completeExceptionally(throwable);
            }

            @Override
            public void onComplete() {
                text.complete(out.toString(StandardCharsets.UTF_8));
            }
        });
        try {
            return text.get(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new AssertionError("body publisher failed", e);
        }
    }
}

package org.javai.replay;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A {@link RoundTrip} backed by {@link HttpClient#sendAsync}.
 *
 * <p>The exchange runs asynchronously while the calling thread waits for it, so the request's
 * cancellation signal can abort an in-flight attempt. Cancellation is best effort: the caller
 * is released with a {@link RequestCanceledException} at once, and the client is asked to
 * abandon the exchange.
 */
public final class HttpClientRoundTrip<T> implements RoundTrip<T> {

    private static final Logger LOG = LogManager.getLogger(HttpClientRoundTrip.class);

    private final HttpClient client;
    private final HttpResponse.BodyHandler<T> bodyHandler;

    public HttpClientRoundTrip(HttpClient client, HttpResponse.BodyHandler<T> bodyHandler) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.bodyHandler = Objects.requireNonNull(bodyHandler, "bodyHandler must not be null");
    }

    @Override
    public HttpResponse<T> send(HttpRequest request, Cancellation cancellation) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        cancellation.throwIfCancelled(0);

        CompletableFuture<HttpResponse<T>> exchange = client.sendAsync(request, bodyHandler);
        try (Cancellation.Registration ignored = cancellation.onCancel(() -> exchange.cancel(true))) {
            return exchange.get();
        } catch (CancellationException e) {
            throw canceled(request, e);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            // the client reports an aborted exchange as a failed one, with the cancellation as cause
            if (e.getCause() instanceof CancellationException || cancellation.isCancelled()) {
                throw canceled(request, e.getCause());
            }
            throw unwrap(e.getCause());
        }
    }

    private static RequestCanceledException canceled(HttpRequest request, Throwable cause) {
        LOG.debug("Exchange {} {} abandoned after cancellation", request.method(), request.uri());
        return new RequestCanceledException("request canceled during exchange", 1, cause);
    }

    private static IOException unwrap(Throwable cause) {
        if (cause instanceof IOException ioException) {
            return ioException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException(cause);
    }
}

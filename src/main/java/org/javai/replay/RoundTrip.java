package org.javai.replay;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * One execution of an HTTP request: send it, return the response or throw the transport error.
 *
 * <p>This is the seam the retry loop wraps. A retrying round trip has the same signature as
 * the one it wraps, so it composes into any request-execution chain.
 *
 * @param <T> the response body type
 */
@FunctionalInterface
public interface RoundTrip<T> {

    /**
     * Sends the request.
     *
     * @param request the request to send
     * @param cancellation the request's cancellation signal; implementations should abort
     *                     an in-flight exchange when it fires
     * @return the response
     * @throws IOException on transport failure
     * @throws InterruptedException if the calling thread is interrupted
     */
    HttpResponse<T> send(HttpRequest request, Cancellation cancellation) throws IOException, InterruptedException;

    /**
     * Sends the request with a signal that is never fired.
     */
    default HttpResponse<T> send(HttpRequest request) throws IOException, InterruptedException {
        return send(request, new Cancellation());
    }

    /**
     * Adapts an {@link HttpClient} into a round trip.
     *
     * @param client the client performing the exchange
     * @param bodyHandler the handler for response bodies
     * @return a round trip that honors cancellation
     */
    static <T> RoundTrip<T> of(HttpClient client, HttpResponse.BodyHandler<T> bodyHandler) {
        return new HttpClientRoundTrip<>(client, bodyHandler);
    }
}

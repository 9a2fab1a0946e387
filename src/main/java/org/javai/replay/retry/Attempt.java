package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The outcome of one execution of the underlying round trip.
 *
 * @param number The attempt number (1-based)
 * @param response The response, or null if the attempt failed
 * @param error The transport error, or null if a response arrived
 * @param completedAt When the attempt completed
 */
public record Attempt(
        int number,
        HttpResponse<?> response,
        IOException error,
        Instant completedAt
) {
    public Attempt {
        if (number < 1) {
            throw new IllegalArgumentException("number must be >= 1");
        }
        Objects.requireNonNull(completedAt, "completedAt must not be null");
    }

    public boolean failed() {
        return error != null;
    }

    public OptionalInt statusCode() {
        return response != null ? OptionalInt.of(response.statusCode()) : OptionalInt.empty();
    }
}

package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Retries responses whose status code is in a fixed set. Errors are not retried.
 */
final class StatusCodePolicy implements RetryPolicy {

    private final Set<Integer> codes;

    StatusCodePolicy(int... codes) {
        for (int code : codes) {
            if (code < 100 || code > 599) {
                throw new IllegalArgumentException("not an HTTP status code: " + code);
            }
        }
        this.codes = Arrays.stream(codes).boxed().collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Verdict retry(HttpResponse<?> response, IOException error) {
        if (response == null) {
            return Verdict.stop();
        }
        return codes.contains(response.statusCode()) ? Verdict.retry() : Verdict.stop();
    }
}

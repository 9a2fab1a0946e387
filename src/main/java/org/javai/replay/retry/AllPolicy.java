package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Logical AND of several policies, consulted left to right.
 */
final class AllPolicy implements RetryPolicy {

    private final List<RetryPolicy> policies;
    private boolean closed;

    private AllPolicy(List<RetryPolicy> policies) {
        this.policies = policies;
    }

    static AllPolicy create(List<RetryPolicyFactory> factories, HttpRequest request) {
        List<RetryPolicy> policies = new ArrayList<>(factories.size());
        for (RetryPolicyFactory factory : factories) {
            policies.add(factory.create(request));
        }
        return new AllPolicy(List.copyOf(policies));
    }

    @Override
    public Verdict retry(HttpResponse<?> response, IOException error) {
        Verdict.Retry combined = Verdict.Retry.immediate();
        for (RetryPolicy policy : policies) {
            Verdict verdict = policy.retry(response, error);
            if (!(verdict instanceof Verdict.Retry retry)) {
                return verdict;
            }
            combined = combined.atLeast(retry.delay());
        }
        return combined;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        RuntimeException failure = null;
        for (RetryPolicy policy : policies) {
            try {
                policy.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

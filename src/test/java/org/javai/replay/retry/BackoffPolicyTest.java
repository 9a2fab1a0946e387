package org.javai.replay.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    private final IOException error = new IOException("boom");

    @Test
    void retry_isPacedByTicker() {
        RetryPolicy policy = RetryPolicyFactory.backoff(Backoff.defaults()).create(null);

        assertThat(policy.retry(null, error)).isEqualTo(Verdict.Retry.after(Duration.ofMillis(100)));
        assertThat(policy.retry(null, error)).isEqualTo(Verdict.Retry.after(Duration.ofMillis(200)));
        assertThat(policy.retry(null, error)).isEqualTo(Verdict.Retry.after(Duration.ofMillis(400)));
    }

    @Test
    void longerDelegateDelay_wins() {
        ScriptedPolicy delegate = new ScriptedPolicy(Verdict.Retry.after(Duration.ofSeconds(3)));
        RetryPolicy policy = RetryPolicyFactory.backoff(Backoff.defaults(), delegate.factory()).create(null);

        assertThat(policy.retry(null, error)).isEqualTo(Verdict.Retry.after(Duration.ofSeconds(3)));
    }

    @Test
    void stop_doesNotAdvanceTicker() {
        ScriptedPolicy delegate = new ScriptedPolicy(Verdict.stop(), Verdict.retry());
        BackoffTicker ticker = Backoff.defaults().newTicker(new Random(1));
        BackoffPolicy policy = new BackoffPolicy(ticker, delegate);

        assertThat(policy.retry(null, error)).isEqualTo(Verdict.stop());
        assertThat(ticker.ticks()).isZero();
        assertThat(policy.retry(null, error)).isEqualTo(Verdict.Retry.after(Duration.ofMillis(100)));
    }

    @Test
    void abort_isPassedThrough() {
        Verdict.Abort abort = Verdict.abort("unreadable");
        ScriptedPolicy delegate = new ScriptedPolicy(abort);
        RetryPolicy policy = RetryPolicyFactory.backoff(Backoff.defaults(), delegate.factory()).create(null);

        assertThat(policy.retry(null, error)).isSameAs(abort);
    }

    @Test
    void close_stopsTickerAndClosesDelegate() {
        ScriptedPolicy delegate = new ScriptedPolicy();
        BackoffTicker ticker = Backoff.defaults().newTicker(new Random(1));
        BackoffPolicy policy = new BackoffPolicy(ticker, delegate);

        policy.close();

        assertThat(ticker.isStopped()).isTrue();
        assertThat(delegate.closes).isEqualTo(1);
    }

    @Test
    void eachRequestGetsItsOwnTicker() {
        RetryPolicyFactory factory = RetryPolicyFactory.backoff(Backoff.defaults());
        RetryPolicy first = factory.create(null);
        first.retry(null, error);
        first.retry(null, error);

        RetryPolicy second = factory.create(null);

        assertThat(second.retry(null, error)).isEqualTo(Verdict.Retry.after(Duration.ofMillis(100)));
    }
}

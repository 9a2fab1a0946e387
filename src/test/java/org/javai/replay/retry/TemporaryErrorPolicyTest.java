package org.javai.replay.retry;

import org.javai.replay.StubResponse;
import org.javai.replay.TransientIOException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.*;

class TemporaryErrorPolicyTest {

    private final RetryPolicy capability = RetryPolicyFactory.temporaryErrors().create(null);
    private final RetryPolicy network = RetryPolicyFactory.temporaryErrors(ErrorClassifier.network()).create(null);

    @Test
    void temporaryError_isRetried() {
        assertThat(capability.retry(null, new TransientIOException("reset by peer"))).isInstanceOf(Verdict.Retry.class);
    }

    @Test
    void errorMarkedPermanent_stops() {
        Verdict verdict = capability.retry(null, new TransientIOException("bad certificate", false));

        assertThat(verdict).isInstanceOf(Verdict.Stop.class);
        assertThat(((Verdict.Stop) verdict).reason()).contains(TransientIOException.class.getName());
        assertThat(((Verdict.Stop) verdict).exhausted()).isFalse();
    }

    @Test
    void errorWithoutCapability_stops() {
        assertThat(capability.retry(null, new IOException("unknown"))).isInstanceOf(Verdict.Stop.class);
    }

    @Test
    void response_stops() {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost/")).build();

        assertThat(capability.retry(StubResponse.of(request, 503, ""), null)).isEqualTo(Verdict.stop());
    }

    @Test
    void policyIsShared_acrossRequests() {
        RetryPolicyFactory factory = RetryPolicyFactory.temporaryErrors();

        assertThat(factory.create(null)).isSameAs(factory.create(null));
    }

    @Test
    void networkClassifier_retriesTimeoutsAndRefusedConnections() {
        assertThat(network.retry(null, new HttpTimeoutException("request timed out"))).isInstanceOf(Verdict.Retry.class);
        assertThat(network.retry(null, new SocketTimeoutException("read timed out"))).isInstanceOf(Verdict.Retry.class);
        assertThat(network.retry(null, new ConnectException("Connection refused"))).isInstanceOf(Verdict.Retry.class);
    }

    @Test
    void networkClassifier_doesNotRetryUnknownHost() {
        assertThat(network.retry(null, new UnknownHostException("nowhere.invalid"))).isInstanceOf(Verdict.Stop.class);
    }

    @Test
    void networkClassifier_defersToCapability() {
        assertThat(network.retry(null, new TransientIOException("marked permanent", false))).isInstanceOf(Verdict.Stop.class);
        assertThat(network.retry(null, new TransientIOException("marked temporary", true))).isInstanceOf(Verdict.Retry.class);
    }

    @Test
    void nullClassifier_isRejected() {
        assertThatThrownBy(() -> RetryPolicyFactory.temporaryErrors(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("classifier");
    }
}

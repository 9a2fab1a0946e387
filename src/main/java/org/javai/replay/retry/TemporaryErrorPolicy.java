package org.javai.replay.retry;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Retries transport errors the classifier deems temporary. Stateless, so one instance is
 * shared by every request of a factory.
 */
final class TemporaryErrorPolicy implements RetryPolicy {

    private final ErrorClassifier classifier;

    TemporaryErrorPolicy(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Verdict retry(HttpResponse<?> response, IOException error) {
        if (error == null) {
            return Verdict.stop();
        }
        return classifier.isTemporary(error)
                ? Verdict.retry()
                : Verdict.Stop.because("error is not temporary: " + error.getClass().getName());
    }
}

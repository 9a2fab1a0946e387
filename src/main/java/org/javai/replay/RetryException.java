package org.javai.replay;

import java.io.IOException;

/**
 * Base type for the terminal errors raised by the retry loop itself, as opposed to
 * transport errors produced by an attempt.
 *
 * <p>Subtypes let callers tell the outcomes apart by type:
 * <ul>
 *   <li>{@link RequestCanceledException} - the request's cancellation signal fired</li>
 *   <li>{@link RetriesExhaustedException} - a bounding policy capped the retries</li>
 *   <li>{@link PolicyException} - a policy refused to classify an outcome</li>
 * </ul>
 */
public abstract class RetryException extends IOException {

    protected RetryException(String message, Throwable cause) {
        super(message, cause);
    }
}

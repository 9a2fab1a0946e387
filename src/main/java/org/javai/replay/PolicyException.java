package org.javai.replay;

/**
 * An error raised by a retry policy while judging an outcome, for example a response
 * the policy refuses to classify. It aborts the loop immediately and wins over any
 * other verdict.
 */
public class PolicyException extends RetryException {

    public PolicyException(String message) {
        super(message, null);
    }

    public PolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}

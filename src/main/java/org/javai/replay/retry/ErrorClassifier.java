package org.javai.replay.retry;

import org.javai.replay.Temporary;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Decides whether a transport error is temporary, i.e. worth retrying.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * @param error the transport error; never null
     * @return {@code true} if retrying might succeed
     */
    boolean isTemporary(IOException error);

    /**
     * Trusts the error's own {@link Temporary} capability; errors without it are not temporary.
     */
    static ErrorClassifier capability() {
        return error -> error instanceof Temporary temporary && temporary.isTemporary();
    }

    /**
     * Like {@link #capability()}, and additionally treats JDK timeouts and refused connections
     * as temporary. Unknown hosts and other errors are not.
     */
    static ErrorClassifier network() {
        ErrorClassifier capability = capability();
        return error -> {
            if (error instanceof Temporary) {
                return capability.isTemporary(error);
            }
            return error instanceof HttpTimeoutException
                    || error instanceof SocketTimeoutException
                    || error instanceof ConnectException;
        };
    }
}

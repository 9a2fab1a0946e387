package org.javai.replay;

import java.io.IOException;

/**
 * An {@link IOException} carrying an explicit temporary flag.
 * Round trips and interceptors throw it to mark a failure as retryable (or not).
 */
public class TransientIOException extends IOException implements Temporary {

    private final boolean temporary;

    public TransientIOException(String message) {
        this(message, true, null);
    }

    public TransientIOException(String message, boolean temporary) {
        this(message, temporary, null);
    }

    public TransientIOException(String message, boolean temporary, Throwable cause) {
        super(message, cause);
        this.temporary = temporary;
    }

    @Override
    public boolean isTemporary() {
        return temporary;
    }
}

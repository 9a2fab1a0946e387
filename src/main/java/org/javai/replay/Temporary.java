package org.javai.replay;

/**
 * Capability implemented by error types that can classify themselves as transient.
 *
 * <p>Retry policies query this capability with {@code instanceof}; an error that does not
 * implement it is never considered temporary by the default classification.
 */
public interface Temporary {

    /**
     * @return {@code true} if retrying the failed operation might succeed
     */
    boolean isTemporary();
}

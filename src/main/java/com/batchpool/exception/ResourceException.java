package com.batchpool.exception;

/**
 * Exception thrown on systemic failures (interrupted batch, broken worker).
 * Always propagated to the caller of the batch operation.
 */
public class ResourceException extends BatchPoolException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

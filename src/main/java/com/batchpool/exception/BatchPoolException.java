package com.batchpool.exception;

/**
 * Base exception for the batch-pool library.
 */
public class BatchPoolException extends RuntimeException {

    public BatchPoolException(String message) {
        super(message);
    }

    public BatchPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}

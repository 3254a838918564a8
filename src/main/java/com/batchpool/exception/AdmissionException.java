package com.batchpool.exception;

/**
 * Exception thrown when an input cannot be admitted to the scheduler,
 * typically because its size cannot be determined.
 * Fatal to that input only.
 */
public class AdmissionException extends BatchPoolException {

    private final transient Object input;

    public AdmissionException(Object input, String message) {
        super(message);
        this.input = input;
    }

    public AdmissionException(Object input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    /**
     * The input reference that was rejected.
     */
    public Object getInput() {
        return input;
    }
}

package com.batchpool.exception;

/**
 * Wraps a failure raised by an item transform.
 * Recorded per item; never aborts a batch.
 */
public class TransformException extends BatchPoolException {

    private final String itemName;

    public TransformException(String itemName, Throwable cause) {
        super("Failed to process " + itemName + ": " + describe(cause), cause);
        this.itemName = itemName;
    }

    public TransformException(String itemName, String message) {
        super("Failed to process " + itemName + ": " + message);
        this.itemName = itemName;
    }

    public String getItemName() {
        return itemName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

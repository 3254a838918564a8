package com.batchpool.exception;

import java.time.Duration;

/**
 * Exception thrown when a dequeue attempt waits longer than allowed,
 * either for a concurrency slot or for memory pressure to drop.
 * Aborts only the call that timed out; scheduler state is untouched.
 */
public class SchedulingTimeoutException extends BatchPoolException {

    /**
     * What the caller was waiting for.
     */
    public enum WaitKind {
        SLOT,
        MEMORY
    }

    private final WaitKind waitKind;
    private final Duration timeout;
    private final String itemName;

    public SchedulingTimeoutException(WaitKind waitKind, Duration timeout) {
        super("Timeout waiting for " + (waitKind == WaitKind.SLOT ? "job slot" : "memory availability")
                + " after " + timeout.toMillis() + "ms");
        this.waitKind = waitKind;
        this.timeout = timeout;
        this.itemName = null;
    }

    private SchedulingTimeoutException(SchedulingTimeoutException cause, String itemName) {
        super("Not started " + itemName + ": " + cause.getMessage(), cause);
        this.waitKind = cause.waitKind;
        this.timeout = cause.timeout;
        this.itemName = itemName;
    }

    /**
     * Failure for an item that never started because of this timeout.
     */
    public SchedulingTimeoutException forItem(String itemName) {
        return new SchedulingTimeoutException(this, itemName);
    }

    public WaitKind getWaitKind() {
        return waitKind;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Item left unstarted, or null when the timeout is not tied to one.
     */
    public String getItemName() {
        return itemName;
    }
}

package com.batchpool.scheduler;

import com.batchpool.exception.SchedulingTimeoutException;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Blocks a dequeue until memory is available.
 * Implementations may poll or react to notifications; callers do not care which.
 */
public interface MemoryAvailabilityWaiter {

    /**
     * Wait until {@code available} reports true.
     *
     * @param available  Availability check, cheap and side-effect free
     * @param maxWait    Give up after this long
     * @param onPressure Invoked each time a check fails
     * @throws SchedulingTimeoutException if {@code maxWait} elapses first
     * @throws InterruptedException       if interrupted while waiting
     */
    void await(BooleanSupplier available, Duration maxWait, Runnable onPressure) throws InterruptedException;
}

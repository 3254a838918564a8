package com.batchpool.scheduler;

import com.batchpool.exception.SchedulingTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Re-checks memory availability at a fixed interval.
 * The interval is read again before every sleep, so a supplier-backed waiter
 * follows configuration changes.
 */
public class PollingMemoryWaiter implements MemoryAvailabilityWaiter {

    private static final Logger log = LoggerFactory.getLogger(PollingMemoryWaiter.class);

    private final Supplier<Duration> checkInterval;

    public PollingMemoryWaiter(Duration checkInterval) {
        validate(checkInterval);
        this.checkInterval = () -> checkInterval;
    }

    public PollingMemoryWaiter(Supplier<Duration> checkInterval) {
        if (checkInterval == null) {
            throw new IllegalArgumentException("Check interval supplier cannot be null");
        }
        this.checkInterval = checkInterval;
    }

    private static Duration validate(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Check interval must be positive");
        }
        return interval;
    }

    @Override
    public void await(BooleanSupplier available, Duration maxWait, Runnable onPressure) throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();

        while (!available.getAsBoolean()) {
            if (System.nanoTime() - deadline > 0) {
                throw new SchedulingTimeoutException(SchedulingTimeoutException.WaitKind.MEMORY, maxWait);
            }
            onPressure.run();
            Duration interval = getCheckInterval();
            log.warn("Memory pressure detected, waiting {}ms before re-check", interval.toMillis());
            Thread.sleep(interval.toMillis());
        }
    }

    public Duration getCheckInterval() {
        return validate(checkInterval.get());
    }
}

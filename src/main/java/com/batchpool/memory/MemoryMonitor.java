package com.batchpool.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Estimated memory accounting against a fixed ceiling.
 * <p>
 * Usage is accumulated from paired {@link #allocate(long)} / {@link #deallocate(long)}
 * calls only; it is an estimate and may drift from real process memory.
 * Subtraction saturates at zero.
 */
public class MemoryMonitor {

    private static final Logger log = LoggerFactory.getLogger(MemoryMonitor.class);

    public static final long MIB = 1024L * 1024L;

    /**
     * Floor for an auto-detected ceiling.
     */
    public static final long MIN_AUTO_CEILING = 512 * MIB;

    /**
     * Usage percentage above which the monitor reports pressure.
     */
    public static final double PRESSURE_THRESHOLD = 80.0;

    private final long maxMemoryUsage;
    private final AtomicLong currentUsage = new AtomicLong(0);

    public MemoryMonitor(long maxMemoryUsage) {
        if (maxMemoryUsage <= 0) {
            throw new IllegalArgumentException("Memory ceiling must be positive");
        }
        this.maxMemoryUsage = maxMemoryUsage;
        log.info("MemoryMonitor initialized with ceiling {}MB", maxMemoryUsage / MIB);
    }

    /**
     * Create a monitor with a ceiling given in megabytes.
     */
    public static MemoryMonitor ofMegabytes(long megabytes) {
        return new MemoryMonitor(megabytes * MIB);
    }

    /**
     * Create a monitor whose ceiling is 75% of the currently available memory,
     * but never less than 512MB.
     */
    public static MemoryMonitor autoDetect(SystemMemory systemMemory) {
        long availableMb = systemMemory.availableBytes() / MIB;
        long ceilingMb = Math.max(availableMb * 75 / 100, MIN_AUTO_CEILING / MIB);
        log.debug("Auto-detected memory ceiling: {}MB (available: {}MB)", ceilingMb, availableMb);
        return ofMegabytes(ceilingMb);
    }

    /**
     * Check whether {@code size} more bytes fit under the ceiling.
     */
    public boolean canAllocate(long size) {
        requireNonNegative(size);
        return size <= maxMemoryUsage - currentUsage.get();
    }

    /**
     * Record an allocation. Usage saturates at {@link Long#MAX_VALUE}.
     */
    public void allocate(long size) {
        requireNonNegative(size);
        long current = currentUsage.accumulateAndGet(size,
                (used, added) -> added > Long.MAX_VALUE - used ? Long.MAX_VALUE : used + added);
        if (current > maxMemoryUsage) {
            log.warn("Memory usage exceeded limit: {}MB / {}MB",
                    String.format("%.2f", current / (double) MIB),
                    String.format("%.2f", maxMemoryUsage / (double) MIB));
        }
    }

    /**
     * Record a deallocation. Never drops usage below zero.
     */
    public void deallocate(long size) {
        requireNonNegative(size);
        currentUsage.updateAndGet(current -> Math.max(0, current - size));
    }

    /**
     * Current usage estimate in bytes.
     */
    public long currentUsage() {
        return currentUsage.get();
    }

    /**
     * Configured ceiling in bytes.
     */
    public long maxUsage() {
        return maxMemoryUsage;
    }

    /**
     * Usage as a percentage of the ceiling, capped at 100.
     */
    public double usagePercentage() {
        double current = currentUsage.get();
        return Math.min(current / maxMemoryUsage * 100.0, 100.0);
    }

    /**
     * Whether usage is above {@value #PRESSURE_THRESHOLD}%.
     */
    public boolean isMemoryPressure() {
        return usagePercentage() > PRESSURE_THRESHOLD;
    }

    private static void requireNonNegative(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("Memory size cannot be negative: " + size);
        }
    }
}

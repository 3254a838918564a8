package com.batchpool.scheduler;

import com.batchpool.config.SchedulerConfig;
import com.batchpool.exception.AdmissionException;
import com.batchpool.exception.SchedulingTimeoutException;
import com.batchpool.memory.MemoryMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Priority work scheduler with concurrency and memory admission control.
 * <p>
 * Inputs are sized and prioritized on {@link #schedule}. A {@link #nextJob()} call
 * first takes a concurrency slot, then waits until estimated memory usage is below
 * the configured target, then pops the highest-priority item. The slot travels with
 * the returned {@link JobLease} and is returned by {@link #complete(JobLease, boolean, Duration)}
 * or by closing the lease.
 * <p>
 * Configuration is published as an immutable epoch (config plus the semaphore enforcing
 * its {@code maxConcurrent}). A swap never mutates the semaphore held by running jobs.
 *
 * @param <I> Input reference type
 */
public class WorkScheduler<I> {

    private static final Logger log = LoggerFactory.getLogger(WorkScheduler.class);

    private record Epoch(SchedulerConfig config, Semaphore slots) {
    }

    private final AtomicReference<Epoch> epoch;
    private final Object configLock = new Object();

    private final WorkQueue<I> queue = new WorkQueue<>();
    private final MemoryMonitor memoryMonitor;
    private final SizeEstimator<I> sizeEstimator;
    private final MemoryAvailabilityWaiter memoryWaiter;

    // Stats, guarded by statsLock
    private final Object statsLock = new Object();
    private long jobsQueued;
    private long jobsCompleted;
    private long jobsFailed;
    private long totalWaitNanos;
    private long totalProcessingNanos;
    private double averageQueueLength;
    private long memoryPressureEvents;

    /**
     * Scheduler that polls memory at the {@code memoryCheckInterval} of whichever
     * configuration is current, so {@link #updateConfig} also changes the poll rate.
     */
    public WorkScheduler(SchedulerConfig config, MemoryMonitor memoryMonitor, SizeEstimator<I> sizeEstimator) {
        this(config, memoryMonitor, sizeEstimator, Optional.empty());
    }

    public WorkScheduler(SchedulerConfig config,
                         MemoryMonitor memoryMonitor,
                         SizeEstimator<I> sizeEstimator,
                         MemoryAvailabilityWaiter memoryWaiter) {
        this(config, memoryMonitor, sizeEstimator, Optional.of(memoryWaiter));
    }

    private WorkScheduler(SchedulerConfig config,
                          MemoryMonitor memoryMonitor,
                          SizeEstimator<I> sizeEstimator,
                          Optional<MemoryAvailabilityWaiter> memoryWaiter) {
        if (config == null || memoryMonitor == null || sizeEstimator == null) {
            throw new NullPointerException("Scheduler collaborators cannot be null");
        }
        this.epoch = new AtomicReference<>(new Epoch(config, new Semaphore(config.maxConcurrent())));
        this.memoryMonitor = memoryMonitor;
        this.sizeEstimator = sizeEstimator;
        this.memoryWaiter = memoryWaiter.orElseGet(
                () -> new PollingMemoryWaiter(() -> epoch.get().config().memoryCheckInterval()));

        log.info("WorkScheduler initialized: maxConcurrent={}, targetMemory={}%, memoryCeiling={}MB",
                config.maxConcurrent(), config.targetMemoryUsage(),
                memoryMonitor.maxUsage() / MemoryMonitor.MIB);
    }

    /**
     * Size, prioritize and enqueue an input.
     *
     * @return the new job ID
     * @throws AdmissionException if the input cannot be sized
     */
    public long schedule(I input) {
        long size;
        try {
            size = sizeEstimator.estimateSize(input);
        } catch (IOException e) {
            throw new AdmissionException(input, "Cannot determine size of " + input, e);
        }
        if (size < 0) {
            throw new AdmissionException(input, "Negative size " + size + " reported for " + input);
        }

        WorkItem<I> item = WorkItem.create(input, size, epoch.get().config());
        queue.add(item);

        synchronized (statsLock) {
            jobsQueued++;
            averageQueueLength = queue.size();
        }

        log.debug("Scheduled job {} ({} bytes, priority {}, est. memory {}MB)",
                item.id(), size, item.priority(), item.estimatedMemory() / MemoryMonitor.MIB);
        return item.id();
    }

    /**
     * Take the next job once a slot and memory are available.
     *
     * @return the leased job, or empty if the queue is empty
     * @throws SchedulingTimeoutException if the slot or memory wait times out
     * @throws InterruptedException       if interrupted while waiting
     */
    public Optional<JobLease<I>> nextJob() throws InterruptedException {
        return nextJob(item -> true);
    }

    /**
     * Like {@link #nextJob()}, but only takes the highest-priority item accepted by
     * {@code filter}. Items it rejects stay queued in place.
     *
     * @return the leased job, or empty if no queued item matches
     */
    public Optional<JobLease<I>> nextJob(Predicate<? super WorkItem<I>> filter) throws InterruptedException {
        long waitStart = System.nanoTime();
        Epoch current = epoch.get();
        SchedulerConfig config = current.config();

        if (!current.slots().tryAcquire(config.maxWaitTime().toNanos(), TimeUnit.NANOSECONDS)) {
            log.warn("No job slot available within {}ms", config.maxWaitTime().toMillis());
            throw new SchedulingTimeoutException(SchedulingTimeoutException.WaitKind.SLOT, config.maxWaitTime());
        }

        boolean handedOut = false;
        try {
            memoryWaiter.await(
                    () -> memoryMonitor.usagePercentage() < config.targetMemoryUsage(),
                    config.memoryWaitTime(),
                    this::recordPressureEvent);

            Optional<WorkItem<I>> next = queue.poll(filter);
            if (next.isEmpty()) {
                return Optional.empty();
            }

            WorkItem<I> item = next.get();
            synchronized (statsLock) {
                totalWaitNanos += System.nanoTime() - waitStart;
                averageQueueLength = queue.size();
            }
            handedOut = true;
            log.debug("Dequeued job {} ({}), waited {}ms in queue",
                    item.id(), item.priority(), item.age().toMillis());
            return Optional.of(new JobLease<>(item, current.slots()));
        } finally {
            if (!handedOut) {
                current.slots().release();
            }
        }
    }

    /**
     * Record a finished job. Call exactly once per dequeued job.
     */
    public void complete(long jobId, boolean success, Duration processingTime) {
        synchronized (statsLock) {
            if (success) {
                jobsCompleted++;
            } else {
                jobsFailed++;
            }
            totalProcessingNanos += processingTime.toNanos();
        }
        log.debug("Job {} {} in {}ms", jobId, success ? "completed" : "failed", processingTime.toMillis());
    }

    /**
     * Record a finished job and release its slot.
     */
    public void complete(JobLease<I> lease, boolean success, Duration processingTime) {
        try {
            complete(lease.id(), success, processingTime);
        } finally {
            lease.release();
        }
    }

    private void recordPressureEvent() {
        synchronized (statsLock) {
            memoryPressureEvents++;
        }
    }

    public SchedulerStats getStats() {
        synchronized (statsLock) {
            long finished = jobsCompleted + jobsFailed;
            double seconds = totalProcessingNanos / 1_000_000_000.0;
            double throughput = seconds > 0 ? finished / seconds : 0.0;
            return new SchedulerStats(
                    jobsQueued,
                    jobsCompleted,
                    jobsFailed,
                    Duration.ofNanos(totalWaitNanos),
                    Duration.ofNanos(totalProcessingNanos),
                    averageQueueLength,
                    memoryPressureEvents,
                    throughput
            );
        }
    }

    public QueueStatus getQueueStatus() {
        return queue.status();
    }

    /**
     * Discard every queued job. Dequeued jobs are unaffected.
     *
     * @return number of jobs discarded
     */
    public int clearQueue() {
        int cleared = queue.clear();
        synchronized (statsLock) {
            averageQueueLength = 0;
        }
        log.info("Cleared {} queued jobs", cleared);
        return cleared;
    }

    /**
     * Withdraw queued jobs matching {@code filter}. Dequeued jobs are unaffected.
     *
     * @return the withdrawn items
     */
    public List<WorkItem<I>> removeQueued(Predicate<? super WorkItem<I>> filter) {
        List<WorkItem<I>> removed = queue.removeIf(filter);
        synchronized (statsLock) {
            averageQueueLength = queue.size();
        }
        if (!removed.isEmpty()) {
            log.debug("Withdrew {} queued jobs", removed.size());
        }
        return removed;
    }

    public SchedulerConfig getConfig() {
        return epoch.get().config();
    }

    /**
     * Free slots in the current epoch.
     */
    public int availableSlots() {
        return epoch.get().slots().availablePermits();
    }

    public MemoryMonitor getMemoryMonitor() {
        return memoryMonitor;
    }

    /**
     * Replace the configuration.
     */
    public void updateConfig(SchedulerConfig newConfig) {
        updateConfig(current -> newConfig);
    }

    /**
     * Atomically derive and publish a new configuration from the current one.
     * A fresh semaphore is created only when {@code maxConcurrent} changes; leases
     * already handed out keep releasing into the semaphore that granted them.
     *
     * @return the configuration in effect afterwards
     */
    public SchedulerConfig updateConfig(UnaryOperator<SchedulerConfig> update) {
        synchronized (configLock) {
            Epoch current = epoch.get();
            SchedulerConfig updated = update.apply(current.config());
            if (updated == null) {
                throw new NullPointerException("Updated config cannot be null");
            }
            if (updated == current.config()) {
                return updated;
            }

            Semaphore slots = updated.maxConcurrent() == current.config().maxConcurrent()
                    ? current.slots()
                    : new Semaphore(updated.maxConcurrent());
            epoch.set(new Epoch(updated, slots));

            log.info("Scheduler config updated: maxConcurrent {} -> {}, targetMemory {}% -> {}%",
                    current.config().maxConcurrent(), updated.maxConcurrent(),
                    current.config().targetMemoryUsage(), updated.targetMemoryUsage());
            return updated;
        }
    }
}

package com.batchpool.scheduler;

import com.batchpool.config.SchedulerConfig;
import com.batchpool.exception.AdmissionException;
import com.batchpool.exception.SchedulingTimeoutException;
import com.batchpool.memory.MemoryMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.batchpool.memory.MemoryMonitor.MIB;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkScheduler. Inputs are their own size in bytes.
 */
class WorkSchedulerTest {

    private static final SizeEstimator<Long> SIZE_IS_INPUT = size -> size;

    private MemoryMonitor monitor;
    private SchedulerConfig config;
    private WorkScheduler<Long> scheduler;

    @BeforeEach
    void setUp() {
        monitor = MemoryMonitor.ofMegabytes(1024);
        config = SchedulerConfig.defaults()
                .withMaxConcurrent(2)
                .withWaitTimes(Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofMillis(10));
        scheduler = new WorkScheduler<>(config, monitor, SIZE_IS_INPUT);
    }

    @Test
    @DisplayName("Should prioritize 500KB, 5MB, 100MB as LOW, NORMAL, HIGH and drain HIGH first")
    void shouldPrioritizeAndDrain() throws InterruptedException {
        scheduler.schedule(500_000L);
        scheduler.schedule(5_000_000L);
        scheduler.schedule(100_000_000L);

        QueueStatus status = scheduler.getQueueStatus();
        assertEquals("H:1 N:1 L:1", status.depthByPriority());

        List<JobPriority> order = new ArrayList<>();
        List<Long> inputs = new ArrayList<>();
        Optional<JobLease<Long>> next;
        while ((next = scheduler.nextJob()).isPresent()) {
            try (JobLease<Long> lease = next.get()) {
                order.add(lease.item().priority());
                inputs.add(lease.input());
            }
        }

        assertEquals(List.of(JobPriority.HIGH, JobPriority.NORMAL, JobPriority.LOW), order);
        assertEquals(List.of(100_000_000L, 5_000_000L, 500_000L), inputs);
    }

    @Test
    @DisplayName("Should return IDs and count queued jobs")
    void shouldCountQueuedJobs() {
        long first = scheduler.schedule(10L);
        long second = scheduler.schedule(20L);

        assertTrue(second > first);
        SchedulerStats stats = scheduler.getStats();
        assertEquals(2, stats.jobsQueued());
        assertEquals(2.0, stats.averageQueueLength());
    }

    @Test
    @DisplayName("Should return empty and give the slot back when the queue is empty")
    void shouldReturnEmptyOnEmptyQueue() throws InterruptedException {
        assertTrue(scheduler.nextJob().isEmpty());
        assertEquals(2, scheduler.availableSlots());
    }

    @Test
    @DisplayName("Should hold the slot until the lease is released")
    void shouldHoldSlotUntilRelease() throws InterruptedException {
        scheduler.schedule(1L);
        JobLease<Long> lease = scheduler.nextJob().orElseThrow();
        assertEquals(1, scheduler.availableSlots());

        lease.release();
        lease.release();
        assertTrue(lease.isReleased());
        assertEquals(2, scheduler.availableSlots());
    }

    @Test
    @DisplayName("Should time out waiting for a slot without touching the queue")
    void shouldTimeOutOnSlot() throws InterruptedException {
        scheduler.schedule(1L);
        scheduler.schedule(2L);
        scheduler.schedule(3L);
        JobLease<Long> first = scheduler.nextJob().orElseThrow();
        JobLease<Long> second = scheduler.nextJob().orElseThrow();

        SchedulingTimeoutException e = assertThrows(SchedulingTimeoutException.class, scheduler::nextJob);
        assertEquals(SchedulingTimeoutException.WaitKind.SLOT, e.getWaitKind());
        assertEquals(1, scheduler.getQueueStatus().totalCount());

        first.release();
        second.release();
        assertTrue(scheduler.nextJob().isPresent());
    }

    @Test
    @DisplayName("Should time out under memory pressure, record events and release the slot")
    void shouldTimeOutOnMemory() {
        scheduler.schedule(1L);
        monitor.allocate(900 * MIB);

        SchedulingTimeoutException e = assertThrows(SchedulingTimeoutException.class, scheduler::nextJob);
        assertEquals(SchedulingTimeoutException.WaitKind.MEMORY, e.getWaitKind());
        assertTrue(scheduler.getStats().memoryPressureEvents() > 0);
        assertEquals(1, scheduler.getQueueStatus().totalCount());
        assertEquals(2, scheduler.availableSlots());
    }

    @Test
    @DisplayName("Should proceed once memory pressure drops")
    void shouldProceedWhenMemoryFrees() throws InterruptedException {
        scheduler.schedule(7L);
        monitor.allocate(900 * MIB);

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(60);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            monitor.deallocate(900 * MIB);
        });
        releaser.start();

        Optional<JobLease<Long>> lease = scheduler.nextJob();
        releaser.join();

        assertTrue(lease.isPresent());
        assertEquals(7L, lease.get().input());
        assertTrue(scheduler.getStats().memoryPressureEvents() >= 1);
        lease.get().release();
    }

    @Test
    @DisplayName("Should reject inputs whose size cannot be determined")
    void shouldRejectUnsizableInput() {
        WorkScheduler<String> failing = new WorkScheduler<>(config, monitor, input -> {
            throw new IOException("No such file: " + input);
        });

        AdmissionException e = assertThrows(AdmissionException.class, () -> failing.schedule("missing.jpg"));
        assertEquals("missing.jpg", e.getInput());
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(0, failing.getQueueStatus().totalCount());
        assertEquals(0, failing.getStats().jobsQueued());
    }

    @Test
    @DisplayName("Should reject negative sizes")
    void shouldRejectNegativeSize() {
        assertThrows(AdmissionException.class, () -> scheduler.schedule(-1L));
    }

    @Test
    @DisplayName("Should track completion statistics and throughput")
    void shouldTrackCompletion() throws InterruptedException {
        scheduler.schedule(1L);
        scheduler.schedule(2L);
        JobLease<Long> first = scheduler.nextJob().orElseThrow();
        JobLease<Long> second = scheduler.nextJob().orElseThrow();

        scheduler.complete(first, true, Duration.ofMillis(500));
        scheduler.complete(second, false, Duration.ofMillis(500));

        SchedulerStats stats = scheduler.getStats();
        assertEquals(1, stats.jobsCompleted());
        assertEquals(1, stats.jobsFailed());
        assertEquals(2, stats.jobsFinished());
        assertEquals(Duration.ofSeconds(1), stats.totalProcessingTime());
        assertEquals(2.0, stats.throughputItemsPerSecond(), 0.0001);
        assertTrue(first.isReleased());
        assertTrue(second.isReleased());
        assertEquals(2, scheduler.availableSlots());
    }

    @Test
    @DisplayName("Should clear only queued jobs")
    void shouldClearQueue() throws InterruptedException {
        scheduler.schedule(1L);
        scheduler.schedule(2L);
        scheduler.schedule(3L);
        JobLease<Long> running = scheduler.nextJob().orElseThrow();

        assertEquals(2, scheduler.clearQueue());
        assertTrue(scheduler.getQueueStatus().isEmpty());
        assertFalse(running.isReleased());
        running.release();
    }

    @Test
    @DisplayName("Should swap the semaphore only when maxConcurrent changes")
    void shouldSwapSemaphoreOnConcurrencyChange() throws InterruptedException {
        scheduler.schedule(1L);
        scheduler.schedule(2L);
        JobLease<Long> inFlight = scheduler.nextJob().orElseThrow();
        assertEquals(1, scheduler.availableSlots());

        scheduler.updateConfig(c -> c.withTargetMemoryUsage(60.0));
        assertEquals(60.0, scheduler.getConfig().targetMemoryUsage());
        assertEquals(1, scheduler.availableSlots());

        scheduler.updateConfig(scheduler.getConfig().withMaxConcurrent(4));
        assertEquals(4, scheduler.getConfig().maxConcurrent());
        assertEquals(4, scheduler.availableSlots());

        // Old permit goes back to the semaphore that granted it
        inFlight.release();
        assertEquals(4, scheduler.availableSlots());

        JobLease<Long> next = scheduler.nextJob().orElseThrow();
        assertEquals(3, scheduler.availableSlots());
        next.release();
    }

    @Test
    @DisplayName("Should drain every job exactly once with concurrent workers")
    void shouldDrainConcurrently() throws InterruptedException {
        int jobs = 200;
        for (long i = 0; i < jobs; i++) {
            scheduler.schedule(i * 10_000);
        }

        ConcurrentLinkedQueue<Long> seen = new ConcurrentLinkedQueue<>();
        int workers = 4;
        CountDownLatch done = new CountDownLatch(workers);
        for (int w = 0; w < workers; w++) {
            Thread worker = new Thread(() -> {
                try {
                    Optional<JobLease<Long>> next;
                    while ((next = scheduler.nextJob()).isPresent()) {
                        JobLease<Long> lease = next.get();
                        seen.add(lease.input());
                        scheduler.complete(lease, true, Duration.ofMillis(1));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            worker.start();
        }

        assertTrue(done.await(30, TimeUnit.SECONDS));
        assertEquals(jobs, seen.size());
        assertEquals(jobs, seen.stream().distinct().count());
        assertEquals(jobs, scheduler.getStats().jobsCompleted());
        assertEquals(2, scheduler.availableSlots());
    }

    @Test
    @DisplayName("Should poll memory at the check interval of the current config")
    void shouldApplyUpdatedCheckInterval() {
        WorkScheduler<Long> slowPolling = new WorkScheduler<>(
                config.withWaitTimes(Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofSeconds(10)),
                monitor, SIZE_IS_INPUT);
        slowPolling.updateConfig(current ->
                current.withWaitTimes(Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofMillis(10)));
        slowPolling.schedule(10L);
        monitor.allocate(1000 * MIB);

        long start = System.nanoTime();
        assertThrows(SchedulingTimeoutException.class, slowPolling::nextJob);
        Duration waited = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(waited.compareTo(Duration.ofSeconds(5)) < 0, "waited " + waited);
        assertTrue(slowPolling.getStats().memoryPressureEvents() > 2);
        assertEquals(2, slowPolling.availableSlots());
    }

    @Test
    @DisplayName("Should take only filtered jobs and withdraw queued ones on request")
    void shouldFilterAndWithdraw() throws InterruptedException {
        scheduler.schedule(100_000_000L);
        long mine = scheduler.schedule(5_000_000L);
        scheduler.schedule(500_000L);

        try (JobLease<Long> lease = scheduler.nextJob(item -> item.id() == mine).orElseThrow()) {
            assertEquals(5_000_000L, lease.input());
        }
        assertTrue(scheduler.nextJob(item -> item.id() == mine).isEmpty());
        assertEquals(2, scheduler.availableSlots());

        List<WorkItem<Long>> withdrawn = scheduler.removeQueued(item -> item.priority() == JobPriority.LOW);
        assertEquals(1, withdrawn.size());
        assertEquals("H:1 N:0 L:0", scheduler.getQueueStatus().depthByPriority());
        assertEquals(1.0, scheduler.getStats().averageQueueLength());
    }
}

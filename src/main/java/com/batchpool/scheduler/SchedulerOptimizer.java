package com.batchpool.scheduler;

import com.batchpool.config.OptimizerConfig;
import com.batchpool.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically tunes a {@link WorkScheduler}'s concurrency from its statistics.
 * <p>
 * Shrinks {@code maxConcurrent} by a quarter (floor 1) and lowers the memory target
 * when too many pressure events occurred since the last pass. Grows it by a quarter
 * (at least one, up to the cap) when throughput is high and no pressure was seen.
 * Passes never overlap.
 */
public class SchedulerOptimizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerOptimizer.class);

    static final double LOW_THROUGHPUT_WARNING = 0.5;

    private final WorkScheduler<?> scheduler;
    private final OptimizerConfig config;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ScheduledExecutorService timer;
    private long lastPressureEvents;

    public SchedulerOptimizer(WorkScheduler<?> scheduler, OptimizerConfig config) {
        this.scheduler = scheduler;
        this.config = config;
        this.lastPressureEvents = scheduler.getStats().memoryPressureEvents();
    }

    /**
     * Start periodic optimization. Later calls have no effect.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Optimizer is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-optimizer");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = config.interval().toMillis();
        timer.scheduleWithFixedDelay(this::runPass, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("SchedulerOptimizer started, interval {}s", config.interval().toSeconds());
    }

    private void runPass() {
        try {
            optimize();
        } catch (RuntimeException e) {
            // Keep the timer alive; the next pass retries
            log.error("Scheduler optimization pass failed", e);
        }
    }

    /**
     * Run one optimization pass.
     *
     * @return the configuration applied, or empty if nothing changed
     */
    public synchronized Optional<SchedulerConfig> optimize() {
        SchedulerStats stats = scheduler.getStats();
        long newPressureEvents = stats.memoryPressureEvents() - lastPressureEvents;
        lastPressureEvents = stats.memoryPressureEvents();
        double throughput = stats.throughputItemsPerSecond();

        if (newPressureEvents > config.pressureThreshold() / 2.0) {
            log.warn("High memory pressure: {} pressure events since last pass", newPressureEvents);
        }
        if (stats.jobsFinished() > 0 && throughput < LOW_THROUGHPUT_WARNING) {
            log.warn("Low throughput: {} items/sec", String.format("%.2f", throughput));
        }

        if (newPressureEvents > config.pressureThreshold()) {
            SchedulerConfig applied = scheduler.updateConfig(current -> current
                    .withMaxConcurrent(Math.max(1, current.maxConcurrent() * 3 / 4))
                    .withTargetMemoryUsage(config.reducedMemoryTarget()));
            log.info("Reduced concurrency to {} due to memory pressure", applied.maxConcurrent());
            return Optional.of(applied);
        }

        if (throughput > config.throughputThreshold() && newPressureEvents == 0) {
            AtomicReference<SchedulerConfig> before = new AtomicReference<>();
            SchedulerConfig applied = scheduler.updateConfig(current -> {
                before.set(current);
                int grown = Math.min(config.maxConcurrentCap(),
                        Math.max(current.maxConcurrent() + 1, current.maxConcurrent() * 5 / 4));
                return grown > current.maxConcurrent() ? current.withMaxConcurrent(grown) : current;
            });
            if (applied == before.get()) {
                return Optional.empty();
            }
            log.info("Increased concurrency to {} due to good performance", applied.maxConcurrent());
            return Optional.of(applied);
        }

        return Optional.empty();
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService current = timer;
        if (current != null) {
            current.shutdownNow();
        }
        log.info("SchedulerOptimizer stopped");
    }
}

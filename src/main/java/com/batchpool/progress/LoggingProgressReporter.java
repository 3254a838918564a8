package com.batchpool.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs progress events from a background daemon thread until the batch
 * completes or the reporter is closed.
 */
public class LoggingProgressReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressReporter.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);
    private static final double MIB = 1024.0 * 1024.0;

    private final ProgressSubscription subscription;
    private final boolean showDetails;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread thread;

    public LoggingProgressReporter(ProgressTracker tracker, boolean showDetails) {
        this.subscription = tracker.subscribe();
        this.showDetails = showDetails;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        thread = new Thread(this::run, "progress-reporter");
        thread.setDaemon(true);
        thread.start();
    }

    private void run() {
        try {
            while (running.get()) {
                Optional<ProgressEvent> event = subscription.poll(POLL_INTERVAL);
                if (event.isEmpty()) {
                    if (subscription.isClosed()) {
                        break;
                    }
                    continue;
                }
                if (report(event.get())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            subscription.close();
        }
    }

    /**
     * @return true once the batch has completed
     */
    boolean report(ProgressEvent event) {
        if (event instanceof ProgressEvent.Started started) {
            log.info("Starting batch processing of {} items...", started.totalItems());
        } else if (event instanceof ProgressEvent.ItemStarted itemStarted) {
            if (showDetails) {
                log.info("Processing: {}", itemStarted.itemName());
            }
        } else if (event instanceof ProgressEvent.ItemCompleted completed) {
            if (showDetails) {
                if (completed.success()) {
                    log.info("Done {} ({} MB, {}K units, {}s)",
                            completed.itemName(),
                            String.format("%.2f", completed.bytes() / MIB),
                            completed.units() / 1000,
                            String.format("%.2f", completed.processingTime().toMillis() / 1000.0));
                } else {
                    log.warn("Failed {}", completed.itemName());
                }
            }
        } else if (event instanceof ProgressEvent.ItemFailed failed) {
            log.error("Error processing {}: {}", failed.itemName(), failed.message());
        } else if (event instanceof ProgressEvent.BatchCompleted batchCompleted) {
            ProgressState state = batchCompleted.finalState();
            log.info("Batch processing completed: successful={}, failed={}, duration={}s, speed={}",
                    state.completedItems(), state.failedItems(),
                    String.format("%.2f", state.elapsed().toNanos() / 1_000_000_000.0),
                    state.speedText());
            if (subscription.missedEvents() > 0) {
                log.debug("Reporter missed {} progress events", subscription.missedEvents());
            }
            return true;
        }
        return false;
    }

    /**
     * Wait for the reporter thread to finish.
     *
     * @return true if it finished within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread current;
        synchronized (this) {
            current = thread;
        }
        if (current == null) {
            return true;
        }
        current.join(Math.max(1L, timeout.toMillis()));
        return !current.isAlive();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        running.set(false);
        subscription.close();
    }
}

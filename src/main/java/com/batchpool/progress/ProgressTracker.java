package com.batchpool.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe progress accounting with event broadcast.
 * <p>
 * Counters and the current item are updated under one lock, so {@link #getState()}
 * never observes a half-applied update. Events go to every subscriber's bounded
 * buffer; slow subscribers lose old events but {@link #getState()} always has the
 * final picture.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    public static final int DEFAULT_BUFFER_SIZE = 1000;

    private final int bufferSize;
    private final List<ProgressSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    // Guarded by lock
    private long totalItems;
    private long completedItems;
    private long failedItems;
    private long bytesProcessed;
    private long unitsProcessed;
    private String currentItem;
    private long startNanos;
    private boolean started;

    public ProgressTracker() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public ProgressTracker(int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("Buffer size must be at least 1");
        }
        this.bufferSize = bufferSize;
    }

    /**
     * Reset every counter and start timing a batch of {@code total} items.
     */
    public void start(long total) {
        synchronized (lock) {
            totalItems = total;
            completedItems = 0;
            failedItems = 0;
            bytesProcessed = 0;
            unitsProcessed = 0;
            currentItem = null;
            startNanos = System.nanoTime();
            started = true;
            publish(new ProgressEvent.Started(total));
        }
        log.info("Started progress tracking for {} items", total);
    }

    public void startFile(String itemName) {
        synchronized (lock) {
            currentItem = itemName;
            publish(new ProgressEvent.ItemStarted(itemName));
        }
        log.debug("Started processing item: {}", itemName);
    }

    /**
     * Finish the current item without size details.
     */
    public void completeFile(boolean success) {
        completeFile(success, 0, 0, Duration.ZERO);
    }

    /**
     * Finish the current item.
     */
    public void completeFile(boolean success, long bytes, long units, Duration processingTime) {
        String name;
        synchronized (lock) {
            name = currentItem != null ? currentItem : "unknown";
        }
        completeFile(name, success, bytes, units, processingTime);
    }

    /**
     * Finish a named item. Used when several items run at once.
     */
    public void completeFile(String itemName, boolean success, long bytes, long units, Duration processingTime) {
        synchronized (lock) {
            if (success) {
                completedItems++;
                bytesProcessed += bytes;
                unitsProcessed += units;
            } else {
                failedItems++;
            }
            if (itemName.equals(currentItem)) {
                currentItem = null;
            }
            publish(new ProgressEvent.ItemCompleted(itemName, success, bytes, units, processingTime));
        }
        log.debug("Completed item: {} (success: {})", itemName, success);
    }

    /**
     * Count an item as failed without it having been started.
     */
    public void reportError(String itemName, String message) {
        synchronized (lock) {
            failedItems++;
            if (itemName.equals(currentItem)) {
                currentItem = null;
            }
            publish(new ProgressEvent.ItemFailed(itemName, message));
        }
        log.debug("Item {} failed: {}", itemName, message);
    }

    /**
     * Publish the final state.
     */
    public ProgressState completeBatch() {
        ProgressState finalState;
        synchronized (lock) {
            finalState = snapshot();
            publish(new ProgressEvent.BatchCompleted(finalState));
        }
        log.info("Batch completed: {}/{} items successful in {}s",
                finalState.completedItems(), finalState.totalItems(),
                String.format("%.2f", finalState.elapsed().toNanos() / 1_000_000_000.0));
        return finalState;
    }

    public ProgressState getState() {
        synchronized (lock) {
            return snapshot();
        }
    }

    public ProgressMetrics getMetrics() {
        return ProgressMetrics.from(getState());
    }

    /**
     * Open an independent event stream using the tracker's buffer size.
     */
    public ProgressSubscription subscribe() {
        return subscribe(bufferSize);
    }

    public ProgressSubscription subscribe(int capacity) {
        ProgressSubscription subscription = new ProgressSubscription(this, capacity);
        subscriptions.add(subscription);
        return subscription;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    void unsubscribe(ProgressSubscription subscription) {
        subscriptions.remove(subscription);
    }

    private void publish(ProgressEvent event) {
        for (ProgressSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    // Caller holds lock
    private ProgressState snapshot() {
        if (!started) {
            return new ProgressState(totalItems, completedItems, failedItems, currentItem,
                    Duration.ZERO, null, bytesProcessed, unitsProcessed, 0.0, 0.0);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        long processed = completedItems + failedItems;
        double percentage = totalItems > 0 ? processed * 100.0 / totalItems : 0.0;

        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        double itemsPerSecond = 0.0;
        Duration remaining = null;
        if (seconds > 0) {
            itemsPerSecond = processed / seconds;
            if (processed > 0 && totalItems > processed) {
                long perItemNanos = elapsed.toNanos() / processed;
                remaining = Duration.ofNanos(perItemNanos * (totalItems - processed));
            } else if (processed > 0) {
                remaining = Duration.ZERO;
            }
        }

        return new ProgressState(totalItems, completedItems, failedItems, currentItem, elapsed,
                remaining, bytesProcessed, unitsProcessed, itemsPerSecond, percentage);
    }
}

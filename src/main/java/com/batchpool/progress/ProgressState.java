package com.batchpool.progress;

import java.time.Duration;
import java.util.Locale;

/**
 * Consistent progress snapshot.
 *
 * @param totalItems           Items expected in the batch
 * @param completedItems       Items finished successfully
 * @param failedItems          Items that failed
 * @param currentItem          Most recently started item still running, or null
 * @param elapsed              Time since {@link ProgressTracker#start(long)}
 * @param estimatedRemaining   Linear ETA, or null while unknown
 * @param bytesProcessed       Input bytes of successful items
 * @param unitsProcessed       Units (e.g. pixels) of successful items
 * @param itemsPerSecond       Finished items per elapsed second
 * @param completionPercentage Finished items as a percentage of the total
 */
public record ProgressState(
        long totalItems,
        long completedItems,
        long failedItems,
        String currentItem,
        Duration elapsed,
        Duration estimatedRemaining,
        long bytesProcessed,
        long unitsProcessed,
        double itemsPerSecond,
        double completionPercentage
) {
    public static ProgressState initial() {
        return new ProgressState(0, 0, 0, null, Duration.ZERO, null, 0, 0, 0.0, 0.0);
    }

    /**
     * Completed plus failed items.
     */
    public long processedItems() {
        return completedItems + failedItems;
    }

    public boolean isComplete() {
        return totalItems > 0 && processedItems() >= totalItems;
    }

    public String statusText() {
        if (currentItem != null) {
            return "Processing: " + currentItem + " (" + (processedItems() + 1) + "/" + totalItems + ")";
        }
        if (completionPercentage >= 100.0) {
            return "Completed";
        }
        return processedItems() + "/" + totalItems + " items processed";
    }

    public String etaText() {
        if (estimatedRemaining == null) {
            return "Unknown";
        }
        long seconds = estimatedRemaining.toSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    public String speedText() {
        if (itemsPerSecond >= 1.0) {
            return String.format(Locale.ROOT, "%.1f items/sec", itemsPerSecond);
        }
        if (itemsPerSecond > 0.0) {
            return String.format(Locale.ROOT, "%.1f sec/item", 1.0 / itemsPerSecond);
        }
        return "Unknown";
    }
}

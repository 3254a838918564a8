package com.batchpool.progress;

import java.util.Locale;

/**
 * Throughput figures derived from a {@link ProgressState}.
 *
 * @param itemsPerSecond  Finished items per second
 * @param bytesPerSecond  Processed input bytes per second
 * @param unitsPerSecond  Processed units per second
 * @param averageItemSize Average input bytes per successful item
 * @param successRate     Successful items as a percentage of the total
 */
public record ProgressMetrics(
        double itemsPerSecond,
        double bytesPerSecond,
        double unitsPerSecond,
        long averageItemSize,
        double successRate
) {
    private static final double MIB = 1024.0 * 1024.0;

    static ProgressMetrics from(ProgressState state) {
        double seconds = state.elapsed().toNanos() / 1_000_000_000.0;
        return new ProgressMetrics(
                state.itemsPerSecond(),
                seconds > 0 ? state.bytesProcessed() / seconds : 0.0,
                seconds > 0 ? state.unitsProcessed() / seconds : 0.0,
                state.completedItems() > 0 ? state.bytesProcessed() / state.completedItems() : 0,
                state.totalItems() > 0 ? state.completedItems() * 100.0 / state.totalItems() : 0.0
        );
    }

    /**
     * e.g. {@code 4.8 MB/s, 10 Mpx/s}
     */
    public String throughputText() {
        return String.format(Locale.ROOT, "%.1f MB/s, %.0f Mpx/s",
                bytesPerSecond / MIB, unitsPerSecond / 1_000_000.0);
    }

    /**
     * e.g. {@code 2.0 MB} or {@code 512 KB}
     */
    public String averageSizeText() {
        double mb = averageItemSize / MIB;
        if (mb >= 1.0) {
            return String.format(Locale.ROOT, "%.1f MB", mb);
        }
        return String.format(Locale.ROOT, "%.0f KB", averageItemSize / 1024.0);
    }
}

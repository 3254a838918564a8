package com.batchpool.processor;

import com.batchpool.exception.BatchPoolException;
import com.batchpool.transform.TransformOutput;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Aggregate outcome of one batch run.
 *
 * @param successful        Items that produced an output
 * @param failed            Items that failed
 * @param outputs           Outputs of the successful items
 * @param failures          Failure of every failed item, each naming its item
 * @param processingTime    Wall time of the batch
 * @param totalInputBytes   Sum of input bytes over successful items
 * @param totalOutputBytes  Sum of output bytes over successful items
 * @param totalUnits        Sum of processed units over successful items
 * @param itemsPerSecond    Successful items per second of wall time
 * @param unitsPerSecond    Units per second of wall time
 * @param <O>               Output type
 */
public record BatchProcessingResult<O extends TransformOutput>(
        int successful,
        int failed,
        List<O> outputs,
        List<BatchPoolException> failures,
        Duration processingTime,
        long totalInputBytes,
        long totalOutputBytes,
        long totalUnits,
        double itemsPerSecond,
        double unitsPerSecond
) {
    private static final double MIB = 1024.0 * 1024.0;

    public BatchProcessingResult {
        outputs = List.copyOf(outputs);
        failures = List.copyOf(failures);
    }

    /**
     * Aggregate per-item outcomes plus failures recorded before any item ran.
     */
    static <O extends TransformOutput> BatchProcessingResult<O> aggregate(
            Collection<ItemOutcome<O>> outcomes,
            List<BatchPoolException> earlyFailures,
            Duration processingTime) {
        List<O> outputs = new ArrayList<>();
        List<BatchPoolException> failures = new ArrayList<>(earlyFailures);
        long input = 0;
        long output = 0;
        long units = 0;

        for (ItemOutcome<O> outcome : outcomes) {
            if (outcome.isSuccess()) {
                O out = outcome.output();
                input += out.inputBytes();
                output += out.outputBytes();
                units += out.unitCount();
                outputs.add(out);
            } else {
                failures.add(outcome.failure());
            }
        }

        double seconds = processingTime.toNanos() / 1_000_000_000.0;
        return new BatchProcessingResult<>(
                outputs.size(),
                failures.size(),
                outputs,
                failures,
                processingTime,
                input,
                output,
                units,
                seconds > 0 ? outputs.size() / seconds : 0.0,
                seconds > 0 ? units / seconds : 0.0
        );
    }

    /**
     * Input bytes per output byte; 1.0 when nothing was written.
     */
    public double compressionRatio() {
        if (totalOutputBytes == 0) {
            return 1.0;
        }
        return (double) totalInputBytes / totalOutputBytes;
    }

    /**
     * Percentage of input bytes saved.
     */
    public double sizeReduction() {
        if (totalInputBytes == 0) {
            return 0.0;
        }
        long reduction = Math.max(0, totalInputBytes - totalOutputBytes);
        return reduction * 100.0 / totalInputBytes;
    }

    public Duration averageTimePerItem() {
        if (successful == 0) {
            return Duration.ZERO;
        }
        return processingTime.dividedBy(successful);
    }

    public int totalItems() {
        return successful + failed;
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    /**
     * Multi-line human readable summary.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder("Batch Processing Results:\n");
        sb.append("  Successful: ").append(successful).append('\n');
        if (failed > 0) {
            sb.append("  Failed: ").append(failed).append('\n');
        }
        sb.append(String.format(Locale.ROOT, "  Duration: %.2fs%n", processingTime.toNanos() / 1_000_000_000.0));
        if (successful > 0) {
            sb.append(String.format(Locale.ROOT, "  Speed: %.1f items/sec, %.0f units/sec%n",
                    itemsPerSecond, unitsPerSecond));
            sb.append(String.format(Locale.ROOT, "  Size: %.2fMB -> %.2fMB (compression: %.1fx, reduction: %.1f%%)%n",
                    totalInputBytes / MIB, totalOutputBytes / MIB, compressionRatio(), sizeReduction()));
        }
        if (!failures.isEmpty()) {
            sb.append("Errors:\n");
            for (int i = 0; i < failures.size(); i++) {
                sb.append("  ").append(i + 1).append(": ").append(failures.get(i).getMessage()).append('\n');
            }
        }
        return sb.toString();
    }
}

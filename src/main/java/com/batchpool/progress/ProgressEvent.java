package com.batchpool.progress;

import java.time.Duration;

/**
 * Events published by a {@link ProgressTracker} to its subscribers.
 */
public interface ProgressEvent {

    record Started(long totalItems) implements ProgressEvent {
    }

    record ItemStarted(String itemName) implements ProgressEvent {
    }

    record ItemCompleted(
            String itemName,
            boolean success,
            long bytes,
            long units,
            Duration processingTime
    ) implements ProgressEvent {
    }

    record ItemFailed(String itemName, String message) implements ProgressEvent {
    }

    record BatchCompleted(ProgressState finalState) implements ProgressEvent {
    }
}

package com.batchpool.scheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Estimates the size in bytes of an input before it is scheduled.
 *
 * @param <I> Input reference type
 */
@FunctionalInterface
public interface SizeEstimator<I> {

    /**
     * @throws IOException if the size cannot be determined
     */
    long estimateSize(I input) throws IOException;

    /**
     * Size from filesystem metadata.
     */
    static SizeEstimator<Path> fileSize() {
        return Files::size;
    }
}

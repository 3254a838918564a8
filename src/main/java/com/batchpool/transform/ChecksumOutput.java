package com.batchpool.transform;

import java.nio.file.Path;

/**
 * Result of checksumming one file.
 *
 * @param input      File that was read
 * @param algorithm  Checksum algorithm used
 * @param checksum   Checksum value
 * @param inputBytes Bytes read
 * @param blocks     Buffer-sized blocks read
 */
public record ChecksumOutput(
        Path input,
        ChecksumAlgorithm algorithm,
        long checksum,
        long inputBytes,
        long blocks
) implements TransformOutput {

    @Override
    public long outputBytes() {
        return Long.BYTES;
    }

    @Override
    public long unitCount() {
        return blocks;
    }

    public String hexChecksum() {
        return String.format("%08x", checksum);
    }
}

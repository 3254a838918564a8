package com.batchpool.transform;

import java.util.zip.Adler32;
import java.util.zip.CRC32;
import java.util.zip.Checksum;

/**
 * Checksums supported by {@link ChecksumTransform}.
 */
public enum ChecksumAlgorithm {
    CRC32,
    ADLER32;

    public Checksum newChecksum() {
        return this == ChecksumAlgorithm.CRC32 ? new CRC32() : new Adler32();
    }
}

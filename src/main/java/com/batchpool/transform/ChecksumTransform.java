package com.batchpool.transform;

import com.batchpool.memory.ManagedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.Checksum;

/**
 * Streams a file through a pooled buffer and computes its checksum.
 */
public class ChecksumTransform implements ItemTransform<Path, ChecksumAlgorithm, ChecksumOutput> {

    private static final Logger log = LoggerFactory.getLogger(ChecksumTransform.class);

    public static final int BLOCK_SIZE = 64 * 1024;

    @Override
    public ChecksumOutput transform(Path input, TransformContext<ChecksumAlgorithm> context) throws IOException {
        ChecksumAlgorithm algorithm = context.config() != null ? context.config() : ChecksumAlgorithm.CRC32;
        Checksum checksum = algorithm.newChecksum();
        long total = 0;
        long blocks = 0;

        try (ManagedBuffer buffer = context.buffers().acquire(BLOCK_SIZE);
             InputStream in = Files.newInputStream(input)) {
            byte[] data = buffer.array();
            int read;
            while ((read = in.read(data, 0, buffer.length())) != -1) {
                checksum.update(data, 0, read);
                total += read;
                blocks++;
            }
        }

        ChecksumOutput output = new ChecksumOutput(input, algorithm, checksum.getValue(), total, blocks);
        log.trace("{} {} = {}", algorithm, context.itemName(), output.hexChecksum());
        return output;
    }
}

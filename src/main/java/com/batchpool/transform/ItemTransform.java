package com.batchpool.transform;

import java.nio.file.Path;

/**
 * The per-item work run by the processor. Must be safe to call from many threads
 * at once and may block on I/O. Any exception fails that item only.
 *
 * @param <I> Input reference type
 * @param <C> Configuration type
 * @param <O> Output type
 */
@FunctionalInterface
public interface ItemTransform<I, C, O extends TransformOutput> {

    O transform(I input, TransformContext<C> context) throws Exception;

    /**
     * Name used for progress reporting and errors.
     */
    default String describe(I input) {
        if (input instanceof Path path) {
            Path fileName = path.getFileName();
            return fileName != null ? fileName.toString() : path.toString();
        }
        return String.valueOf(input);
    }
}

package com.batchpool.transform;

import com.batchpool.memory.MemoryPool;

/**
 * Per-item context handed to an {@link ItemTransform}.
 *
 * @param itemName Display name of the item
 * @param config   Transform configuration, shared by the whole batch
 * @param buffers  Pool for scratch buffers; release every buffer before returning
 * @param <C>      Configuration type
 */
public record TransformContext<C>(String itemName, C config, MemoryPool buffers) {
}

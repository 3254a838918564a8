package com.batchpool.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Size-classed recycler for scratch byte buffers.
 * <p>
 * Buffers are handed out as {@link ManagedBuffer}s and come back on close.
 * Each {@link BufferSizeClass} keeps its own bounded free list; buffers larger than
 * {@link #MAX_POOLED_SIZE} are never kept. Free lists are guarded by their own
 * monitor, so a returned array is visible to at most one acquirer.
 */
public class MemoryPool {

    private static final Logger log = LoggerFactory.getLogger(MemoryPool.class);

    /**
     * Buffers with a larger capacity are dropped on release.
     */
    public static final int MAX_POOLED_SIZE = 100 * 1024 * 1024;

    private final Map<BufferSizeClass, ArrayDeque<byte[]>> freeLists = new EnumMap<>(BufferSizeClass.class);
    private final Map<BufferSizeClass, AtomicLong> allocated = new EnumMap<>(BufferSizeClass.class);
    private final Map<BufferSizeClass, AtomicLong> reused = new EnumMap<>(BufferSizeClass.class);
    private final AtomicLong totalMemorySaved = new AtomicLong(0);

    public MemoryPool() {
        for (BufferSizeClass sizeClass : BufferSizeClass.values()) {
            freeLists.put(sizeClass, new ArrayDeque<>(sizeClass.maxPooled()));
            allocated.put(sizeClass, new AtomicLong(0));
            reused.put(sizeClass, new AtomicLong(0));
        }
    }

    /**
     * Acquire a zeroed buffer of exactly {@code minSize} bytes logical length.
     * Reuses a pooled array of sufficient capacity when one is available.
     */
    public ManagedBuffer acquire(int minSize) {
        if (minSize < 0) {
            throw new IllegalArgumentException("Buffer size cannot be negative: " + minSize);
        }
        BufferSizeClass sizeClass = BufferSizeClass.forSize(minSize);
        byte[] data = takeFromFreeList(sizeClass, minSize);

        if (data != null) {
            Arrays.fill(data, 0, minSize, (byte) 0);
            reused.get(sizeClass).incrementAndGet();
            totalMemorySaved.addAndGet(minSize);
            log.debug("Reused buffer: {} bytes ({})", minSize, sizeClass);
        } else {
            data = new byte[minSize];
            allocated.get(sizeClass).incrementAndGet();
            log.debug("Allocated new buffer: {} bytes ({})", minSize, sizeClass);
        }
        return new ManagedBuffer(this, sizeClass, data, minSize);
    }

    private byte[] takeFromFreeList(BufferSizeClass sizeClass, int minSize) {
        ArrayDeque<byte[]> freeList = freeLists.get(sizeClass);
        synchronized (freeList) {
            Iterator<byte[]> it = freeList.iterator();
            while (it.hasNext()) {
                byte[] candidate = it.next();
                if (candidate.length >= minSize) {
                    it.remove();
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * Called by {@link ManagedBuffer#close()}.
     */
    void release(BufferSizeClass sizeClass, byte[] data) {
        if (data.length > MAX_POOLED_SIZE) {
            log.debug("Buffer too large for pool, discarded: {} bytes", data.length);
            return;
        }
        ArrayDeque<byte[]> freeList = freeLists.get(sizeClass);
        synchronized (freeList) {
            if (freeList.size() < sizeClass.maxPooled()) {
                freeList.addLast(data);
                log.trace("Buffer returned to pool ({}), free: {}", sizeClass, freeList.size());
                return;
            }
        }
        log.debug("Pool full, buffer discarded ({})", sizeClass);
    }

    /**
     * Snapshot of allocation and reuse counters.
     */
    public PoolStats getStats() {
        return new PoolStats(
                allocated.get(BufferSizeClass.SMALL).get(),
                reused.get(BufferSizeClass.SMALL).get(),
                allocated.get(BufferSizeClass.MEDIUM).get(),
                reused.get(BufferSizeClass.MEDIUM).get(),
                allocated.get(BufferSizeClass.LARGE).get(),
                reused.get(BufferSizeClass.LARGE).get(),
                totalMemorySaved.get()
        );
    }

    /**
     * Drop every pooled buffer.
     */
    public void clear() {
        for (ArrayDeque<byte[]> freeList : freeLists.values()) {
            synchronized (freeList) {
                freeList.clear();
            }
        }
        log.debug("Memory pool cleared");
    }

    /**
     * Total capacity of buffers currently sitting in the free lists.
     */
    public long currentMemoryUsage() {
        long total = 0;
        for (ArrayDeque<byte[]> freeList : freeLists.values()) {
            synchronized (freeList) {
                for (byte[] buffer : freeList) {
                    total += buffer.length;
                }
            }
        }
        return total;
    }

    /**
     * Number of free buffers held for a size class.
     */
    public int pooledBufferCount(BufferSizeClass sizeClass) {
        ArrayDeque<byte[]> freeList = freeLists.get(sizeClass);
        synchronized (freeList) {
            return freeList.size();
        }
    }
}

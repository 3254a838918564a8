package com.batchpool.memory;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Byte buffer borrowed from a {@link MemoryPool}.
 * <p>
 * Owned exclusively by the caller until {@link #close()}, which hands the backing
 * array back to the free list of the size class it was acquired from. Any access
 * after close fails with {@link IllegalStateException}. Not thread-safe.
 */
public final class ManagedBuffer implements AutoCloseable {

    private final MemoryPool pool;
    private final BufferSizeClass sizeClass;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private byte[] data;
    private int length;

    ManagedBuffer(MemoryPool pool, BufferSizeClass sizeClass, byte[] data, int length) {
        this.pool = pool;
        this.sizeClass = sizeClass;
        this.data = data;
        this.length = length;
    }

    /**
     * Backing array. Only the first {@link #length()} bytes are meaningful.
     */
    public byte[] array() {
        ensureOpen();
        return data;
    }

    public int length() {
        ensureOpen();
        return length;
    }

    public int capacity() {
        ensureOpen();
        return data.length;
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Size class this buffer returns to on close.
     */
    public BufferSizeClass sizeClass() {
        return sizeClass;
    }

    /**
     * Change the logical length. Bytes exposed by growing are set to {@code fill}.
     */
    public void resize(int newLength, byte fill) {
        ensureOpen();
        if (newLength < 0) {
            throw new IllegalArgumentException("Length cannot be negative: " + newLength);
        }
        if (newLength > data.length) {
            data = Arrays.copyOf(data, newLength);
        }
        if (newLength > length) {
            Arrays.fill(data, length, newLength, fill);
        }
        length = newLength;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Return the backing array to the pool. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            byte[] released = data;
            data = null;
            length = 0;
            pool.release(sizeClass, released);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Buffer already returned to pool");
        }
    }
}

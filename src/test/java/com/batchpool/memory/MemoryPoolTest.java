package com.batchpool.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MemoryPool and ManagedBuffer.
 */
class MemoryPoolTest {

    private static final int KIB = 1024;
    private static final int MIB = 1024 * 1024;

    private MemoryPool pool;

    @BeforeEach
    void setUp() {
        pool = new MemoryPool();
    }

    @ParameterizedTest
    @DisplayName("Should pick size class by breakpoints")
    @CsvSource({
            "0, SMALL",
            "1048575, SMALL",
            "1048576, MEDIUM",
            "10485759, MEDIUM",
            "10485760, LARGE",
            "104857600, LARGE"
    })
    void shouldPickSizeClass(long size, BufferSizeClass expected) {
        assertEquals(expected, BufferSizeClass.forSize(size));
    }

    @Test
    @DisplayName("Should reuse a released buffer for an equal or smaller request")
    void shouldReuseReleasedBuffer() {
        try (ManagedBuffer buffer = pool.acquire(64 * KIB)) {
            assertEquals(64 * KIB, buffer.length());
        }
        PoolStats afterFirst = pool.getStats();
        assertEquals(1, afterFirst.allocated(BufferSizeClass.SMALL));
        assertEquals(0, afterFirst.reused(BufferSizeClass.SMALL));

        try (ManagedBuffer buffer = pool.acquire(32 * KIB)) {
            assertEquals(32 * KIB, buffer.length());
            assertTrue(buffer.capacity() >= 64 * KIB);
        }

        PoolStats stats = pool.getStats();
        assertEquals(1, stats.allocated(BufferSizeClass.SMALL));
        assertEquals(1, stats.reused(BufferSizeClass.SMALL));
        assertEquals(32 * KIB, stats.totalMemorySaved());
        assertEquals(50.0, stats.reuseRate(), 0.0001);
    }

    @Test
    @DisplayName("Should allocate when pooled buffers are too small")
    void shouldAllocateWhenTooSmall() {
        pool.acquire(16 * KIB).close();
        pool.acquire(64 * KIB).close();

        PoolStats stats = pool.getStats();
        assertEquals(2, stats.smallAllocated());
        assertEquals(0, stats.smallReused());
        assertEquals(2, pool.pooledBufferCount(BufferSizeClass.SMALL));
    }

    @Test
    @DisplayName("Should hand out zeroed data on reuse")
    void shouldZeroReusedBuffer() {
        ManagedBuffer first = pool.acquire(128);
        first.array()[0] = 42;
        first.array()[127] = 7;
        first.close();

        try (ManagedBuffer second = pool.acquire(128)) {
            for (int i = 0; i < second.length(); i++) {
                assertEquals(0, second.array()[i]);
            }
        }
    }

    @Test
    @DisplayName("Should keep medium and large classes separate")
    void shouldKeepClassesSeparate() {
        pool.acquire(2 * MIB).close();
        pool.acquire(12 * MIB).close();

        assertEquals(0, pool.pooledBufferCount(BufferSizeClass.SMALL));
        assertEquals(1, pool.pooledBufferCount(BufferSizeClass.MEDIUM));
        assertEquals(1, pool.pooledBufferCount(BufferSizeClass.LARGE));
        assertEquals(14L * MIB, pool.currentMemoryUsage());

        pool.acquire(2 * MIB).close();
        PoolStats stats = pool.getStats();
        assertEquals(1, stats.mediumReused());
        assertEquals(0, stats.largeReused());
    }

    @Test
    @DisplayName("Should cap the number of pooled buffers per class")
    void shouldCapFreeList() {
        List<ManagedBuffer> buffers = new ArrayList<>();
        for (int i = 0; i < BufferSizeClass.SMALL.maxPooled() + 5; i++) {
            buffers.add(pool.acquire(16));
        }
        buffers.forEach(ManagedBuffer::close);

        assertEquals(BufferSizeClass.SMALL.maxPooled(), pool.pooledBufferCount(BufferSizeClass.SMALL));
    }

    @Test
    @DisplayName("Should drop buffers grown past the pool ceiling")
    void shouldDropOversizedBuffer() {
        ManagedBuffer buffer = pool.acquire(16);
        buffer.resize(MemoryPool.MAX_POOLED_SIZE + 1, (byte) 0);
        buffer.close();

        assertEquals(0, pool.pooledBufferCount(BufferSizeClass.SMALL));
    }

    @Test
    @DisplayName("Should fail on access after close and tolerate double close")
    void shouldFailAfterClose() {
        ManagedBuffer buffer = pool.acquire(32);
        buffer.close();
        buffer.close();

        assertTrue(buffer.isClosed());
        assertThrows(IllegalStateException.class, buffer::array);
        assertThrows(IllegalStateException.class, buffer::length);
        assertThrows(IllegalStateException.class, () -> buffer.resize(10, (byte) 1));
        assertEquals(1, pool.pooledBufferCount(BufferSizeClass.SMALL));
    }

    @Test
    @DisplayName("Should fill grown region on resize")
    void shouldResize() {
        try (ManagedBuffer buffer = pool.acquire(4)) {
            buffer.resize(8, (byte) 9);
            assertEquals(8, buffer.length());
            assertEquals(9, buffer.array()[7]);
            assertEquals(0, buffer.array()[3]);

            buffer.resize(0, (byte) 0);
            assertTrue(buffer.isEmpty());
        }
    }

    @Test
    @DisplayName("Should clear pooled buffers")
    void shouldClear() {
        pool.acquire(1024).close();
        pool.acquire(2 * MIB).close();
        pool.clear();

        assertEquals(0, pool.currentMemoryUsage());
        assertEquals(0, pool.pooledBufferCount(BufferSizeClass.SMALL));
        assertEquals(0, pool.pooledBufferCount(BufferSizeClass.MEDIUM));
    }

    @Test
    @DisplayName("Should never hand the same array to two holders at once")
    void shouldNotShareArraysConcurrently() throws InterruptedException {
        int threads = 8;
        int iterations = 500;
        Set<byte[]> inUse = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
        AtomicBoolean shared = new AtomicBoolean(false);
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            Thread worker = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < iterations; i++) {
                    try (ManagedBuffer buffer = pool.acquire(256)) {
                        byte[] array = buffer.array();
                        if (!inUse.add(array)) {
                            shared.set(true);
                        }
                        inUse.remove(array);
                    }
                }
            });
            workers.add(worker);
            worker.start();
        }
        start.countDown();
        for (Thread worker : workers) {
            worker.join();
        }

        assertFalse(shared.get());
        PoolStats stats = pool.getStats();
        assertEquals((long) threads * iterations, stats.smallAllocated() + stats.smallReused());
    }
}

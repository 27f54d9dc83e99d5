/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChunkBufferPoolTest {

    private ChunkBufferPool pool;

    @BeforeEach
    void setUp() {
        pool = new ChunkBufferPool(1024);
    }

    @Test
    void constructor_withInvalidBufferSize_throwsException() {
        assertThatThrownBy(() -> new ChunkBufferPool(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bufferSize must be positive");

        assertThatThrownBy(() -> new ChunkBufferPool(ChunkBufferPool.MAX_BUFFER_SIZE + 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not exceed");
    }

    @Test
    void acquire_returnsBufferWithDoubledCapacity() {
        PooledBuffer buffer = pool.acquire();

        assertThat(buffer.isAcquired()).isTrue();
        assertThat(buffer.capacity()).isEqualTo(2048);
        assertThat(buffer.storage().position()).isZero();
        assertThat(buffer.storage().limit()).isEqualTo(1024);
        assertThat(buffer.length()).isZero();
    }

    @Test
    void release_thenAcquire_reusesSameBufferCleared() {
        PooledBuffer buffer = pool.acquire();
        buffer.storage().put("some bytes".getBytes(StandardCharsets.US_ASCII));
        pool.release(buffer);

        assertThat(buffer.isAcquired()).isFalse();

        PooledBuffer reused = pool.acquire();
        assertThat(reused).isSameAs(buffer);
        assertThat(reused.length()).isZero();
        assertThat(reused.storage().limit()).isEqualTo(1024);

        ChunkBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.buffersCreated()).isEqualTo(1);
        assertThat(stats.buffersReused()).isEqualTo(1);
        assertThat(stats.buffersReleased()).isEqualTo(1);
        assertThat(stats.acquiredBuffers()).isEqualTo(1);
    }

    @Test
    void release_withNullBuffer_doesNothing() {
        pool.release(null);

        assertThat(pool.getStatistics().buffersReleased()).isZero();
    }

    @Test
    void release_twice_throwsException() {
        PooledBuffer buffer = pool.acquire();
        pool.release(buffer);

        assertThatThrownBy(() -> pool.release(buffer))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("released twice");
        assertThat(pool.getStatistics().availableBuffers()).isEqualTo(1);
    }

    @Test
    void release_bufferFromAnotherPool_throwsException() {
        ChunkBufferPool other = new ChunkBufferPool(1024);
        PooledBuffer foreign = other.acquire();

        assertThatThrownBy(() -> pool.release(foreign))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not belong to this pool");
        assertThat(foreign.isAcquired()).isTrue();
    }

    @Test
    void releasedBuffer_rejectsAccess() {
        PooledBuffer buffer = pool.acquire();
        pool.release(buffer);

        assertThatThrownBy(buffer::storage).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(buffer::contents).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void seed_preallocatesBuffers() {
        pool.seed(5);

        ChunkBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.availableBuffers()).isEqualTo(5);
        assertThat(stats.buffersCreated()).isEqualTo(5);

        for (int i = 0; i < 5; i++) {
            pool.acquire();
        }
        stats = pool.getStatistics();
        assertThat(stats.buffersCreated()).isEqualTo(5);
        assertThat(stats.buffersReused()).isEqualTo(5);
        assertThat(stats.hitRate()).isEqualTo(100.0);

        pool.acquire();
        assertThat(pool.getStatistics().buffersCreated()).isEqualTo(6);
    }

    @Test
    void seed_withNegativeCount_throwsException() {
        assertThatThrownBy(() -> pool.seed(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ensureRemaining_growsStoragePreservingContent() {
        PooledBuffer buffer = pool.acquire();
        byte[] head = new byte[1024];
        for (int i = 0; i < head.length; i++) {
            head[i] = (byte) i;
        }
        buffer.storage().put(head);

        // within the doubled capacity: no reallocation
        ByteBuffer storage = buffer.ensureRemaining(1000);
        assertThat(storage.capacity()).isEqualTo(2048);
        storage.put(new byte[1000]);

        // beyond it: grows and keeps what was written
        storage = buffer.ensureRemaining(100);
        assertThat(storage.capacity()).isEqualTo(4096);
        assertThat(buffer.length()).isEqualTo(2024);

        ByteBuffer contents = buffer.contents();
        assertThat(contents.remaining()).isEqualTo(2024);
        byte[] copy = new byte[1024];
        contents.get(copy);
        assertThat(copy).isEqualTo(head);
    }

    @Test
    void grownBuffer_keepsCapacityWhenPooled() {
        PooledBuffer buffer = pool.acquire();
        buffer.ensureRemaining(5000);
        pool.release(buffer);

        PooledBuffer reused = pool.acquire();
        assertThat(reused).isSameAs(buffer);
        assertThat(reused.capacity()).isGreaterThanOrEqualTo(5000);
        assertThat(reused.storage().limit()).isEqualTo(1024);
    }

    @Test
    void clear_dropsAvailableBuffersOnly() {
        PooledBuffer kept = pool.acquire();
        pool.seed(3);

        pool.clear();

        assertThat(pool.getStatistics().availableBuffers()).isZero();
        pool.release(kept);
        assertThat(pool.getStatistics().availableBuffers()).isEqualTo(1);
    }

    @Test
    void concurrentAcquireAndRelease_neverSharesBuffers() throws Exception {
        final int threadCount = 8;
        final int iterations = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        Set<PooledBuffer> inUse = ConcurrentHashMap.newKeySet();
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch startLatch = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threadCount; t++) {
                futures.add(executor.submit(() -> {
                    try {
                        startLatch.await();
                        for (int i = 0; i < iterations; i++) {
                            PooledBuffer buffer = pool.acquire();
                            if (!inUse.add(buffer)) {
                                errors.add(new AssertionError("Buffer handed out twice: " + buffer));
                            }
                            buffer.storage().putInt(i);
                            inUse.remove(buffer);
                            pool.release(buffer);
                        }
                    } catch (Throwable e) {
                        errors.add(e);
                    }
                    return null;
                }));
            }

            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
        }

        assertThat(errors).isEmpty();
        ChunkBufferPool.PoolStatistics stats = pool.getStatistics();
        assertThat(stats.acquiredBuffers()).isZero();
        assertThat(stats.buffersReleased()).isEqualTo((long) threadCount * iterations);
        assertThat(stats.buffersCreated()).isLessThanOrEqualTo(threadCount);
    }

    @Test
    void toString_includesStatistics() {
        pool.seed(2);
        pool.acquire();

        assertThat(pool.toString()).contains("bufferSize=1024", "available=1", "acquired=1", "created=2");
    }
}

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

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe free list of {@link PooledBuffer} instances of a fixed initial size, used to
 * avoid allocating a new buffer for every chunk of a large stream.
 * <p>
 * Each buffer is created with a length of {@link #bufferSize()} bytes and twice that as
 * capacity, so a chunk can be extended up to the end of a delimited record without
 * reallocating. Buffers that had to grow keep their bigger storage when released.
 * <p>
 * <strong>Ownership:</strong> {@link #acquire()} hands out a buffer that is exclusively owned
 * by the caller until it is passed to {@link #release(PooledBuffer)}. A buffer is never
 * handed out twice before being released, and releasing a buffer that is not acquired, or
 * that belongs to another pool, fails with {@link IllegalStateException}.
 * <p>
 * <strong>Thread Safety:</strong> {@code acquire} and {@code release} can be called
 * concurrently from any number of threads.
 * <p>
 * Pools are cheap and meant to be created per ingestion rather than shared, so independent
 * ingestions never exchange buffers.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ChunkBufferPool pool = new ChunkBufferPool(64 * 1024);
 * pool.seed(4);
 *
 * PooledBuffer buffer = pool.acquire();
 * try {
 *     channel.read(buffer.storage());
 *     process(buffer.contents());
 * } finally {
 *     pool.release(buffer);
 * }
 * }</pre>
 */
public class ChunkBufferPool {

    private static final Logger logger = LoggerFactory.getLogger(ChunkBufferPool.class);

    /** Largest buffer size for which the doubled capacity still fits in an array. */
    public static final int MAX_BUFFER_SIZE = (Integer.MAX_VALUE - 8) / 2;

    /** Free list of released buffers. */
    private final ConcurrentLinkedQueue<PooledBuffer> available = new ConcurrentLinkedQueue<>();

    /** Current count of buffers in the free list. */
    private final AtomicInteger availableCount = new AtomicInteger(0);

    /** Current count of buffers handed out and not yet released. */
    private final AtomicInteger acquiredCount = new AtomicInteger(0);

    /** Initial length of every buffer. */
    private final int bufferSize;

    /** Statistics: total buffers created. */
    private final AtomicLong buffersCreated = new AtomicLong(0);

    /** Statistics: total buffers reused from the free list. */
    private final AtomicLong buffersReused = new AtomicLong(0);

    /** Statistics: total buffers released. */
    private final AtomicLong buffersReleased = new AtomicLong(0);

    /**
     * Creates an empty pool of buffers of the given size.
     *
     * @param bufferSize initial length of every buffer, in bytes
     * @throws IllegalArgumentException if {@code bufferSize} is not positive or larger than {@link #MAX_BUFFER_SIZE}
     */
    public ChunkBufferPool(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        if (bufferSize > MAX_BUFFER_SIZE) {
            throw new IllegalArgumentException("bufferSize must not exceed " + MAX_BUFFER_SIZE + ": " + bufferSize);
        }
        this.bufferSize = bufferSize;
        logger.debug("Created ChunkBufferPool: bufferSize={}", bufferSize);
    }

    /**
     * @return the initial length of the buffers handed out by this pool
     */
    public int bufferSize() {
        return bufferSize;
    }

    /**
     * Eagerly creates {@code count} buffers and puts them in the free list.
     * <p>
     * This only pre-warms the pool; {@link #acquire()} allocates on demand anyway.
     *
     * @param count number of buffers to create
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public void seed(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("seed count cannot be negative: " + count);
        }
        for (int i = 0; i < count; i++) {
            PooledBuffer buffer = new PooledBuffer(this, bufferSize);
            buffersCreated.incrementAndGet();
            available.offer(buffer);
            availableCount.incrementAndGet();
        }
        if (count > 0) {
            logger.debug("Seeded pool with {} buffers of {} bytes", count, bufferSize);
        }
    }

    /**
     * Takes a buffer from the free list, or creates one if the free list is empty.
     * <p>
     * The returned buffer is positioned at zero with a limit of {@link #bufferSize()}. Its
     * content is undefined: it may hold bytes of a previous chunk.
     *
     * @return a buffer exclusively owned by the caller
     */
    public PooledBuffer acquire() {
        PooledBuffer buffer = available.poll();
        if (buffer != null) {
            availableCount.decrementAndGet();
            buffersReused.incrementAndGet();
            logger.trace("Reused buffer: capacity={}", buffer.capacity());
        } else {
            buffer = new PooledBuffer(this, bufferSize);
            buffersCreated.incrementAndGet();
            logger.trace("Created new buffer: size={}, capacity={}", bufferSize, buffer.capacity());
        }
        buffer.reset(bufferSize);
        buffer.markAcquired();
        acquiredCount.incrementAndGet();
        return buffer;
    }

    /**
     * Returns a buffer to the free list.
     * <p>
     * <strong>Important:</strong> After calling this method, the caller must not use the
     * buffer anymore, as it may be handed out to another thread right away.
     *
     * @param buffer the buffer to release (may be null, in which case this is a no-op)
     * @throws IllegalStateException if the buffer is not acquired or belongs to another pool
     */
    public void release(PooledBuffer buffer) {
        if (buffer == null) {
            return;
        }
        if (buffer.pool() != this) {
            throw new IllegalStateException("Buffer does not belong to this pool");
        }
        buffer.markAvailable();
        buffer.reset(bufferSize);
        acquiredCount.decrementAndGet();
        buffersReleased.incrementAndGet();
        available.offer(buffer);
        availableCount.incrementAndGet();
        logger.trace("Released buffer to pool: capacity={}", buffer.capacity());
    }

    /**
     * Drops all buffers in the free list. Acquired buffers are not affected and can still be
     * released afterwards.
     */
    public void clear() {
        int cleared = 0;
        while (available.poll() != null) {
            availableCount.decrementAndGet();
            cleared++;
        }
        logger.debug("Cleared pool: {} buffers", cleared);
    }

    /**
     * Gets statistics about pool usage.
     *
     * @return pool statistics
     */
    public PoolStatistics getStatistics() {
        return new PoolStatistics(
                availableCount.get(),
                acquiredCount.get(),
                buffersCreated.get(),
                buffersReused.get(),
                buffersReleased.get());
    }

    @Override
    public String toString() {
        PoolStatistics stats = getStatistics();
        return String.format(
                "ChunkBufferPool[bufferSize=%d, available=%d, acquired=%d, created=%d, reused=%d, released=%d]",
                bufferSize,
                stats.availableBuffers(),
                stats.acquiredBuffers(),
                stats.buffersCreated(),
                stats.buffersReused(),
                stats.buffersReleased());
    }

    /**
     * Immutable statistics snapshot for a chunk buffer pool.
     *
     * @param availableBuffers current number of buffers in the free list
     * @param acquiredBuffers current number of buffers handed out and not yet released
     * @param buffersCreated total number of buffers created, including seeded ones
     * @param buffersReused total number of acquisitions served from the free list
     * @param buffersReleased total number of buffers released
     */
    public record PoolStatistics(
            int availableBuffers, int acquiredBuffers, long buffersCreated, long buffersReused, long buffersReleased) {

        /**
         * Calculates the hit rate (percentage of acquisitions satisfied from the free list).
         * Seeded buffers count as created, so a fully pre-warmed pool reports reuse on every
         * acquisition.
         *
         * @return hit rate as a percentage (0.0 to 100.0)
         */
        public double hitRate() {
            long totalAcquisitions = buffersReleased + acquiredBuffers;
            return totalAcquisitions > 0 ? (buffersReused * 100.0) / totalAcquisitions : 0.0;
        }
    }
}

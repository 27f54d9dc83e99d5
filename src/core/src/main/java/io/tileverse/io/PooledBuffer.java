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

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A heap buffer handed out by a {@link ChunkBufferPool}, with explicit ownership.
 * <p>
 * A pooled buffer is either <em>available</em> (sitting in its pool's free list) or
 * <em>acquired</em> (exclusively owned by whoever called {@link ChunkBufferPool#acquire()}).
 * Ownership may be handed over to another thread, but a buffer is never shared: the
 * current owner is the only one allowed to touch it until it calls
 * {@link ChunkBufferPool#release(PooledBuffer)}.
 * <p>
 * The backing storage starts with twice the pool's buffer size as capacity, and a limit
 * equal to the buffer size. {@link #ensureRemaining(int)} lifts the limit and grows the
 * storage when more bytes have to be appended, for example to complete a delimited record.
 * <p>
 * <strong>Thread Safety:</strong> only the ownership transitions are thread-safe. The
 * contents must be accessed by the owner only.
 */
public final class PooledBuffer {

    /** Largest array size the JVM reliably allocates, and thus the longest possible chunk. */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final ChunkBufferPool pool;

    private final AtomicBoolean acquired = new AtomicBoolean(false);

    private ByteBuffer storage;

    PooledBuffer(ChunkBufferPool pool, int size) {
        this.pool = pool;
        this.storage = ByteBuffer.allocate(Math.multiplyExact(size, 2));
        reset(size);
    }

    /**
     * Returns the backing storage, in write mode: data is appended at its position.
     * <p>
     * The returned instance may be replaced by a bigger one after a call to
     * {@link #ensureRemaining(int)}, callers must not hold on to it across that call.
     *
     * @return the current backing buffer
     * @throws IllegalStateException if this buffer is not acquired
     */
    public ByteBuffer storage() {
        checkAcquired();
        return storage;
    }

    /**
     * Makes room for at least {@code count} more bytes after the current position.
     * <p>
     * The limit is lifted to the capacity first; if that is still not enough, the storage is
     * replaced by one at least twice as big, preserving the bytes written so far.
     *
     * @param count number of bytes about to be appended
     * @return the (possibly new) backing storage, positioned after the existing content
     * @throws IllegalStateException if this buffer is not acquired
     */
    public ByteBuffer ensureRemaining(int count) {
        checkAcquired();
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        storage.limit(storage.capacity());
        if (storage.remaining() < count) {
            int required = Math.addExact(storage.position(), count);
            int newCapacity = (int) Math.max(required, Math.min(MAX_CAPACITY, 2L * storage.capacity()));
            ByteBuffer grown = ByteBuffer.allocate(newCapacity);
            storage.flip();
            grown.put(storage);
            storage = grown;
        }
        return storage;
    }

    /**
     * @return the number of bytes written so far
     */
    public int length() {
        return storage.position();
    }

    /**
     * @return the capacity of the backing storage
     */
    public int capacity() {
        return storage.capacity();
    }

    /**
     * Returns a view of the bytes written so far, positioned at zero with its limit at
     * {@link #length()}. The view shares the backing storage.
     *
     * @return a read-mode view of the contents
     * @throws IllegalStateException if this buffer is not acquired
     */
    public ByteBuffer contents() {
        checkAcquired();
        return storage.duplicate().flip();
    }

    /**
     * @return {@code true} if this buffer is currently owned by a caller of {@link ChunkBufferPool#acquire()}
     */
    public boolean isAcquired() {
        return acquired.get();
    }

    ChunkBufferPool pool() {
        return pool;
    }

    void markAcquired() {
        if (!acquired.compareAndSet(false, true)) {
            throw new IllegalStateException("Buffer is already acquired");
        }
    }

    void markAvailable() {
        if (!acquired.compareAndSet(true, false)) {
            throw new IllegalStateException("Buffer is not acquired, it can't be released twice");
        }
    }

    void reset(int size) {
        storage.clear().limit(Math.min(size, storage.capacity()));
    }

    private void checkAcquired() {
        if (!acquired.get()) {
            throw new IllegalStateException("Buffer is not acquired");
        }
    }

    @Override
    public String toString() {
        return "PooledBuffer[length=%d, capacity=%d, acquired=%s]".formatted(length(), capacity(), acquired.get());
    }
}

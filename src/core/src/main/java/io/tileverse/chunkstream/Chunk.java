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
package io.tileverse.chunkstream;

import io.tileverse.io.PooledBuffer;
import java.nio.ByteBuffer;

/**
 * A slice of the source handed to a {@link ChunkProcessor}.
 * <p>
 * The bytes live in a pooled buffer that goes back to the pool as soon as the processor
 * returns; after that, {@link #buffer()} and {@link #toByteArray()} throw
 * {@link IllegalStateException}.
 */
public final class Chunk {

    private final long sequence;
    private final long offset;
    private final int length;
    private final PooledBuffer storage;
    private volatile boolean released;

    Chunk(long sequence, long offset, PooledBuffer storage) {
        this.sequence = sequence;
        this.offset = offset;
        this.storage = storage;
        this.length = storage.length();
    }

    /**
     * @return the 0-based position of this chunk in dispatch (and source) order
     */
    public long sequence() {
        return sequence;
    }

    /**
     * @return the position of this chunk's first byte in the source
     */
    public long offset() {
        return offset;
    }

    /**
     * @return the number of bytes in this chunk
     */
    public int length() {
        return length;
    }

    /**
     * Returns a read-only view of the chunk's bytes, positioned at zero with a limit of
     * {@link #length()}. Each call returns a new view.
     *
     * @return the chunk bytes
     * @throws IllegalStateException if the processor already returned
     */
    public ByteBuffer buffer() {
        checkNotReleased();
        return storage.contents().asReadOnlyBuffer();
    }

    /**
     * @return a copy of the chunk bytes
     * @throws IllegalStateException if the processor already returned
     */
    public byte[] toByteArray() {
        ByteBuffer view = buffer();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }

    /**
     * @param delimiter the delimiter byte
     * @return whether the last byte of this chunk is {@code delimiter}
     * @throws IllegalStateException if the processor already returned
     */
    public boolean endsWithDelimiter(byte delimiter) {
        ByteBuffer view = buffer();
        return length > 0 && view.get(length - 1) == delimiter;
    }

    PooledBuffer storage() {
        return storage;
    }

    void release() {
        released = true;
    }

    private void checkNotReleased() {
        if (released) {
            throw new IllegalStateException("Chunk " + sequence + " was released, its buffer is no longer accessible");
        }
    }

    @Override
    public String toString() {
        return "Chunk[sequence=%d, offset=%d, length=%d]".formatted(sequence, offset, length);
    }
}

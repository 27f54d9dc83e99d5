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
package io.tileverse.chunkstream.reader;

import io.tileverse.io.PooledBuffer;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.Objects;

/**
 * Cuts a sequential byte source into chunks, optionally aligned on a delimiter byte.
 * <p>
 * Each call to {@link #readChunk(PooledBuffer)} first fills the buffer up to its limit (the
 * pool's buffer size) or to the end of the source. In delimited mode it then keeps appending
 * bytes up to and including the next delimiter, so a record is never split across two
 * chunks. If the rest of the source has no delimiter, it all goes into that chunk. In
 * fixed-size mode the chunk is exactly the initial fill.
 * <p>
 * A chunk can not grow past {@link PooledBuffer#MAX_CAPACITY} bytes. A record longer than
 * that fails the read with an {@link IOException} instead of being split.
 * <p>
 * Delimiter scanning goes through an internal read-ahead buffer, so bytes read past the
 * delimiter are kept for the next chunk rather than lost.
 * <p>
 * <strong>Thread Safety:</strong> This class is not thread-safe, and neither is the channel
 * it reads from. A reader belongs to the single thread driving an ingestion. The channel is
 * expected to be blocking, and is never closed by this class.
 */
public class ChunkReader {

    /** Size of the read-ahead buffer used while looking for a delimiter. */
    public static final int READ_AHEAD_SIZE = 8192;

    private final ReadableByteChannel channel;

    private final boolean delimited;

    private final byte delimiter;

    private final int maxChunkSize;

    /** Bytes read from the channel but not consumed yet, in read mode. */
    private final ByteBuffer readAhead;

    private boolean endOfSource;

    private long position;

    /**
     * Creates a reader producing delimiter-aligned chunks.
     *
     * @param channel the source
     * @param delimiter the end of record byte
     */
    public ChunkReader(ReadableByteChannel channel, byte delimiter) {
        this(channel, delimiter, false);
    }

    /**
     * Creates a reader.
     *
     * @param channel the source
     * @param delimiter the end of record byte, ignored if {@code noDelimiter} is {@code true}
     * @param noDelimiter {@code true} for fixed-size chunks
     */
    public ChunkReader(ReadableByteChannel channel, byte delimiter, boolean noDelimiter) {
        this(channel, delimiter, noDelimiter, PooledBuffer.MAX_CAPACITY);
    }

    ChunkReader(ReadableByteChannel channel, byte delimiter, boolean noDelimiter, int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.delimiter = delimiter;
        this.delimited = !noDelimiter;
        this.maxChunkSize = maxChunkSize;
        this.readAhead = ByteBuffer.allocate(READ_AHEAD_SIZE).limit(0);
    }

    /**
     * Reads the next chunk into {@code target}, appending at its position.
     *
     * @param target an acquired buffer, positioned at zero with its limit at the chunk size
     * @return the number of bytes in the chunk, or {@code -1} if the source is exhausted
     * @throws IOException if reading from the channel fails, or the chunk would exceed the maximum buffer size
     */
    public int readChunk(PooledBuffer target) throws IOException {
        Objects.requireNonNull(target, "target cannot be null");
        final int start = target.length();
        fill(target.storage());
        if (target.length() == start) {
            return -1;
        }
        if (delimited) {
            extendToDelimiter(target);
        }
        int length = target.length() - start;
        position += length;
        return length;
    }

    /**
     * @return the number of bytes returned in chunks so far, i.e. the source offset of the next chunk
     */
    public long position() {
        return position;
    }

    /**
     * @return whether the channel reported end of stream
     */
    public boolean isEndOfSource() {
        return endOfSource && !readAhead.hasRemaining();
    }

    private void fill(ByteBuffer dst) throws IOException {
        if (readAhead.hasRemaining()) {
            int count = Math.min(readAhead.remaining(), dst.remaining());
            ByteBuffer slice = readAhead.duplicate();
            slice.limit(slice.position() + count);
            dst.put(slice);
            readAhead.position(readAhead.position() + count);
        }
        // Read until the buffer is full or the source is exhausted
        while (dst.hasRemaining() && !endOfSource) {
            int read = channel.read(dst);
            if (read < 0) {
                endOfSource = true;
            }
        }
    }

    private void extendToDelimiter(PooledBuffer target) throws IOException {
        while (true) {
            if (!readAhead.hasRemaining() && !refill()) {
                return;
            }
            final int start = readAhead.position();
            final int limit = readAhead.limit();
            int end = start;
            boolean found = false;
            while (end < limit) {
                if (readAhead.get(end++) == delimiter) {
                    found = true;
                    break;
                }
            }
            if ((long) target.length() + (end - start) > maxChunkSize) {
                throw new IOException("Chunk at offset " + position + " exceeds maximum buffer size of " + maxChunkSize
                        + " bytes without a delimiter");
            }
            ByteBuffer slice = readAhead.duplicate();
            slice.limit(end);
            target.ensureRemaining(end - start).put(slice);
            readAhead.position(end);
            if (found) {
                return;
            }
        }
    }

    private boolean refill() throws IOException {
        if (endOfSource) {
            return false;
        }
        readAhead.clear();
        while (readAhead.position() == 0) {
            if (channel.read(readAhead) < 0) {
                endOfSource = true;
                break;
            }
        }
        readAhead.flip();
        return readAhead.hasRemaining();
    }
}

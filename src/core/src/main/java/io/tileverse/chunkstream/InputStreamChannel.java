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

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link ReadableByteChannel} reading from an {@link InputStream}, for ingestion.
 * <p>
 * Unlike {@link java.nio.channels.Channels#newChannel(InputStream)}, this channel is not
 * interruptible: interrupting the reading thread neither closes the channel nor the stream,
 * so the interruption surfaces where the ingestion checks it. Closing this channel does not
 * close the stream, which stays owned by the caller.
 * <p>
 * Heap buffers are read into directly through their backing array.
 */
final class InputStreamChannel implements ReadableByteChannel {

    private static final int TRANSFER_SIZE = 8192;

    private final InputStream in;

    private final AtomicBoolean open = new AtomicBoolean(true);

    private byte[] transfer;

    InputStreamChannel(InputStream in) {
        this.in = Objects.requireNonNull(in, "input stream cannot be null");
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (!open.get()) {
            throw new ClosedChannelException();
        }
        if (!dst.hasRemaining()) {
            return 0;
        }
        if (dst.hasArray()) {
            int read = in.read(dst.array(), dst.arrayOffset() + dst.position(), dst.remaining());
            if (read > 0) {
                dst.position(dst.position() + read);
            }
            return read;
        }
        if (transfer == null) {
            transfer = new byte[TRANSFER_SIZE];
        }
        int read = in.read(transfer, 0, Math.min(transfer.length, dst.remaining()));
        if (read > 0) {
            dst.put(transfer, 0, read);
        }
        return read;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /**
     * Closes this channel only, the stream is left open.
     */
    @Override
    public void close() {
        open.set(false);
    }
}

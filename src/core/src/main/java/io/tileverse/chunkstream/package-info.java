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

/**
 * Parallel, memory-bounded ingestion of large byte streams.
 * <p>
 * {@link io.tileverse.chunkstream.ChunkIngestor} reads a sequential source (a
 * {@link java.nio.channels.ReadableByteChannel} or an {@link java.io.InputStream}) in chunks of
 * a configured size, extended up to the next delimiter so that records are never split, and
 * calls a {@link io.tileverse.chunkstream.ChunkProcessor} for each chunk on a bounded number of
 * worker threads.
 *
 * <h2>Key Classes</h2>
 * <ul>
 * <li>{@link io.tileverse.chunkstream.IngestConfig} - workers, buffer size and seed, delimiter policy</li>
 * <li>{@link io.tileverse.chunkstream.IngestContext} - cooperative cancellation and deadlines</li>
 * <li>{@link io.tileverse.chunkstream.Chunk} - the bytes handed to the processor</li>
 * <li>{@link io.tileverse.chunkstream.IngestStatistics} - summary of a completed ingestion</li>
 * </ul>
 *
 * <h2>Counting Lines of a Large File</h2>
 * <pre>{@code
 * LongAdder lines = new LongAdder();
 * IngestConfig config = IngestConfig.builder()
 *         .processor((context, chunk) -> {
 *             ByteBuffer bytes = chunk.buffer();
 *             while (bytes.hasRemaining()) {
 *                 if (bytes.get() == '\n') {
 *                     lines.increment();
 *                 }
 *             }
 *         })
 *         .workers(Runtime.getRuntime().availableProcessors())
 *         .bufferSeed(4)
 *         .bufferSize(ByteSize.MB)
 *         .build();
 *
 * try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
 *     ChunkIngestor.ingest(config, IngestContext.background(), channel);
 * }
 * }</pre>
 *
 * <h2>Memory Usage</h2>
 * At most {@code workers} chunks are processed at once and one more is being read, so about
 * {@code workers + 1} buffers of {@code bufferSize} bytes are alive at any time, plus whatever
 * delimiter extension their records needed. With fixed-size chunks
 * ({@link io.tileverse.chunkstream.IngestConfig#noDelimiter() noDelimiter}) the bound is strict;
 * in delimited mode a source with no delimiter at all ends up in a single chunk.
 */
package io.tileverse.chunkstream;

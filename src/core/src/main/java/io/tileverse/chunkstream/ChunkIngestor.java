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

import io.tileverse.chunkstream.reader.ChunkReader;
import io.tileverse.io.ChunkBufferPool;
import io.tileverse.io.PooledBuffer;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.channels.ReadableByteChannel;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a byte stream in bounded, optionally delimiter-aligned chunks, and hands each chunk
 * to a {@link ChunkProcessor} running on up to {@link IngestConfig#workers() workers}
 * threads at a time.
 * <p>
 * The calling thread is the only one reading from the source. For every chunk it acquires a
 * buffer from a pool created for this ingestion, fills it with a {@link ChunkReader}, waits
 * for a free worker slot, and dispatches the chunk. Once the processor returns, the buffer
 * goes back to the pool and the slot is freed. Memory use is thus bounded by about
 * {@code workers + 1} buffers of {@code bufferSize} bytes plus their delimiter extensions.
 * <p>
 * <strong>Chunk size limit:</strong> a delimited chunk can grow up to
 * {@link io.tileverse.io.PooledBuffer#MAX_CAPACITY} bytes (just under 2 GiB). A source with
 * no delimiter over a longer stretch fails with an {@link IOException} reporting that the
 * chunk exceeds the maximum buffer size; use {@link IngestConfig#noDelimiter() fixed-size
 * chunks} for such data.
 * <p>
 * <strong>Outcome:</strong> {@code ingest} always waits for every dispatched chunk to be
 * processed before returning or throwing, so no processor is still running afterwards.
 * <ul>
 * <li>The source is exhausted: returns {@link IngestStatistics}.</li>
 * <li>Reading fails: the source's {@link IOException} is rethrown as is.</li>
 * <li>The context is cancelled: its {@link ContextCancelledException} (possibly a
 *     {@link DeadlineExceededException}) is thrown.</li>
 * <li>The configuration is incomplete: {@link InvalidConfigurationException} is thrown before
 *     anything is read.</li>
 * </ul>
 * <p>
 * <strong>Cancellation</strong> is cooperative and observed per chunk: the context is
 * checked before reading each chunk and while waiting for a worker slot. A chunk being read
 * when the context is cancelled is dropped rather than dispatched. Processors already
 * running are not interrupted; they receive the context and may check it themselves.
 * <p>
 * <strong>Processor failures</strong> are logged and otherwise ignored; they don't stop the
 * ingestion and are not retried.
 *
 * <pre>{@code
 * IngestConfig config = IngestConfig.builder()
 *         .processor((context, chunk) -> parseLines(chunk.buffer()))
 *         .workers(8)
 *         .bufferSize(ByteSize.MB)
 *         .build();
 *
 * try (InputStream in = Files.newInputStream(path)) {
 *     IngestStatistics stats = ChunkIngestor.ingest(config, IngestContext.background(), in);
 * }
 * }</pre>
 */
@Slf4j
public class ChunkIngestor {

    private static final AtomicInteger INGESTION_IDS = new AtomicInteger();

    private final IngestConfig config;

    /**
     * Creates an ingestor bound to a configuration. The configuration is only validated
     * when {@link #ingest(IngestContext, ReadableByteChannel) ingesting}.
     *
     * @param config the configuration
     */
    public ChunkIngestor(@NonNull IngestConfig config) {
        this.config = config;
    }

    /**
     * @return the configuration this ingestor was created with
     */
    public IngestConfig config() {
        return config;
    }

    /**
     * Ingests {@code source} with this ingestor's configuration.
     *
     * @param context the cancellation context
     * @param source the byte source, read sequentially and never closed
     * @return statistics of the ingestion
     * @throws IOException if reading from the source fails
     * @see #ingest(IngestConfig, IngestContext, ReadableByteChannel)
     */
    public IngestStatistics ingest(IngestContext context, ReadableByteChannel source) throws IOException {
        return ingest(config, context, source);
    }

    /**
     * Ingests {@code source} with this ingestor's configuration.
     *
     * @param context the cancellation context
     * @param source the byte source, read sequentially and never closed
     * @return statistics of the ingestion
     * @throws IOException if reading from the source fails
     * @see #ingest(IngestConfig, IngestContext, ReadableByteChannel)
     */
    public IngestStatistics ingest(IngestContext context, InputStream source) throws IOException {
        return ingest(config, context, source);
    }

    /**
     * Ingests an {@link InputStream}.
     *
     * @param config the configuration
     * @param context the cancellation context
     * @param source the byte source, read sequentially and never closed
     * @return statistics of the ingestion
     * @throws IOException if reading from the source fails
     * @see #ingest(IngestConfig, IngestContext, ReadableByteChannel)
     */
    public static IngestStatistics ingest(IngestConfig config, IngestContext context, InputStream source)
            throws IOException {
        ReadableByteChannel channel = source == null ? null : new InputStreamChannel(source);
        return ingest(config, context, channel);
    }

    /**
     * Ingests a {@link ReadableByteChannel}, blocking until every chunk has been processed.
     *
     * @param config the configuration, {@code null} is handled as an empty one
     * @param context the cancellation context, passed to every processor invocation
     * @param source the byte source, read sequentially from the calling thread and never closed
     * @return statistics of the ingestion, when the source was fully ingested
     * @throws InvalidConfigurationException if the context, the source, the processor or the buffer size is missing
     * @throws IOException if reading from the source fails, after the dispatched chunks are processed
     * @throws InterruptedIOException if the calling thread is interrupted while reading or waiting for a worker
     * @throws ContextCancelledException if the context is cancelled, after the dispatched chunks are processed
     */
    public static IngestStatistics ingest(IngestConfig config, IngestContext context, ReadableByteChannel source)
            throws IOException {
        IngestConfig effective = validate(config, context, source);
        return new Ingestion(effective, context, source).run();
    }

    /**
     * Checks what an ingestion needs before reading anything, and applies the defaults.
     *
     * @return the configuration with {@link IngestConfig#withDefaults() defaults} applied
     * @throws InvalidConfigurationException naming the first missing piece
     */
    static IngestConfig validate(IngestConfig config, IngestContext context, ReadableByteChannel source) {
        IngestConfig candidate = config == null ? IngestConfig.builder().build() : config;
        if (context == null) {
            throw new InvalidConfigurationException(ConfigurationError.MISSING_CONTEXT);
        }
        if (source == null) {
            throw new InvalidConfigurationException(ConfigurationError.NIL_SOURCE);
        }
        if (candidate.processor().isEmpty()) {
            throw new InvalidConfigurationException(ConfigurationError.MISSING_CALLBACK);
        }
        if (candidate.bufferSize() == 0) {
            throw new InvalidConfigurationException(ConfigurationError.MISSING_BUFFER_SIZE);
        }
        return candidate.withDefaults();
    }

    /**
     * State of a single call to {@code ingest}. Nothing in here is shared between ingestions.
     */
    private static class Ingestion {

        private final int id = INGESTION_IDS.incrementAndGet();
        private final IngestConfig config;
        private final IngestContext context;

        private final ChunkBufferPool pool;
        private final ConcurrencyGate gate;
        private final CompletionCoordinator coordinator;
        private final ChunkReader reader;

        private long chunks;
        private long bytes;

        Ingestion(IngestConfig config, IngestContext context, ReadableByteChannel source) {
            this.config = config;
            this.context = context;
            this.pool = new ChunkBufferPool(config.bufferSize());
            this.gate = new ConcurrencyGate(config.workers());
            this.coordinator = new CompletionCoordinator(context);
            this.reader = new ChunkReader(
                    source, config.delimiter().orElse(IngestConfig.DEFAULT_DELIMITER), config.noDelimiter());
        }

        IngestStatistics run() throws IOException {
            final long start = System.nanoTime();
            log.debug("Ingestion {} starting: {}", id, config);
            pool.seed(config.bufferSeed());

            ExecutorService ownExecutor = null;
            Executor executor = config.executor().orElse(null);
            if (executor == null) {
                ownExecutor = Executors.newFixedThreadPool(config.workers(), new WorkerThreadFactory(id));
                executor = ownExecutor;
            }
            ChunkDispatcher dispatcher = new ChunkDispatcher(
                    context, config.processor().orElseThrow(), executor, pool, gate, coordinator);

            IOException failure = null;
            IngestState outcome;
            try {
                failure = readLoop(dispatcher);
            } finally {
                coordinator.readLoopExited(failure);
                outcome = coordinator.awaitTermination();
                if (ownExecutor != null) {
                    ownExecutor.shutdown();
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.debug(
                    "Ingestion {} {}: {} chunks, {} bytes in {} ms, {}",
                    id,
                    outcome,
                    chunks,
                    bytes,
                    elapsed.toMillis(),
                    pool);

            switch (outcome) {
                case FAILED:
                    throw failure;
                case CANCELLED:
                    throw context.error().orElseGet(ContextCancelledException::new);
                default:
                    return new IngestStatistics(outcome, chunks, bytes, elapsed, pool.getStatistics());
            }
        }

        /**
         * @return the failure that ended the loop, or {@code null} if it ended on end of source or cancellation
         */
        private IOException readLoop(ChunkDispatcher dispatcher) {
            try {
                while (!context.isCancelled()) {
                    PooledBuffer buffer = pool.acquire();
                    boolean handedOver = false;
                    try {
                        final long offset = reader.position();
                        int length = reader.readChunk(buffer);
                        if (length < 0) {
                            log.trace("Ingestion {} reached end of source after {} chunks", id, chunks);
                            break;
                        }
                        if (!gate.acquire(context)) {
                            log.debug("Ingestion {} cancelled, dropping chunk at offset {}", id, offset);
                            break;
                        }
                        handedOver = true;
                        dispatcher.dispatch(new Chunk(chunks, offset, buffer));
                        chunks++;
                        bytes += length;
                    } finally {
                        if (!handedOver) {
                            pool.release(buffer);
                        }
                    }
                }
                return null;
            } catch (IOException e) {
                log.debug("Ingestion {} failed reading source after {} chunks: {}", id, chunks, e.toString());
                return e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                InterruptedIOException interrupted =
                        new InterruptedIOException("Interrupted while waiting for a worker slot");
                interrupted.initCause(e);
                return interrupted;
            } catch (RejectedExecutionException e) {
                return new IOException("Executor rejected chunk " + chunks, e);
            }
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger threads = new AtomicInteger();

        private final int ingestionId;

        WorkerThreadFactory(int ingestionId) {
            this.ingestionId = ingestionId;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(
                    task, "chunkstream-%d-worker-%d".formatted(ingestionId, threads.incrementAndGet()));
            thread.setDaemon(true);
            return thread;
        }
    }

    @Override
    public String toString() {
        return "ChunkIngestor[" + config + "]";
    }
}

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

import io.tileverse.io.ChunkBufferPool;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the processor for each chunk as an independent task, and returns the chunk's
 * resources when it's done.
 * <p>
 * Whatever way the processor returns, the chunk is invalidated, its buffer released to the
 * pool, its gate slot released and the coordinator notified, in that order.
 */
@Slf4j
final class ChunkDispatcher {

    private final IngestContext context;
    private final ChunkProcessor processor;
    private final Executor executor;
    private final ChunkBufferPool pool;
    private final ConcurrencyGate gate;
    private final CompletionCoordinator coordinator;

    ChunkDispatcher(
            IngestContext context,
            ChunkProcessor processor,
            Executor executor,
            ChunkBufferPool pool,
            ConcurrencyGate gate,
            CompletionCoordinator coordinator) {
        this.context = context;
        this.processor = processor;
        this.executor = executor;
        this.pool = pool;
        this.gate = gate;
        this.coordinator = coordinator;
    }

    /**
     * Hands {@code chunk} over to a worker. The caller must hold a gate slot, which is
     * transferred along with the chunk's buffer, even if this method throws.
     *
     * @param chunk the chunk to process
     * @throws RejectedExecutionException if the executor refuses the task
     */
    void dispatch(Chunk chunk) {
        coordinator.register();
        try {
            executor.execute(() -> process(chunk));
        } catch (RejectedExecutionException e) {
            complete(chunk);
            throw e;
        }
    }

    private void process(Chunk chunk) {
        try {
            processor.process(context, chunk);
        } catch (RuntimeException e) {
            log.warn("Chunk processor failed on {}", chunk, e);
        } finally {
            complete(chunk);
        }
    }

    private void complete(Chunk chunk) {
        chunk.release();
        pool.release(chunk.storage());
        gate.release();
        coordinator.arrive();
        log.trace("Processed {}", chunk);
    }
}

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

import io.tileverse.io.ChunkBufferPool.PoolStatistics;
import java.time.Duration;

/**
 * Summary of a successful ingestion.
 *
 * @param state the terminal state, always {@link IngestState#COMPLETED} when returned by {@link ChunkIngestor}
 * @param chunksDispatched number of chunks handed to the processor
 * @param bytesRead number of bytes read from the source and dispatched
 * @param elapsed wall clock time of the ingestion
 * @param bufferPool statistics of the buffer pool used by the ingestion
 */
public record IngestStatistics(
        IngestState state, long chunksDispatched, long bytesRead, Duration elapsed, PoolStatistics bufferPool) {

    /**
     * @return average chunk length in bytes, or zero if nothing was dispatched
     */
    public double averageChunkSize() {
        return chunksDispatched > 0 ? (double) bytesRead / chunksDispatched : 0.0;
    }
}

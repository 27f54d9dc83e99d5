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

/**
 * Caller supplied function invoked once per chunk, on a worker thread.
 * <p>
 * Implementations may run concurrently with each other, up to the configured number of
 * workers, and must therefore be thread-safe. The chunk is only valid until this method
 * returns: copy what must outlive the call.
 * <p>
 * There is no failure channel back to the ingestion. A processor that needs to report
 * errors does so through its own means (e.g. a shared error collector), and may cancel the
 * context to stop the ingestion. A {@link RuntimeException} escaping this method is logged
 * and otherwise ignored.
 */
@FunctionalInterface
public interface ChunkProcessor {

    /**
     * Processes one chunk.
     *
     * @param context the ingestion context, check it to cooperate with cancellation
     * @param chunk the chunk, valid only for the duration of the call
     */
    void process(IngestContext context, Chunk chunk);
}

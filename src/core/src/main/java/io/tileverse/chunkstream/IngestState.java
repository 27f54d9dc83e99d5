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
 * Lifecycle of a single ingestion.
 */
public enum IngestState {
    /** The read loop is active and chunks may be in flight. */
    RUNNING,
    /** The read loop exited, waiting for in-flight chunks to be processed. */
    DRAINING,
    /** The source was exhausted and every chunk was processed. */
    COMPLETED,
    /** The context was cancelled before every chunk was processed. */
    CANCELLED,
    /** Reading from the source failed. */
    FAILED;

    /**
     * @return whether this is a final state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}

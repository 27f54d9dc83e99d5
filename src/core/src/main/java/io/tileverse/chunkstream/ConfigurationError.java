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
 * Reasons an ingestion is refused before reading anything.
 *
 * @see InvalidConfigurationException
 */
public enum ConfigurationError {
    /** No {@link IngestContext} was given. */
    MISSING_CONTEXT("missing ingest context"),
    /** No byte source was given. */
    NIL_SOURCE("nil byte source"),
    /** The configuration has no {@link ChunkProcessor}. */
    MISSING_CALLBACK("missing chunk processor"),
    /** The configuration has no buffer size. */
    MISSING_BUFFER_SIZE("missing buffer size");

    private final String message;

    ConfigurationError(String message) {
        this.message = message;
    }

    /**
     * @return a short human readable description of this error
     */
    public String message() {
        return message;
    }
}

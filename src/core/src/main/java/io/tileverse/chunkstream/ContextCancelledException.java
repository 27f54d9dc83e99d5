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

import java.util.concurrent.CancellationException;

/**
 * The error of a cancelled {@link IngestContext}, thrown by {@link ChunkIngestor} once all
 * the chunks dispatched before the cancellation have been processed.
 */
public class ContextCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    /** Creates an exception with the default message. */
    public ContextCancelledException() {
        this("context cancelled");
    }

    /**
     * @param message the detail message
     */
    public ContextCancelledException(String message) {
        super(message);
    }
}

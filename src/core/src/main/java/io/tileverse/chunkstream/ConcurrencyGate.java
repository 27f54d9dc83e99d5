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

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Admission control limiting the number of chunks processed at the same time.
 * <p>
 * The reading thread acquires a slot before dispatching each chunk and blocks while all
 * slots are taken; the worker releases it once the processor returns.
 */
final class ConcurrencyGate {

    /** How often a blocked {@link #acquire(IngestContext)} checks for cancellation. */
    static final long CANCELLATION_POLL_MILLIS = 10;

    private final Semaphore slots;

    private final int capacity;

    ConcurrencyGate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
    }

    /**
     * Takes a slot, waiting for one to be released if needed.
     *
     * @param context checked while waiting
     * @return {@code true} if a slot was taken, {@code false} if the context got cancelled first
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    boolean acquire(IngestContext context) throws InterruptedException {
        while (!context.isCancelled()) {
            if (slots.tryAcquire(CANCELLATION_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    void release() {
        slots.release();
    }

    int capacity() {
        return capacity;
    }

    /**
     * @return number of slots currently taken
     */
    int inUse() {
        return capacity - slots.availablePermits();
    }
}

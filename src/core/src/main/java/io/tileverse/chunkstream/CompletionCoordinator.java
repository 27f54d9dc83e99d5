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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks the chunks in flight and decides how an ingestion ends.
 * <p>
 * The outstanding count starts at one, held by the read loop itself, so it can only drop to
 * zero once the loop has {@link #readLoopExited(IOException) exited} and every dispatched
 * chunk has {@link #arrive() arrived}. At that moment the outcome is fixed, exactly once:
 * {@link IngestState#FAILED} if the loop recorded a read failure, otherwise
 * {@link IngestState#CANCELLED} if the context is cancelled by then, otherwise
 * {@link IngestState#COMPLETED}.
 */
@Slf4j
final class CompletionCoordinator {

    private final IngestContext context;

    private final AtomicInteger outstanding = new AtomicInteger(1);

    private final AtomicReference<IngestState> state = new AtomicReference<>(IngestState.RUNNING);

    private final CompletableFuture<IngestState> terminated = new CompletableFuture<>();

    private volatile IOException failure;

    CompletionCoordinator(IngestContext context) {
        this.context = context;
    }

    /** Accounts for a chunk about to be dispatched. */
    void register() {
        if (outstanding.getAndIncrement() <= 0) {
            outstanding.decrementAndGet();
            throw new IllegalStateException("Ingestion already terminated");
        }
    }

    /** Accounts for a chunk whose processing is over. */
    void arrive() {
        int remaining = outstanding.decrementAndGet();
        if (remaining == 0) {
            terminate();
        } else if (remaining < 0) {
            throw new IllegalStateException("More arrivals than registrations");
        }
    }

    /**
     * Marks the end of the read loop and starts draining.
     *
     * @param failure the read failure that stopped the loop, or {@code null}
     */
    void readLoopExited(IOException failure) {
        this.failure = failure;
        if (state.compareAndSet(IngestState.RUNNING, IngestState.DRAINING)) {
            log.trace("Read loop exited, draining {} chunks", outstanding.get() - 1);
            arrive();
        }
    }

    /**
     * Blocks until every dispatched chunk has been processed. Waiting is not interruptible:
     * once this method returns no worker touches the ingestion's buffers anymore.
     *
     * @return the terminal state
     */
    IngestState awaitTermination() {
        return terminated.join();
    }

    IngestState state() {
        return state.get();
    }

    IOException failure() {
        return failure;
    }

    int outstanding() {
        return Math.max(0, outstanding.get());
    }

    private void terminate() {
        IngestState outcome;
        if (failure != null) {
            outcome = IngestState.FAILED;
        } else if (context.isCancelled()) {
            outcome = IngestState.CANCELLED;
        } else {
            outcome = IngestState.COMPLETED;
        }
        state.set(outcome);
        terminated.complete(outcome);
    }
}

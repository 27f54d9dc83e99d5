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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal shared by an ingestion and the chunk processors it runs.
 * <p>
 * A context is either the never-cancelled {@link #background() background} context, or a
 * cancellable one created with {@link #create()} or derived from a parent with
 * {@link #withCancel()}, {@link #withTimeout(Duration)} or {@link #withDeadline(Instant)}.
 * Derived contexts are cancelled when their parent is, with the parent's error.
 * <p>
 * Cancellation happens at most once; the first {@link ContextCancelledException} recorded
 * is the context's {@link #error() error} for good. Expiry of a deadline cancels with a
 * {@link DeadlineExceededException}.
 * <p>
 * A child is only referenced by its parent until it is cancelled, and a pending deadline is
 * dropped as soon as its context is cancelled. Cancel derived contexts once they are no
 * longer needed, so that a long-lived parent doesn't accumulate them.
 * <p>
 * <strong>Thread Safety:</strong> contexts are thread-safe.
 *
 * <pre>{@code
 * IngestContext context = IngestContext.background().withTimeout(Duration.ofMinutes(5));
 * try {
 *     ChunkIngestor.ingest(config, context, channel);
 * } catch (DeadlineExceededException e) {
 *     // took too long, chunks already dispatched were still processed
 * }
 * }</pre>
 */
public class IngestContext {

    private static final IngestContext BACKGROUND = new IngestContext(null, false, null);

    /** Single daemon thread firing the deadlines of all contexts. */
    private static final ScheduledThreadPoolExecutor DEADLINES = createDeadlineScheduler();

    private final IngestContext parent;

    private final boolean cancellable;

    private final Instant deadline;

    private final CompletableFuture<ContextCancelledException> done = new CompletableFuture<>();

    /** Cancellable children not cancelled yet. */
    private final Set<IngestContext> children = ConcurrentHashMap.newKeySet();

    private volatile ScheduledFuture<?> deadlineTimer;

    private IngestContext(IngestContext parent, boolean cancellable, Instant deadline) {
        this.parent = parent;
        this.cancellable = cancellable;
        this.deadline = deadline;
    }

    private static ScheduledThreadPoolExecutor createDeadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, task -> {
            Thread thread = new Thread(task, "chunkstream-deadlines");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Returns the root context, which is never cancelled and has no deadline.
     *
     * @return the background context
     */
    public static IngestContext background() {
        return BACKGROUND;
    }

    /**
     * Creates a new cancellable context with no parent and no deadline.
     *
     * @return a new cancellable context
     */
    public static IngestContext create() {
        return new IngestContext(null, true, null);
    }

    /**
     * Derives a cancellable child context, cancelled along with this one.
     *
     * @return a new child context
     */
    public IngestContext withCancel() {
        return attach(new IngestContext(this, true, deadline));
    }

    /**
     * Derives a child context cancelled after {@code timeout}, or along with this one.
     *
     * @param timeout time until the child is cancelled with a {@link DeadlineExceededException}
     * @return a new child context
     */
    public IngestContext withTimeout(Duration timeout) {
        requireNonNull(timeout, "timeout cannot be null");
        return withDeadline(Instant.now().plus(timeout));
    }

    /**
     * Derives a child context cancelled at {@code deadline}, or along with this one.
     * <p>
     * If this context has an earlier deadline, the child keeps the earlier one. A deadline in
     * the past yields an already cancelled context.
     *
     * @param deadline instant the child is cancelled at with a {@link DeadlineExceededException}
     * @return a new child context
     */
    public IngestContext withDeadline(Instant deadline) {
        requireNonNull(deadline, "deadline cannot be null");
        if (this.deadline != null && this.deadline.isBefore(deadline)) {
            return withCancel();
        }
        IngestContext child = attach(new IngestContext(this, true, deadline));
        long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
        if (delayNanos <= 0) {
            child.cancel(new DeadlineExceededException());
        } else if (!child.isCancelled()) {
            child.deadlineTimer = DEADLINES.schedule(
                    () -> child.cancel(new DeadlineExceededException()), delayNanos, TimeUnit.NANOSECONDS);
            // cancelled while scheduling: its cancel() may have missed the timer
            if (child.isCancelled()) {
                child.deadlineTimer.cancel(false);
            }
        }
        return child;
    }

    /**
     * Cancels this context and all its descendants with a {@link ContextCancelledException}.
     *
     * @return {@code true} if this call cancelled the context, {@code false} if it was already cancelled
     * @throws IllegalStateException if called on the {@link #background() background} context
     */
    public boolean cancel() {
        return cancel(new ContextCancelledException());
    }

    /**
     * Cancels this context and all its descendants with the given error.
     *
     * @param error the error reported by {@link #error()}
     * @return {@code true} if this call cancelled the context, {@code false} if it was already cancelled
     * @throws IllegalStateException if called on the {@link #background() background} context
     */
    public boolean cancel(ContextCancelledException error) {
        requireNonNull(error, "error cannot be null");
        if (!cancellable) {
            throw new IllegalStateException("The background context can't be cancelled");
        }
        if (!done.complete(error)) {
            return false;
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        for (IngestContext child : children) {
            child.cancel(error);
        }
        children.clear();
        return true;
    }

    /**
     * @return whether this context has been cancelled
     */
    public boolean isCancelled() {
        return done.isDone();
    }

    /**
     * @return the cancellation error, or empty if this context is not cancelled
     */
    public Optional<ContextCancelledException> error() {
        return Optional.ofNullable(done.getNow(null));
    }

    /**
     * @return the deadline of this context, if any
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Registers an action to run once this context is cancelled. The action runs on the
     * cancelling thread, or immediately on the calling thread if already cancelled. Actions
     * registered on the background context never run.
     *
     * @param action the action to run
     */
    public void onCancel(Runnable action) {
        requireNonNull(action, "action cannot be null");
        if (cancellable) {
            done.thenRun(action);
        }
    }

    /**
     * Blocks until this context is cancelled or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @param unit unit of {@code timeout}
     * @return {@code true} if the context is cancelled, {@code false} if the timeout elapsed first
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        if (!cancellable) {
            unit.sleep(timeout);
            return false;
        }
        try {
            done.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // done is only ever completed normally
            throw new IllegalStateException(e.getCause());
        }
    }

    private IngestContext attach(IngestContext child) {
        if (cancellable) {
            children.add(child);
            // this context may have been cancelled while adding, after iterating its children
            error().ifPresent(child::cancel);
        }
        return child;
    }

    /**
     * @return number of children still referenced by this context
     */
    int childCount() {
        return children.size();
    }

    /**
     * @return number of deadlines scheduled and not yet fired or dropped, across all contexts
     */
    static int pendingDeadlines() {
        return DEADLINES.getQueue().size();
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "IngestContext[background]";
        }
        return "IngestContext[cancelled=%s, deadline=%s]".formatted(isCancelled(), deadline);
    }
}

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IngestContextTest {

    @Test
    void backgroundIsNeverCancelled() throws InterruptedException {
        IngestContext background = IngestContext.background();

        assertThat(IngestContext.background()).isSameAs(background);
        assertThat(background.isCancelled()).isFalse();
        assertThat(background.error()).isEmpty();
        assertThat(background.deadline()).isEmpty();
        assertThat(background.awaitCancellation(5, TimeUnit.MILLISECONDS)).isFalse();
        assertThatThrownBy(background::cancel).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelIsRecordedOnce() {
        IngestContext context = IngestContext.create();
        ContextCancelledException first = new ContextCancelledException("stop");

        assertThat(context.cancel(first)).isTrue();
        assertThat(context.cancel()).isFalse();

        assertThat(context.isCancelled()).isTrue();
        assertThat(context.error()).containsSame(first);
    }

    @Test
    void childIsCancelledWithParent() {
        IngestContext parent = IngestContext.create();
        IngestContext child = parent.withCancel();
        IngestContext grandChild = child.withCancel();

        parent.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandChild.isCancelled()).isTrue();
        assertThat(grandChild.error()).containsSame(parent.error().orElseThrow());
    }

    @Test
    void cancellingChildLeavesParentAlone() {
        IngestContext parent = IngestContext.create();
        IngestContext child = parent.withCancel();

        child.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void timeoutCancelsWithDeadlineExceeded() {
        IngestContext context = IngestContext.background().withTimeout(Duration.ofMillis(50));

        assertThat(context.deadline()).isPresent();
        await().atMost(Duration.ofSeconds(5)).until(context::isCancelled);
        assertThat(context.error()).get().isInstanceOf(DeadlineExceededException.class);
    }

    @Test
    void deadlineInThePastIsAlreadyCancelled() {
        IngestContext context = IngestContext.background().withDeadline(Instant.now().minusSeconds(1));

        assertThat(context.isCancelled()).isTrue();
        assertThat(context.error()).get().isInstanceOf(DeadlineExceededException.class);
    }

    @Test
    void childKeepsEarlierParentDeadline() {
        Instant soon = Instant.now().plusSeconds(60);
        IngestContext parent = IngestContext.background().withDeadline(soon);

        IngestContext child = parent.withDeadline(soon.plusSeconds(3600));

        assertThat(child.deadline()).contains(soon);
        parent.cancel();
        assertThat(child.isCancelled()).isTrue();
    }

    @Test
    void onCancelRunsOnceCancelled() throws InterruptedException {
        IngestContext context = IngestContext.create();
        AtomicInteger runs = new AtomicInteger();
        context.onCancel(runs::incrementAndGet);

        assertThat(context.awaitCancellation(1, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(runs).hasValue(0);

        context.cancel();
        context.cancel();
        assertThat(runs).hasValue(1);
        assertThat(context.awaitCancellation(1, TimeUnit.MILLISECONDS)).isTrue();

        // registered after the fact: runs right away
        context.onCancel(runs::incrementAndGet);
        assertThat(runs).hasValue(2);
    }

    @Test
    void cancelledChildrenAreReleasedByParent() {
        IngestContext parent = IngestContext.create();

        for (int i = 0; i < 10_000; i++) {
            parent.withCancel().cancel();
        }

        assertThat(parent.childCount()).isZero();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void liveChildrenAreReleasedWhenParentIsCancelled() {
        IngestContext parent = IngestContext.create();
        List<IngestContext> children = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            children.add(parent.withCancel());
        }
        assertThat(parent.childCount()).isEqualTo(10);

        parent.cancel();

        assertThat(parent.childCount()).isZero();
        assertThat(children).allMatch(IngestContext::isCancelled);
    }

    @Test
    void childOfCancelledParentIsBornCancelled() {
        IngestContext parent = IngestContext.create();
        parent.cancel();

        IngestContext child = parent.withCancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(child.error()).containsSame(parent.error().orElseThrow());
        assertThat(parent.childCount()).isZero();
    }

    @Test
    void cancellingDropsPendingDeadline() {
        IngestContext parent = IngestContext.create();
        int before = IngestContext.pendingDeadlines();

        List<IngestContext> timed = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            timed.add(parent.withTimeout(Duration.ofHours(1)));
        }
        assertThat(IngestContext.pendingDeadlines()).isGreaterThanOrEqualTo(before + 100);
        assertThat(parent.childCount()).isEqualTo(100);

        timed.forEach(IngestContext::cancel);

        assertThat(IngestContext.pendingDeadlines()).isLessThanOrEqualTo(before);
        assertThat(parent.childCount()).isZero();
        assertThat(timed).allSatisfy(context -> assertThat(context.error())
                .get()
                .isNotInstanceOf(DeadlineExceededException.class));
    }

    @Test
    void backgroundTimeoutDeadlineIsDroppedOnCancel() {
        int before = IngestContext.pendingDeadlines();
        IngestContext context = IngestContext.background().withTimeout(Duration.ofHours(1));
        assertThat(IngestContext.pendingDeadlines()).isGreaterThanOrEqualTo(before + 1);

        context.cancel();

        assertThat(IngestContext.pendingDeadlines()).isLessThanOrEqualTo(before);
    }
}

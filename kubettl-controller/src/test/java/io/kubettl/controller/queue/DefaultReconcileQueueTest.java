/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubettl.controller.queue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import io.kubettl.common.util.retry.Retryers;
import io.kubettl.controller.model.ReconcileOutcome;
import io.kubettl.controller.model.ResourceKey;
import org.junit.Before;
import org.junit.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;

public class DefaultReconcileQueueTest {

    private static final ResourceKey KEY = ResourceKey.of("default", "report1");
    private static final ResourceKey OTHER_KEY = ResourceKey.of("default", "report2");

    private static final RuntimeException ERROR = new RuntimeException("simulated error");

    private final List<Runnable> pendingTasks = new ArrayList<>();
    private final Scheduler workerScheduler = Schedulers.fromExecutor(pendingTasks::add);
    private final VirtualTimeScheduler timerScheduler = VirtualTimeScheduler.create();

    private final List<ResourceKey> invocations = new ArrayList<>();
    private final LinkedList<ReconcileOutcome> scriptedOutcomes = new LinkedList<>();

    private Function<ResourceKey, ReconcileOutcome> onInvoke = key -> null;

    private DefaultReconcileQueue queue;

    @Before
    public void setUp() {
        queue = DefaultReconcileQueue.newBuilder()
                .withName("test")
                .withHandler(this::handle)
                .withWorkerScheduler(workerScheduler)
                .withTimerScheduler(timerScheduler)
                .withRetryer(Retryers.exponentialBackoff(10, 1_000, TimeUnit.MILLISECONDS))
                .build();
    }

    @Test
    public void testKeyAddedManyTimesIsReconciledOnce() {
        queue.add(KEY);
        queue.add(KEY);
        queue.add(OTHER_KEY);
        assertThat(queue.size()).isEqualTo(2);

        runPendingTasks();
        assertThat(invocations).containsExactly(KEY, OTHER_KEY);
        assertThat(queue.size()).isZero();
    }

    @Test
    public void testKeyAddedDuringProcessingIsReconciledAgain() {
        AtomicBoolean first = new AtomicBoolean(true);
        onInvoke = key -> {
            if (first.getAndSet(false)) {
                queue.add(key);
                queue.add(key);
            }
            return null;
        };

        queue.add(KEY);
        runPendingTasks();
        assertThat(invocations).containsExactly(KEY, KEY);
    }

    @Test
    public void testRequeueAfterIsNotDeliveredBeforeDelay() {
        scriptedOutcomes.add(ReconcileOutcome.requeueAfter(Duration.ofSeconds(10)));

        queue.add(KEY);
        runPendingTasks();
        assertThat(queue.size()).isEqualTo(1);

        advance(Duration.ofMillis(9_999));
        assertThat(invocations).hasSize(1);

        advance(Duration.ofMillis(1));
        assertThat(invocations).hasSize(2);
        assertThat(queue.size()).isZero();
    }

    @Test
    public void testRequeueAfterZeroIsDelayedByMinimumDelay() {
        scriptedOutcomes.add(ReconcileOutcome.requeueAfter(Duration.ZERO));

        queue.add(KEY);
        runPendingTasks();
        assertThat(invocations).hasSize(1);

        advance(Duration.ofMillis(1));
        assertThat(invocations).hasSize(2);
    }

    @Test
    public void testRequeueAfterIsRoundedUpToMillisecond() {
        scriptedOutcomes.add(ReconcileOutcome.requeueAfter(Duration.ofNanos(1_500_000)));

        queue.add(KEY);
        runPendingTasks();

        advance(Duration.ofMillis(1));
        assertThat(invocations).hasSize(1);
        advance(Duration.ofMillis(1));
        assertThat(invocations).hasSize(2);
    }

    @Test
    public void testTransientErrorsAreRetriedWithExponentialBackoff() {
        scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));
        scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));
        scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));

        queue.add(KEY);
        runPendingTasks();
        assertThat(invocations).hasSize(1);

        expectNextInvocationAfter(10, 2);
        expectNextInvocationAfter(20, 3);
        expectNextInvocationAfter(40, 4);
    }

    @Test
    public void testPermanentErrorsAreRetriedWithExponentialBackoff() {
        scriptedOutcomes.add(ReconcileOutcome.permanentError(ERROR));
        scriptedOutcomes.add(ReconcileOutcome.permanentError(ERROR));

        queue.add(KEY);
        runPendingTasks();

        expectNextInvocationAfter(10, 2);
        expectNextInvocationAfter(20, 3);
    }

    @Test
    public void testBackoffIsCapped() {
        for (int i = 0; i < 10; i++) {
            scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));
        }
        queue.add(KEY);
        runPendingTasks();

        long[] expectedDelaysMs = {10, 20, 40, 80, 160, 320, 640, 1_000, 1_000};
        for (int i = 0; i < expectedDelaysMs.length; i++) {
            expectNextInvocationAfter(expectedDelaysMs[i], i + 2);
        }
    }

    @Test
    public void testSuccessResetsBackoff() {
        scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));
        scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));
        scriptedOutcomes.add(ReconcileOutcome.noOp());
        scriptedOutcomes.add(ReconcileOutcome.transientError(ERROR));

        queue.add(KEY);
        runPendingTasks();
        expectNextInvocationAfter(10, 2);
        expectNextInvocationAfter(20, 3);

        queue.add(KEY);
        runPendingTasks();
        assertThat(invocations).hasSize(4);

        expectNextInvocationAfter(10, 5);
    }

    @Test
    public void testHandlerExceptionIsRetried() {
        AtomicBoolean first = new AtomicBoolean(true);
        onInvoke = key -> {
            if (first.getAndSet(false)) {
                throw ERROR;
            }
            return null;
        };

        queue.add(KEY);
        runPendingTasks();
        expectNextInvocationAfter(10, 2);
    }

    @Test
    public void testEarliestDelayedDeliveryWins() {
        queue.addAfter(KEY, Duration.ofSeconds(10));
        queue.addAfter(KEY, Duration.ofSeconds(5));
        queue.addAfter(KEY, Duration.ofSeconds(20));
        assertThat(queue.size()).isEqualTo(1);

        advance(Duration.ofSeconds(5));
        assertThat(invocations).hasSize(1);

        advance(Duration.ofSeconds(30));
        assertThat(invocations).hasSize(1);
    }

    @Test
    public void testNonPositiveDelayIsImmediate() {
        queue.addAfter(KEY, Duration.ZERO);
        runPendingTasks();
        assertThat(invocations).containsExactly(KEY);
    }

    @Test
    public void testShutdownDropsPendingWork() {
        queue.addAfter(KEY, Duration.ofSeconds(1));
        queue.add(OTHER_KEY);

        queue.shutdown();
        assertThat(queue.size()).isZero();

        queue.add(KEY);
        runPendingTasks();
        advance(Duration.ofSeconds(10));
        assertThat(invocations).isEmpty();
    }

    @Test(timeout = 30_000)
    public void testReconciliationExceedingDeadlineIsInterrupted() throws Exception {
        Scheduler realWorker = Schedulers.newSingle("test-worker");
        Scheduler realTimer = Schedulers.newSingle("test-timer");
        CountDownLatch interrupted = new CountDownLatch(1);
        CountDownLatch retried = new CountDownLatch(1);
        AtomicBoolean first = new AtomicBoolean(true);
        try {
            DefaultReconcileQueue timedQueue = DefaultReconcileQueue.newBuilder()
                    .withName("timed")
                    .withHandler(key -> {
                        if (!first.getAndSet(false)) {
                            retried.countDown();
                            return ReconcileOutcome.noOp();
                        }
                        try {
                            Thread.sleep(60_000);
                            return ReconcileOutcome.noOp();
                        } catch (InterruptedException e) {
                            interrupted.countDown();
                            return ReconcileOutcome.transientError(e);
                        }
                    })
                    .withWorkerScheduler(realWorker)
                    .withTimerScheduler(realTimer)
                    .withReconcileTimeout(Duration.ofMillis(100))
                    .withRetryer(Retryers.exponentialBackoff(10, 100, TimeUnit.MILLISECONDS))
                    .build();

            timedQueue.add(KEY);
            assertThat(interrupted.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(retried.await(10, TimeUnit.SECONDS)).isTrue();
            timedQueue.shutdown();
        } finally {
            realWorker.dispose();
            realTimer.dispose();
        }
    }

    private ReconcileOutcome handle(ResourceKey key) {
        invocations.add(key);
        ReconcileOutcome injected = onInvoke.apply(key);
        if (injected != null) {
            return injected;
        }
        return scriptedOutcomes.isEmpty() ? ReconcileOutcome.noOp() : scriptedOutcomes.removeFirst();
    }

    private void expectNextInvocationAfter(long delayMs, int expectedInvocations) {
        advance(Duration.ofMillis(delayMs - 1));
        assertThat(invocations).hasSize(expectedInvocations - 1);
        advance(Duration.ofMillis(1));
        assertThat(invocations).hasSize(expectedInvocations);
    }

    private void advance(Duration duration) {
        timerScheduler.advanceTimeBy(duration);
        runPendingTasks();
    }

    private void runPendingTasks() {
        while (!pendingTasks.isEmpty()) {
            pendingTasks.remove(0).run();
        }
    }
}

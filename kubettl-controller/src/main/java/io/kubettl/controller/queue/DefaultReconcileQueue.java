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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import io.kubettl.common.util.DateTimeExt;
import io.kubettl.common.util.retry.Retryer;
import io.kubettl.common.util.retry.Retryers;
import io.kubettl.controller.model.ReconcileOutcome;
import io.kubettl.controller.model.ResourceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

/**
 * {@link ReconcileQueue} running reconciliations on a worker {@link Scheduler}, and keeping delayed deliveries
 * on a timer {@link Scheduler}. The schedulers are owned by the caller.
 * <p>
 * Outcome handling:
 * <ul>
 *     <li>{@link ReconcileOutcome.Kind#RequeueAfter} - delivered again after the requested delay plus a random jitter, error backoff is reset</li>
 *     <li>{@link ReconcileOutcome.Kind#NoOp}, {@link ReconcileOutcome.Kind#Deleted} - the key is forgotten, error backoff is reset</li>
 *     <li>{@link ReconcileOutcome.Kind#TransientError}, {@link ReconcileOutcome.Kind#PermanentError} - delivered again after the next error backoff delay</li>
 * </ul>
 * Each reconciliation runs under a deadline. When the deadline passes, the worker thread is interrupted.
 */
public class DefaultReconcileQueue implements ReconcileQueue {

    private static final Logger logger = LoggerFactory.getLogger(DefaultReconcileQueue.class);

    /**
     * Requeue requests are never delivered sooner than this, so a resource at its exact expiry instant is
     * evaluated again only after the expiry point has passed.
     */
    private static final long MIN_REQUEUE_DELAY_MS = 1;

    private final String name;
    private final Function<ResourceKey, ReconcileOutcome> handler;
    private final Scheduler workerScheduler;
    private final Scheduler timerScheduler;
    private final long reconcileTimeoutMs;
    private final Retryer initialRetryer;
    private final long requeueJitterMs;

    private final Object lock = new Object();

    // Keys dispatched to the worker scheduler, but not started yet.
    private final Set<ResourceKey> queued = new LinkedHashSet<>();
    private final Map<ResourceKey, Thread> processing = new HashMap<>();
    // Keys added again while being processed.
    private final Set<ResourceKey> dirty = new HashSet<>();
    private final Map<ResourceKey, DelayedDelivery> delayed = new HashMap<>();
    private final Map<ResourceKey, Retryer> retryers = new HashMap<>();

    private boolean shutdown;

    private DefaultReconcileQueue(Builder builder) {
        this.name = builder.name;
        this.handler = builder.handler;
        this.workerScheduler = builder.workerScheduler;
        this.timerScheduler = builder.timerScheduler;
        this.reconcileTimeoutMs = builder.reconcileTimeout.toMillis();
        this.initialRetryer = builder.retryer;
        this.requeueJitterMs = builder.requeueJitter.toMillis();
    }

    @Override
    public void add(ResourceKey key) {
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            if (processing.containsKey(key)) {
                dirty.add(key);
                return;
            }
            if (!queued.add(key)) {
                return;
            }
        }
        dispatch(key);
    }

    @Override
    public void addAfter(ResourceKey key, Duration delay) {
        long delayMs = delay.toMillis();
        if (delayMs <= 0) {
            add(key);
            return;
        }
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            long deadlineMs = timerScheduler.now(TimeUnit.MILLISECONDS) + delayMs;
            DelayedDelivery existing = delayed.get(key);
            if (existing != null) {
                if (existing.getDeadlineMs() <= deadlineMs) {
                    return;
                }
                existing.getDisposable().dispose();
            }
            Disposable disposable = timerScheduler.schedule(() -> onDelayExpired(key, deadlineMs), delayMs, TimeUnit.MILLISECONDS);
            delayed.put(key, new DelayedDelivery(deadlineMs, disposable));
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            Set<ResourceKey> waiting = new HashSet<>(queued);
            waiting.addAll(dirty);
            waiting.addAll(delayed.keySet());
            return waiting.size();
        }
    }

    @Override
    public void shutdown() {
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            this.shutdown = true;
            delayed.values().forEach(d -> d.getDisposable().dispose());
            delayed.clear();
            queued.clear();
            dirty.clear();
            retryers.clear();
            processing.values().forEach(Thread::interrupt);
        }
        logger.info("Reconcile queue {} shut down", name);
    }

    private void onDelayExpired(ResourceKey key, long deadlineMs) {
        synchronized (lock) {
            DelayedDelivery current = delayed.get(key);
            if (current == null || current.getDeadlineMs() != deadlineMs) {
                return;
            }
            delayed.remove(key);
        }
        add(key);
    }

    private void dispatch(ResourceKey key) {
        try {
            workerScheduler.schedule(() -> process(key));
        } catch (Exception e) {
            // Rejected, as the worker scheduler is disposed.
            logger.warn("[{}] Cannot dispatch reconciliation in queue {}: {}", key, name, e.getMessage());
            synchronized (lock) {
                queued.remove(key);
            }
        }
    }

    private void process(ResourceKey key) {
        synchronized (lock) {
            queued.remove(key);
            if (shutdown) {
                return;
            }
            processing.put(key, Thread.currentThread());
        }

        ReconcileOutcome outcome = invoke(key);

        boolean rerun;
        synchronized (lock) {
            processing.remove(key);
            if (shutdown) {
                return;
            }
            rerun = dirty.remove(key);
            if (rerun) {
                queued.add(key);
            }
        }

        handleOutcome(key, outcome);
        if (rerun) {
            dispatch(key);
        }
    }

    private ReconcileOutcome invoke(ResourceKey key) {
        Thread worker = Thread.currentThread();
        Deadline deadline = new Deadline(key, worker);
        Disposable watchdog = timerScheduler.schedule(deadline::expire, reconcileTimeoutMs, TimeUnit.MILLISECONDS);
        try {
            ReconcileOutcome outcome = handler.apply(key);
            if (outcome == null) {
                return ReconcileOutcome.transientError(new IllegalStateException("Reconciler returned null outcome"));
            }
            return outcome;
        } catch (Exception e) {
            logger.error("[{}] Unexpected reconciler error", key, e);
            return ReconcileOutcome.transientError(e);
        } finally {
            deadline.complete();
            watchdog.dispose();
            // Clear the interrupt set by the deadline or shutdown.
            Thread.interrupted();
        }
    }

    private void handleOutcome(ResourceKey key, ReconcileOutcome outcome) {
        switch (outcome.getKind()) {
            case RequeueAfter:
                forgetRetries(key);
                long delayMs = Math.max(MIN_REQUEUE_DELAY_MS, toCeilMillis(outcome.getRequeueAfter())) + nextJitterMs();
                logger.debug("[{}] Requeue after {}", key, DateTimeExt.toTimeUnitString(delayMs));
                addAfter(key, Duration.ofMillis(delayMs));
                break;
            case NoOp:
            case Deleted:
                forgetRetries(key);
                break;
            case TransientError:
            case PermanentError:
                long backoffMs = nextBackoffMs(key);
                logger.debug("[{}] Reconciliation failed with {}, retrying in {}", key, outcome.getKind(), DateTimeExt.toTimeUnitString(backoffMs));
                addAfter(key, Duration.ofMillis(backoffMs));
                break;
        }
    }

    private void forgetRetries(ResourceKey key) {
        synchronized (lock) {
            retryers.remove(key);
        }
    }

    private long nextBackoffMs(ResourceKey key) {
        synchronized (lock) {
            Retryer retryer = retryers.getOrDefault(key, initialRetryer);
            long delayMs = retryer.getDelayMs().orElse(0L);
            retryers.put(key, retryer.retry());
            return delayMs;
        }
    }

    private static long toCeilMillis(Duration duration) {
        long millis = duration.toMillis();
        return duration.equals(Duration.ofMillis(millis)) ? millis : millis + 1;
    }

    private long nextJitterMs() {
        return requeueJitterMs <= 0 ? 0 : ThreadLocalRandom.current().nextLong(requeueJitterMs + 1);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private class Deadline {

        private final ResourceKey key;
        private final Thread worker;

        private boolean completed;

        private Deadline(ResourceKey key, Thread worker) {
            this.key = key;
            this.worker = worker;
        }

        private synchronized void expire() {
            if (!completed) {
                logger.warn("[{}] Reconciliation in queue {} exceeded deadline of {}ms; interrupting it", key, name, reconcileTimeoutMs);
                worker.interrupt();
            }
        }

        private synchronized void complete() {
            this.completed = true;
        }
    }

    private static class DelayedDelivery {

        private final long deadlineMs;
        private final Disposable disposable;

        private DelayedDelivery(long deadlineMs, Disposable disposable) {
            this.deadlineMs = deadlineMs;
            this.disposable = disposable;
        }

        private long getDeadlineMs() {
            return deadlineMs;
        }

        private Disposable getDisposable() {
            return disposable;
        }
    }

    public static final class Builder {

        private String name = "reconcileQueue";
        private Function<ResourceKey, ReconcileOutcome> handler;
        private Scheduler workerScheduler;
        private Scheduler timerScheduler;
        private Duration reconcileTimeout = Duration.ofMinutes(1);
        private Retryer retryer = Retryers.exponentialBackoff(5, 1_000_000, TimeUnit.MILLISECONDS);
        private Duration requeueJitter = Duration.ZERO;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withHandler(Function<ResourceKey, ReconcileOutcome> handler) {
            this.handler = handler;
            return this;
        }

        public Builder withWorkerScheduler(Scheduler workerScheduler) {
            this.workerScheduler = workerScheduler;
            return this;
        }

        public Builder withTimerScheduler(Scheduler timerScheduler) {
            this.timerScheduler = timerScheduler;
            return this;
        }

        public Builder withReconcileTimeout(Duration reconcileTimeout) {
            this.reconcileTimeout = reconcileTimeout;
            return this;
        }

        public Builder withRetryer(Retryer retryer) {
            this.retryer = retryer;
            return this;
        }

        public Builder withRequeueJitter(Duration requeueJitter) {
            this.requeueJitter = requeueJitter;
            return this;
        }

        public DefaultReconcileQueue build() {
            Preconditions.checkNotNull(handler, "handler not set");
            Preconditions.checkNotNull(workerScheduler, "worker scheduler not set");
            Preconditions.checkNotNull(timerScheduler, "timer scheduler not set");
            Preconditions.checkArgument(!reconcileTimeout.isNegative() && !reconcileTimeout.isZero(), "Reconcile timeout must be > 0: %s", reconcileTimeout);
            Preconditions.checkArgument(!requeueJitter.isNegative(), "Negative requeue jitter: %s", requeueJitter);
            return new DefaultReconcileQueue(this);
        }
    }
}

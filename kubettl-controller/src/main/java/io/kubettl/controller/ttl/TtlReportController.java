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

package io.kubettl.controller.ttl;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.kubettl.common.runtime.KubettlRuntime;
import io.kubettl.common.util.retry.Retryers;
import io.kubettl.controller.MetricConstants;
import io.kubettl.controller.model.ReconcileOutcome;
import io.kubettl.controller.model.ResourceKey;
import io.kubettl.controller.predicate.InstallModePredicate;
import io.kubettl.controller.predicate.ReportPredicates;
import io.kubettl.controller.queue.DefaultReconcileQueue;
import io.kubettl.controller.queue.ReconcileQueue;
import io.kubettl.runtime.connector.kubernetes.KubeApiFacade;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubernetes.client.informer.ResourceEventHandler;
import io.kubernetes.client.informer.SharedIndexInformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Removes VulnerabilityReports once their TTL, set with the {@link TtlAnnotations#TTL_REPORT_ANNOTATION} annotation,
 * has elapsed. Report add and update events from the informer are filtered, and the admitted reports are passed to
 * the reconcile queue, which runs {@link DefaultTtlReconciler} for them.
 */
@Singleton
public class TtlReportController {

    private static final Logger logger = LoggerFactory.getLogger(TtlReportController.class);

    public static final String NAME = "ttlReport";

    public static final String METRIC_ROOT = MetricConstants.METRIC_CONTROLLER + NAME + ".";

    private final TtlControllerConfiguration configuration;
    private final KubeApiFacade kubeApiFacade;
    private final Predicate<V1alpha1VulnerabilityReport> admissionPredicate;
    private final KubettlRuntime runtime;
    private final boolean ownsSchedulers;

    private final Registry registry;
    private final Id outcomeId;
    private final Id eventId;
    private final Id queueSizeId;
    private final Counter invalidTtlCounter;

    private final Object activationLock = new Object();

    private volatile Scheduler workerScheduler;
    private volatile Scheduler timerScheduler;
    private volatile TtlReconciler reconciler;
    private volatile ReconcileQueue queue;
    private volatile boolean shutdown;

    @Inject
    public TtlReportController(TtlControllerConfiguration configuration,
                               KubeApiFacade kubeApiFacade,
                               InstallModePredicate installModePredicate,
                               KubettlRuntime runtime) {
        this(configuration, kubeApiFacade, installModePredicate, runtime, null, null);
    }

    @VisibleForTesting
    TtlReportController(TtlControllerConfiguration configuration,
                        KubeApiFacade kubeApiFacade,
                        InstallModePredicate installModePredicate,
                        KubettlRuntime runtime,
                        Scheduler workerScheduler,
                        Scheduler timerScheduler) {
        this.configuration = configuration;
        this.kubeApiFacade = kubeApiFacade;
        this.admissionPredicate = ReportPredicates.isBeingTerminated().negate().and(installModePredicate);
        this.runtime = runtime;
        this.workerScheduler = workerScheduler;
        this.timerScheduler = timerScheduler;
        this.ownsSchedulers = workerScheduler == null;

        this.registry = runtime.getRegistry();
        this.outcomeId = registry.createId(METRIC_ROOT + "outcomes");
        this.eventId = registry.createId(METRIC_ROOT + "events");
        this.queueSizeId = registry.createId(METRIC_ROOT + "queueSize");
        this.invalidTtlCounter = registry.counter(METRIC_ROOT + "invalidTtl");
    }

    public void enterActiveMode() {
        synchronized (activationLock) {
            if (queue != null || shutdown) {
                return;
            }
            if (!configuration.isEnabled()) {
                logger.info("Controller {} disabled", NAME);
                return;
            }

            if (ownsSchedulers) {
                this.workerScheduler = Schedulers.newBoundedElastic(configuration.getWorkerCount(), Integer.MAX_VALUE, NAME + "-worker");
                this.timerScheduler = Schedulers.newSingle(NAME + "-timer", true);
            }
            this.reconciler = new DefaultTtlReconciler(new KubeVulnerabilityReportStore(kubeApiFacade), runtime.getClock());
            this.queue = DefaultReconcileQueue.newBuilder()
                    .withName(NAME)
                    .withHandler(this::reconcile)
                    .withWorkerScheduler(workerScheduler)
                    .withTimerScheduler(timerScheduler)
                    .withReconcileTimeout(Duration.ofMillis(configuration.getReconcileTimeoutMs()))
                    .withRetryer(Retryers.exponentialBackoff(
                            configuration.getRetryInitialDelayMs(),
                            configuration.getRetryMaxDelayMs(),
                            TimeUnit.MILLISECONDS
                    ))
                    .withRequeueJitter(Duration.ofMillis(configuration.getRequeueJitterMs()))
                    .build();
            PolledMeter.using(registry).withId(queueSizeId).monitorValue(queue, ReconcileQueue::size);

            SharedIndexInformer<V1alpha1VulnerabilityReport> informer = kubeApiFacade.getVulnerabilityReportInformer();
            informer.addEventHandler(new ReportEventHandler());

            logger.info("Controller {} activated: workers={}, reconcileTimeoutMs={}, retryDelayMs={}..{}, requeueJitterMs={}",
                    NAME,
                    configuration.getWorkerCount(),
                    configuration.getReconcileTimeoutMs(),
                    configuration.getRetryInitialDelayMs(),
                    configuration.getRetryMaxDelayMs(),
                    configuration.getRequeueJitterMs()
            );
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (activationLock) {
            if (shutdown) {
                return;
            }
            this.shutdown = true;
            if (queue != null) {
                queue.shutdown();
                PolledMeter.remove(registry, queueSizeId);
            }
            if (ownsSchedulers) {
                if (workerScheduler != null) {
                    workerScheduler.dispose();
                }
                if (timerScheduler != null) {
                    timerScheduler.dispose();
                }
            }
        }
    }

    @VisibleForTesting
    ReconcileQueue getQueue() {
        return queue;
    }

    private ReconcileOutcome reconcile(ResourceKey key) {
        ReconcileOutcome outcome = reconciler.reconcile(key);
        registry.counter(outcomeId.withTag("kind", outcome.getKind().name())).increment();
        if (outcome.getKind() == ReconcileOutcome.Kind.PermanentError
                && outcome.getError().filter(e -> e instanceof InvalidTtlAnnotationException).isPresent()) {
            invalidTtlCounter.increment();
        }
        return outcome;
    }

    private void onReportEvent(String eventType, V1alpha1VulnerabilityReport report) {
        ResourceKey key = KubeVulnerabilityReportStore.toResourceKey(report);
        boolean admitted = admissionPredicate.test(report);
        registry.counter(eventId.withTag("event", eventType).withTag("admitted", Boolean.toString(admitted))).increment();
        if (!admitted) {
            logger.debug("[{}] Ignoring {} event of not admitted report", key, eventType);
            return;
        }
        queue.add(key);
    }

    private class ReportEventHandler implements ResourceEventHandler<V1alpha1VulnerabilityReport> {

        @Override
        public void onAdd(V1alpha1VulnerabilityReport report) {
            onReportEvent("add", report);
        }

        @Override
        public void onUpdate(V1alpha1VulnerabilityReport oldReport, V1alpha1VulnerabilityReport newReport) {
            onReportEvent("update", newReport);
        }

        @Override
        public void onDelete(V1alpha1VulnerabilityReport report, boolean deletedFinalStateUnknown) {
            registry.counter(eventId.withTag("event", "delete").withTag("admitted", "false")).increment();
            logger.debug("[{}] Report deleted", KubeVulnerabilityReportStore.toResourceKey(report));
        }
    }
}

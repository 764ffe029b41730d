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
import java.time.Instant;
import java.util.Optional;

import io.kubettl.common.util.DateTimeExt;
import io.kubettl.common.util.time.Clock;
import io.kubettl.common.util.unit.TimeUnitExt;
import io.kubettl.controller.model.ExpirableResource;
import io.kubettl.controller.model.ExpiryVerdict;
import io.kubettl.controller.model.ReconcileOutcome;
import io.kubettl.controller.model.ResourceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.kubettl.controller.ttl.TtlAnnotations.TTL_REPORT_ANNOTATION;

public class DefaultTtlReconciler implements TtlReconciler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultTtlReconciler.class);

    private final ExpirableResourceStore store;
    private final Clock clock;

    public DefaultTtlReconciler(ExpirableResourceStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public ReconcileOutcome reconcile(ResourceKey key) {
        Optional<ExpirableResource> resourceOpt;
        try {
            resourceOpt = store.find(key);
        } catch (Exception e) {
            logger.warn("[{}] Cannot read resource: {}", key, e.getMessage());
            logger.debug("[{}] Read error details", key, e);
            return ReconcileOutcome.transientError(e);
        }
        if (!resourceOpt.isPresent()) {
            logger.debug("[{}] Ignoring cached resource that must have been deleted", key);
            return ReconcileOutcome.noOp();
        }
        ExpirableResource resource = resourceOpt.get();

        Optional<String> ttlValue = resource.getAnnotation(TTL_REPORT_ANNOTATION);
        if (!ttlValue.isPresent()) {
            logger.debug("[{}] Ignoring resource without TTL set", key);
            return ReconcileOutcome.noOp();
        }

        Optional<Duration> ttl = TimeUnitExt.parseDuration(ttlValue.get());
        if (!ttl.isPresent()) {
            InvalidTtlAnnotationException error = InvalidTtlAnnotationException.malformedDuration(key, TTL_REPORT_ANNOTATION, ttlValue.get());
            logger.warn("[{}] {}", key, error.getMessage());
            return ReconcileOutcome.permanentError(error);
        }

        Optional<Instant> referenceTimestamp = resource.getReferenceTimestamp();
        if (!referenceTimestamp.isPresent()) {
            InvalidTtlAnnotationException error = InvalidTtlAnnotationException.missingReferenceTimestamp(key, TTL_REPORT_ANNOTATION, ttlValue.get());
            logger.warn("[{}] {}", key, error.getMessage());
            return ReconcileOutcome.permanentError(error);
        }

        ExpiryVerdict verdict = ExpiryCalculator.evaluate(ttl.get(), referenceTimestamp.get(), clock.instant());
        if (!verdict.isExpired()) {
            logger.debug("[{}] TTL not expired yet, requeue after {}", key, DateTimeExt.toTimeUnitString(verdict.getRemaining()));
            return ReconcileOutcome.requeueAfter(verdict.getRemaining());
        }

        logger.info("[{}] Removing resource with expired TTL: ttl={}, referenceTimestamp={}",
                key, ttlValue.get(), DateTimeExt.toUtcDateTimeString(referenceTimestamp.get()));
        try {
            if (!store.delete(key)) {
                logger.debug("[{}] Resource already removed", key);
            }
        } catch (Exception e) {
            logger.warn("[{}] Cannot delete resource: {}", key, e.getMessage());
            logger.debug("[{}] Delete error details", key, e);
            return ReconcileOutcome.transientError(e);
        }
        return ReconcileOutcome.deleted();
    }
}

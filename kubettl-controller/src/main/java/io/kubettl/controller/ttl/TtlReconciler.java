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

import io.kubettl.controller.model.ReconcileOutcome;
import io.kubettl.controller.model.ResourceKey;

/**
 * Level-triggered TTL reconciler. Each invocation looks at the current state of a single resource, and either
 * deletes it, asks to be called again when the TTL elapses, or does nothing.
 * <p>
 * Implementations are stateless. The caller guarantees that at most one invocation per key runs at a time.
 */
public interface TtlReconciler {

    /**
     * Never throws. All failures are reported as {@link ReconcileOutcome.Kind#TransientError} or
     * {@link ReconcileOutcome.Kind#PermanentError} outcomes.
     */
    ReconcileOutcome reconcile(ResourceKey key);
}

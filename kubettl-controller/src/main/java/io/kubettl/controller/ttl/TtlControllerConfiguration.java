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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "kubettl.controller.ttlReport")
public interface TtlControllerConfiguration {

    /**
     * @return whether or not the controller is enabled
     */
    @DefaultValue("true")
    boolean isEnabled();

    /**
     * @return maximum number of reports reconciled concurrently
     */
    @DefaultValue("10")
    int getWorkerCount();

    /**
     * @return deadline of a single reconciliation, after which it is interrupted and retried
     */
    @DefaultValue("60000")
    long getReconcileTimeoutMs();

    /**
     * @return delay before the first retry of a failed reconciliation. Doubled with each consecutive failure.
     */
    @DefaultValue("5")
    long getRetryInitialDelayMs();

    /**
     * @return upper bound of the retry delay of a failed reconciliation
     */
    @DefaultValue("1000000")
    long getRetryMaxDelayMs();

    /**
     * @return upper bound of the random delay added to each TTL requeue, so reports sharing the same TTL and
     * update time are not all removed at the same moment
     */
    @DefaultValue("1000")
    long getRequeueJitterMs();
}

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

package io.kubettl.runtime.connector.kubernetes;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.kubettl.common.runtime.KubettlRuntime;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.informer.SharedIndexInformer;

class KubeInformerMetrics<ApiType extends KubernetesObject> {

    private static final String METRICS_ROOT = "kubettl.kubeClient.";

    private static final String METRICS_INFORMER = METRICS_ROOT + "informer";

    private static final String METRICS_INFORMER_SYNCED = METRICS_ROOT + "informerSynced";

    private final Id sizeGaugeId;
    private final Id syncedGaugeId;

    private final KubettlRuntime runtime;

    KubeInformerMetrics(String type,
                        SharedIndexInformer<ApiType> informer,
                        KubettlRuntime runtime) {
        this.runtime = runtime;
        this.sizeGaugeId = runtime.getRegistry().createId(METRICS_INFORMER, "type", type);
        this.syncedGaugeId = runtime.getRegistry().createId(METRICS_INFORMER_SYNCED, "type", type);

        PolledMeter.using(runtime.getRegistry())
                .withId(sizeGaugeId)
                .monitorValue(informer, i -> i.getIndexer().list().size());
        PolledMeter.using(runtime.getRegistry())
                .withId(syncedGaugeId)
                .monitorValue(informer, i -> i.hasSynced() ? 1 : 0);
    }

    void shutdown() {
        PolledMeter.remove(runtime.getRegistry(), sizeGaugeId);
        PolledMeter.remove(runtime.getRegistry(), syncedGaugeId);
    }
}

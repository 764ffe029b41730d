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

import java.util.Optional;

import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubernetes.client.informer.SharedIndexInformer;

/**
 * {@link KubeApiFacade} encapsulates Kube Java, except the entity model and the informer API. The latter is
 * provided as a set of interfaces, so it is easy to mock in the test code.
 * <p>
 * All operations are blocking, and respond to thread interrupts by throwing {@link KubeApiException} with
 * {@link KubeApiException.ErrorCode#CANCELLED} error code.
 */
public interface KubeApiFacade {

    /**
     * Reads the report directly from the API server (not from the informer cache).
     *
     * @return {@link Optional#empty()} if the report does not exist
     * @throws KubeApiException if the read fails for any other reason
     */
    Optional<V1alpha1VulnerabilityReport> findNamespacedVulnerabilityReport(String namespace, String name);

    /**
     * @return true if the report was deleted, false if it did not exist
     * @throws KubeApiException if the delete fails for any other reason
     */
    boolean deleteNamespacedVulnerabilityReport(String namespace, String name);

    SharedIndexInformer<V1alpha1VulnerabilityReport> getVulnerabilityReportInformer();
}

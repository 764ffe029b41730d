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

import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import io.kubettl.common.util.DateTimeExt;
import io.kubettl.common.util.Evaluators;
import io.kubettl.controller.model.ExpirableResource;
import io.kubettl.controller.model.ResourceKey;
import io.kubettl.runtime.connector.kubernetes.KubeApiFacade;
import io.kubettl.runtime.connector.kubernetes.KubeUtil;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityScanResult;
import io.kubernetes.client.openapi.models.V1ObjectMeta;

/**
 * {@link ExpirableResourceStore} backed by VulnerabilityReport custom resources. The TTL is counted from the
 * report update timestamp, or from the resource creation timestamp for reports that do not have one.
 */
@Singleton
public class KubeVulnerabilityReportStore implements ExpirableResourceStore {

    private final KubeApiFacade kubeApiFacade;

    @Inject
    public KubeVulnerabilityReportStore(KubeApiFacade kubeApiFacade) {
        this.kubeApiFacade = kubeApiFacade;
    }

    @Override
    public Optional<ExpirableResource> find(ResourceKey key) {
        return kubeApiFacade.findNamespacedVulnerabilityReport(key.getNamespace(), key.getName())
                .map(KubeVulnerabilityReportStore::toExpirableResource);
    }

    @Override
    public boolean delete(ResourceKey key) {
        return kubeApiFacade.deleteNamespacedVulnerabilityReport(key.getNamespace(), key.getName());
    }

    public static ResourceKey toResourceKey(V1alpha1VulnerabilityReport report) {
        V1ObjectMeta metadata = report.getMetadata();
        return ResourceKey.of(KubeUtil.getMetadataNamespace(metadata), KubeUtil.getMetadataName(metadata));
    }

    @VisibleForTesting
    static ExpirableResource toExpirableResource(V1alpha1VulnerabilityReport report) {
        V1ObjectMeta metadata = report.getMetadata();
        return ExpirableResource.newBuilder()
                .withKey(toResourceKey(report))
                .withAnnotations(metadata.getAnnotations())
                .withReferenceTimestamp(getReferenceTimestamp(report))
                .build();
    }

    private static Instant getReferenceTimestamp(V1alpha1VulnerabilityReport report) {
        Instant updateTimestamp = DateTimeExt.toInstant(
                Evaluators.applyNotNull(report.getReport(), V1alpha1VulnerabilityScanResult::getUpdateTimestamp)
        );
        Instant creationTimestamp = DateTimeExt.toInstant(
                Evaluators.applyNotNull(report.getMetadata(), V1ObjectMeta::getCreationTimestamp)
        );
        return Evaluators.getFirstNotNull(updateTimestamp, creationTimestamp);
    }
}

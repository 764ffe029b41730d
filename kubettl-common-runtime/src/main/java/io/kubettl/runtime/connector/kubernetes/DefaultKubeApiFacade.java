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
import java.util.function.Supplier;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.JsonSyntaxException;
import io.kubettl.common.runtime.KubettlRuntime;
import io.kubettl.common.util.Evaluators;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReportList;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.kubettl.runtime.connector.kubernetes.KubeApiClients.createSharedInformerFactory;

@Singleton
public class DefaultKubeApiFacade implements KubeApiFacade {

    private static final Logger logger = LoggerFactory.getLogger(DefaultKubeApiFacade.class);

    private static final int HTTP_NOT_FOUND = 404;

    private final KubeConnectorConfiguration configuration;
    private final ApiClient apiClient;
    private final GenericKubernetesApi<V1alpha1VulnerabilityReport, V1alpha1VulnerabilityReportList> reportApi;
    private final KubettlRuntime runtime;

    private final Object activationLock = new Object();

    private volatile SharedInformerFactory sharedInformerFactory;
    private volatile SharedIndexInformer<V1alpha1VulnerabilityReport> reportInformer;

    private KubeInformerMetrics<V1alpha1VulnerabilityReport> reportInformerMetrics;

    private volatile boolean deactivated;

    @Inject
    public DefaultKubeApiFacade(KubeConnectorConfiguration configuration, ApiClient apiClient, KubettlRuntime runtime) {
        this(configuration, apiClient, newReportApi(apiClient), runtime);
    }

    @VisibleForTesting
    DefaultKubeApiFacade(KubeConnectorConfiguration configuration,
                         ApiClient apiClient,
                         GenericKubernetesApi<V1alpha1VulnerabilityReport, V1alpha1VulnerabilityReportList> reportApi,
                         KubettlRuntime runtime) {
        this.configuration = configuration;
        this.apiClient = apiClient;
        this.reportApi = reportApi;
        this.runtime = runtime;
    }

    @PreDestroy
    public void shutdown() {
        if (sharedInformerFactory != null) {
            sharedInformerFactory.stopAllRegisteredInformers();
        }
        Evaluators.acceptNotNull(reportInformerMetrics, KubeInformerMetrics::shutdown);
    }

    public void deactivate() {
        if (!deactivated) {
            synchronized (activationLock) {
                shutdown();
                this.deactivated = true;
            }
        }
    }

    @Override
    public Optional<V1alpha1VulnerabilityReport> findNamespacedVulnerabilityReport(String namespace, String name) {
        KubernetesApiResponse<V1alpha1VulnerabilityReport> response = execute(
                "get", namespace, name, () -> reportApi.get(namespace, name)
        );
        if (response.isSuccess()) {
            return Optional.ofNullable(response.getObject());
        }
        if (response.getHttpStatusCode() == HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        throw KubeApiException.fromStatus(operationName("get", namespace, name), response.getHttpStatusCode(), response.getStatus());
    }

    @Override
    public boolean deleteNamespacedVulnerabilityReport(String namespace, String name) {
        KubernetesApiResponse<V1alpha1VulnerabilityReport> response;
        try {
            response = execute("delete", namespace, name, () -> reportApi.delete(namespace, name));
        } catch (JsonSyntaxException e) {
            // this will be counted as successful as the response type mapping in the client is incorrect
            return true;
        }
        if (response.isSuccess()) {
            return true;
        }
        if (response.getHttpStatusCode() == HTTP_NOT_FOUND) {
            return false;
        }
        throw KubeApiException.fromStatus(operationName("delete", namespace, name), response.getHttpStatusCode(), response.getStatus());
    }

    @Override
    public SharedIndexInformer<V1alpha1VulnerabilityReport> getVulnerabilityReportInformer() {
        activate();
        return reportInformer;
    }

    protected <T extends KubernetesObject> SharedIndexInformer<T> customizeInformer(String name, SharedIndexInformer<T> informer) {
        return informer;
    }

    private <T> T execute(String operation, String namespace, String name, Supplier<T> call) {
        try {
            return call.get();
        } catch (JsonSyntaxException | KubeApiException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = String.format("%s failed: %s", operationName(operation, namespace, name), e.getMessage());
            if (Thread.currentThread().isInterrupted()) {
                throw new KubeApiException(message, KubeApiException.ErrorCode.CANCELLED, e);
            }
            throw new KubeApiException(message, e.getCause() != null ? e.getCause() : e);
        }
    }

    private static String operationName(String operation, String namespace, String name) {
        return String.format("%s %s/%s %s", operation, V1alpha1VulnerabilityReport.PLURAL, namespace, name);
    }

    private void activate() {
        synchronized (activationLock) {
            if (deactivated) {
                throw new IllegalStateException("Deactivated");
            }

            if (sharedInformerFactory != null) {
                return;
            }

            try {
                this.sharedInformerFactory = createSharedInformerFactory("kube-report-shared-informer-", apiClient);

                this.reportInformer = customizeInformer("vulnerabilityReportInformer", sharedInformerFactory.sharedIndexInformerFor(
                        reportApi,
                        V1alpha1VulnerabilityReport.class,
                        configuration.getReportInformerResyncIntervalMs()
                ));
                this.reportInformerMetrics = new KubeInformerMetrics<>(V1alpha1VulnerabilityReport.PLURAL, reportInformer, runtime);

                sharedInformerFactory.startAllRegisteredInformers();

                logger.info("Kube vulnerability report informer activated");
            } catch (Exception e) {
                logger.error("Could not initialize Kube client shared informer", e);
                if (sharedInformerFactory != null) {
                    try {
                        sharedInformerFactory.stopAllRegisteredInformers();
                    } catch (Exception stopError) {
                        logger.debug("Cannot stop shared informers", stopError);
                    }
                }
                sharedInformerFactory = null;
                reportInformer = null;
                throw e;
            }
        }
    }

    private static GenericKubernetesApi<V1alpha1VulnerabilityReport, V1alpha1VulnerabilityReportList> newReportApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(
                V1alpha1VulnerabilityReport.class,
                V1alpha1VulnerabilityReportList.class,
                V1alpha1VulnerabilityReport.GROUP,
                V1alpha1VulnerabilityReport.VERSION,
                V1alpha1VulnerabilityReport.PLURAL,
                apiClient
        );
    }
}

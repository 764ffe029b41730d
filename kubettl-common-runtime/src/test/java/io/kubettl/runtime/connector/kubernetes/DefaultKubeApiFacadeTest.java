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

import java.io.IOException;
import java.io.InterruptedIOException;

import com.google.gson.JsonSyntaxException;
import io.kubettl.common.runtime.KubettlRuntimes;
import io.kubettl.common.util.archaius2.Archaius2Ext;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReportList;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class DefaultKubeApiFacadeTest {

    private static final String NAMESPACE = "team-a";
    private static final String NAME = "replicaset-nginx-6d4cf56db6-nginx";

    @SuppressWarnings("unchecked")
    private final GenericKubernetesApi<V1alpha1VulnerabilityReport, V1alpha1VulnerabilityReportList> reportApi = mock(GenericKubernetesApi.class);

    private final DefaultKubeApiFacade facade = new DefaultKubeApiFacade(
            Archaius2Ext.newConfiguration(KubeConnectorConfiguration.class),
            mock(ApiClient.class),
            reportApi,
            KubettlRuntimes.test()
    );

    @After
    public void tearDown() {
        // Clear interrupt flag possibly set by a test.
        Thread.interrupted();
    }

    @Test
    public void testFindExistingReport() {
        V1alpha1VulnerabilityReport report = newReport();
        when(reportApi.get(NAMESPACE, NAME)).thenReturn(new KubernetesApiResponse<>(report));

        assertThat(facade.findNamespacedVulnerabilityReport(NAMESPACE, NAME)).contains(report);
    }

    @Test
    public void testFindMissingReport() {
        when(reportApi.get(NAMESPACE, NAME)).thenReturn(new KubernetesApiResponse<>(new V1Status().code(404).reason("NotFound"), 404));

        assertThat(facade.findNamespacedVulnerabilityReport(NAMESPACE, NAME)).isEmpty();
    }

    @Test
    public void testFindFailsOnServerError() {
        when(reportApi.get(NAMESPACE, NAME)).thenReturn(new KubernetesApiResponse<>(new V1Status().code(500).reason("InternalError"), 500));

        KubeApiException error = catchThrowableOfType(() -> facade.findNamespacedVulnerabilityReport(NAMESPACE, NAME), KubeApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.INTERNAL);
        assertThat(error.getMessage()).contains(NAMESPACE).contains(NAME);
    }

    @Test
    public void testFindFailsOnIoError() {
        when(reportApi.get(NAMESPACE, NAME)).thenThrow(new IllegalStateException(new IOException("connection refused")));

        KubeApiException error = catchThrowableOfType(() -> facade.findNamespacedVulnerabilityReport(NAMESPACE, NAME), KubeApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.INTERNAL);
    }

    @Test
    public void testFindInterrupted() {
        when(reportApi.get(NAMESPACE, NAME)).thenThrow(new IllegalStateException(new InterruptedIOException("interrupted")));

        KubeApiException error = catchThrowableOfType(() -> facade.findNamespacedVulnerabilityReport(NAMESPACE, NAME), KubeApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.CANCELLED);
    }

    @Test
    public void testFindWithInterruptFlagSet() {
        when(reportApi.get(NAMESPACE, NAME)).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(new IOException("Socket closed"));
        });

        KubeApiException error = catchThrowableOfType(() -> facade.findNamespacedVulnerabilityReport(NAMESPACE, NAME), KubeApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.CANCELLED);
    }

    @Test
    public void testDeleteExistingReport() {
        when(reportApi.delete(NAMESPACE, NAME)).thenReturn(new KubernetesApiResponse<>(newReport()));

        assertThat(facade.deleteNamespacedVulnerabilityReport(NAMESPACE, NAME)).isTrue();
    }

    @Test
    public void testDeleteMissingReport() {
        when(reportApi.delete(NAMESPACE, NAME)).thenReturn(new KubernetesApiResponse<>(new V1Status().code(404), 404));

        assertThat(facade.deleteNamespacedVulnerabilityReport(NAMESPACE, NAME)).isFalse();
    }

    @Test
    public void testDeleteWithResponseMappingError() {
        when(reportApi.delete(NAMESPACE, NAME)).thenThrow(new JsonSyntaxException("Expected BEGIN_OBJECT"));

        assertThat(facade.deleteNamespacedVulnerabilityReport(NAMESPACE, NAME)).isTrue();
    }

    @Test
    public void testDeleteForbidden() {
        when(reportApi.delete(NAMESPACE, NAME)).thenReturn(new KubernetesApiResponse<>(new V1Status().code(403).reason("Forbidden"), 403));

        KubeApiException error = catchThrowableOfType(() -> facade.deleteNamespacedVulnerabilityReport(NAMESPACE, NAME), KubeApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(KubeApiException.ErrorCode.INTERNAL);
    }

    @Test(expected = IllegalStateException.class)
    public void testInformerNotAvailableAfterDeactivation() {
        facade.deactivate();
        facade.getVulnerabilityReportInformer();
    }

    private static V1alpha1VulnerabilityReport newReport() {
        return new V1alpha1VulnerabilityReport()
                .apiVersion("aquasecurity.github.io/v1alpha1")
                .kind(V1alpha1VulnerabilityReport.KIND)
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name(NAME));
    }
}

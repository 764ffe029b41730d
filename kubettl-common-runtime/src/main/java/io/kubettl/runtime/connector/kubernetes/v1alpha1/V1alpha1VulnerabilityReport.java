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

package io.kubettl.runtime.connector.kubernetes.v1alpha1;

import java.util.Objects;

import com.google.gson.annotations.SerializedName;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;

/**
 * GSON-compatible POJO of the Aqua Security scanner VulnerabilityReport custom resource
 * (aquasecurity.github.io/v1alpha1). Only the fields read by the controller are mapped.
 */
public class V1alpha1VulnerabilityReport implements KubernetesObject {

    public static final String GROUP = "aquasecurity.github.io";
    public static final String VERSION = "v1alpha1";
    public static final String PLURAL = "vulnerabilityreports";
    public static final String KIND = "VulnerabilityReport";

    @SerializedName("apiVersion")
    private String apiVersion = null;

    @SerializedName("kind")
    private String kind = null;

    @SerializedName("metadata")
    private V1ObjectMeta metadata = null;

    @SerializedName("report")
    private V1alpha1VulnerabilityScanResult report = null;

    public V1alpha1VulnerabilityReport apiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
        return this;
    }

    @Override
    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public V1alpha1VulnerabilityReport kind(String kind) {
        this.kind = kind;
        return this;
    }

    @Override
    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public V1alpha1VulnerabilityReport metadata(V1ObjectMeta metadata) {
        this.metadata = metadata;
        return this;
    }

    @Override
    public V1ObjectMeta getMetadata() {
        return metadata;
    }

    public void setMetadata(V1ObjectMeta metadata) {
        this.metadata = metadata;
    }

    public V1alpha1VulnerabilityReport report(V1alpha1VulnerabilityScanResult report) {
        this.report = report;
        return this;
    }

    public V1alpha1VulnerabilityScanResult getReport() {
        return report;
    }

    public void setReport(V1alpha1VulnerabilityScanResult report) {
        this.report = report;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1VulnerabilityReport that = (V1alpha1VulnerabilityReport) o;
        return Objects.equals(apiVersion, that.apiVersion) &&
                Objects.equals(kind, that.kind) &&
                Objects.equals(metadata, that.metadata) &&
                Objects.equals(report, that.report);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, kind, metadata, report);
    }

    @Override
    public String toString() {
        return "V1alpha1VulnerabilityReport{" +
                "apiVersion='" + apiVersion + '\'' +
                ", kind='" + kind + '\'' +
                ", metadata=" + metadata +
                ", report=" + report +
                '}';
    }
}

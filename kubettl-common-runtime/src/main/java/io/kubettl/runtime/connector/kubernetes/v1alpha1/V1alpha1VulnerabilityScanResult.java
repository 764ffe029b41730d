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

import java.time.OffsetDateTime;
import java.util.Objects;

import com.google.gson.annotations.SerializedName;

/**
 * The 'report' section of a VulnerabilityReport. The scanner rewrites it, including the update timestamp,
 * each time the workload image is scanned again.
 */
public class V1alpha1VulnerabilityScanResult {

    @SerializedName("updateTimestamp")
    private OffsetDateTime updateTimestamp = null;

    @SerializedName("scanner")
    private V1alpha1Scanner scanner = null;

    @SerializedName("summary")
    private V1alpha1VulnerabilitySummary summary = null;

    public V1alpha1VulnerabilityScanResult updateTimestamp(OffsetDateTime updateTimestamp) {
        this.updateTimestamp = updateTimestamp;
        return this;
    }

    public OffsetDateTime getUpdateTimestamp() {
        return updateTimestamp;
    }

    public void setUpdateTimestamp(OffsetDateTime updateTimestamp) {
        this.updateTimestamp = updateTimestamp;
    }

    public V1alpha1VulnerabilityScanResult scanner(V1alpha1Scanner scanner) {
        this.scanner = scanner;
        return this;
    }

    public V1alpha1Scanner getScanner() {
        return scanner;
    }

    public void setScanner(V1alpha1Scanner scanner) {
        this.scanner = scanner;
    }

    public V1alpha1VulnerabilityScanResult summary(V1alpha1VulnerabilitySummary summary) {
        this.summary = summary;
        return this;
    }

    public V1alpha1VulnerabilitySummary getSummary() {
        return summary;
    }

    public void setSummary(V1alpha1VulnerabilitySummary summary) {
        this.summary = summary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1VulnerabilityScanResult that = (V1alpha1VulnerabilityScanResult) o;
        return Objects.equals(updateTimestamp, that.updateTimestamp) &&
                Objects.equals(scanner, that.scanner) &&
                Objects.equals(summary, that.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(updateTimestamp, scanner, summary);
    }

    @Override
    public String toString() {
        return "V1alpha1VulnerabilityScanResult{" +
                "updateTimestamp=" + updateTimestamp +
                ", scanner=" + scanner +
                ", summary=" + summary +
                '}';
    }
}

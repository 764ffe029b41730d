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

/**
 * Number of vulnerabilities found, per severity.
 */
public class V1alpha1VulnerabilitySummary {

    @SerializedName("criticalCount")
    private int criticalCount;

    @SerializedName("highCount")
    private int highCount;

    @SerializedName("mediumCount")
    private int mediumCount;

    @SerializedName("lowCount")
    private int lowCount;

    @SerializedName("unknownCount")
    private int unknownCount;

    public int getCriticalCount() {
        return criticalCount;
    }

    public void setCriticalCount(int criticalCount) {
        this.criticalCount = criticalCount;
    }

    public int getHighCount() {
        return highCount;
    }

    public void setHighCount(int highCount) {
        this.highCount = highCount;
    }

    public int getMediumCount() {
        return mediumCount;
    }

    public void setMediumCount(int mediumCount) {
        this.mediumCount = mediumCount;
    }

    public int getLowCount() {
        return lowCount;
    }

    public void setLowCount(int lowCount) {
        this.lowCount = lowCount;
    }

    public int getUnknownCount() {
        return unknownCount;
    }

    public void setUnknownCount(int unknownCount) {
        this.unknownCount = unknownCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1VulnerabilitySummary that = (V1alpha1VulnerabilitySummary) o;
        return criticalCount == that.criticalCount &&
                highCount == that.highCount &&
                mediumCount == that.mediumCount &&
                lowCount == that.lowCount &&
                unknownCount == that.unknownCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(criticalCount, highCount, mediumCount, lowCount, unknownCount);
    }

    @Override
    public String toString() {
        return "V1alpha1VulnerabilitySummary{" +
                "criticalCount=" + criticalCount +
                ", highCount=" + highCount +
                ", mediumCount=" + mediumCount +
                ", lowCount=" + lowCount +
                ", unknownCount=" + unknownCount +
                '}';
    }
}

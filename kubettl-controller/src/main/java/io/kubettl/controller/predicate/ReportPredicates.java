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

package io.kubettl.controller.predicate;

import java.util.function.Predicate;

import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;

public final class ReportPredicates {

    private static final Predicate<V1alpha1VulnerabilityReport> IS_BEING_TERMINATED =
            report -> report.getMetadata() != null && report.getMetadata().getDeletionTimestamp() != null;

    private ReportPredicates() {
    }

    /**
     * Matches reports with the deletion timestamp set. Such reports are already scheduled for removal.
     */
    public static Predicate<V1alpha1VulnerabilityReport> isBeingTerminated() {
        return IS_BEING_TERMINATED;
    }
}

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

import java.time.OffsetDateTime;

import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ReportPredicatesTest {

    @Test
    public void testIsBeingTerminated() {
        V1alpha1VulnerabilityReport terminating = new V1alpha1VulnerabilityReport().metadata(
                new V1ObjectMeta().name("report1").deletionTimestamp(OffsetDateTime.parse("2023-01-01T00:00:00Z"))
        );
        V1alpha1VulnerabilityReport active = new V1alpha1VulnerabilityReport().metadata(new V1ObjectMeta().name("report2"));

        assertThat(ReportPredicates.isBeingTerminated().test(terminating)).isTrue();
        assertThat(ReportPredicates.isBeingTerminated().test(active)).isFalse();
        assertThat(ReportPredicates.isBeingTerminated().test(new V1alpha1VulnerabilityReport())).isFalse();
    }
}

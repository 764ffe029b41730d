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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import io.kubettl.common.util.archaius2.Archaius2Ext;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InstallModePredicateTest {

    @Test
    public void testResolveInstallMode() {
        assertThat(InstallModePredicate.resolveInstallMode("operators", Collections.emptySet()))
                .isEqualTo(InstallMode.AllNamespaces);
        assertThat(InstallModePredicate.resolveInstallMode("operators", Collections.singleton("operators")))
                .isEqualTo(InstallMode.OwnNamespace);
        assertThat(InstallModePredicate.resolveInstallMode("operators", Collections.singleton("foo")))
                .isEqualTo(InstallMode.SingleNamespace);
        assertThat(InstallModePredicate.resolveInstallMode("operators", new HashSet<>(Arrays.asList("foo", "bar"))))
                .isEqualTo(InstallMode.MultiNamespace);
    }

    @Test
    public void testAllNamespaces() {
        InstallModePredicate predicate = newPredicate("operators", "");

        assertThat(predicate.getInstallMode()).isEqualTo(InstallMode.AllNamespaces);
        assertThat(predicate.getTargetNamespaces()).isEmpty();
        assertThat(predicate.test(newReport("foo"))).isTrue();
        assertThat(predicate.test(newReport("kube-system"))).isTrue();
    }

    @Test
    public void testOwnNamespace() {
        InstallModePredicate predicate = newPredicate("operators", "operators");

        assertThat(predicate.getInstallMode()).isEqualTo(InstallMode.OwnNamespace);
        assertThat(predicate.test(newReport("operators"))).isTrue();
        assertThat(predicate.test(newReport("foo"))).isFalse();
    }

    @Test
    public void testSingleNamespace() {
        InstallModePredicate predicate = newPredicate("operators", "foo");

        assertThat(predicate.getInstallMode()).isEqualTo(InstallMode.SingleNamespace);
        assertThat(predicate.test(newReport("foo"))).isTrue();
        assertThat(predicate.test(newReport("operators"))).isFalse();
    }

    @Test
    public void testMultiNamespace() {
        InstallModePredicate predicate = newPredicate("operators", "foo,bar");

        assertThat(predicate.getInstallMode()).isEqualTo(InstallMode.MultiNamespace);
        assertThat(predicate.getTargetNamespaces()).containsExactly("foo", "bar");
        assertThat(predicate.test(newReport("foo"))).isTrue();
        assertThat(predicate.test(newReport("bar"))).isTrue();
        assertThat(predicate.test(newReport("baz"))).isFalse();
    }

    @Test
    public void testMissingOperatorNamespace() {
        assertThatThrownBy(() -> newPredicate("", "foo")).isInstanceOf(IllegalStateException.class);
    }

    private static InstallModePredicate newPredicate(String operatorNamespace, String targetNamespaces) {
        return new InstallModePredicate(Archaius2Ext.newConfiguration(OperatorConfiguration.class,
                "kubettl.operator.operatorNamespace", operatorNamespace,
                "kubettl.operator.targetNamespaces", targetNamespaces
        ));
    }

    private static V1alpha1VulnerabilityReport newReport(String namespace) {
        return new V1alpha1VulnerabilityReport().metadata(new V1ObjectMeta().namespace(namespace).name("report1"));
    }
}

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

import java.util.Set;
import java.util.function.Predicate;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubettl.common.util.StringExt;
import io.kubettl.runtime.connector.kubernetes.KubeUtil;
import io.kubettl.runtime.connector.kubernetes.v1alpha1.V1alpha1VulnerabilityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admits reports from the namespaces the controller is responsible for, according to the resolved {@link InstallMode}.
 */
@Singleton
public class InstallModePredicate implements Predicate<V1alpha1VulnerabilityReport> {

    private static final Logger logger = LoggerFactory.getLogger(InstallModePredicate.class);

    private final InstallMode installMode;
    private final String operatorNamespace;
    private final Set<String> targetNamespaces;

    @Inject
    public InstallModePredicate(OperatorConfiguration configuration) {
        this.operatorNamespace = configuration.getOperatorNamespace();
        if (StringExt.isEmpty(operatorNamespace) || operatorNamespace.trim().isEmpty()) {
            throw new IllegalStateException("kubettl.operator.operatorNamespace must be set");
        }
        this.targetNamespaces = StringExt.splitByCommaIntoSet(configuration.getTargetNamespaces());
        this.installMode = resolveInstallMode(operatorNamespace, targetNamespaces);

        logger.info("Resolved install mode: installMode={}, operatorNamespace={}, targetNamespaces={}",
                installMode, operatorNamespace, targetNamespaces);
    }

    public InstallMode getInstallMode() {
        return installMode;
    }

    public Set<String> getTargetNamespaces() {
        return targetNamespaces;
    }

    @Override
    public boolean test(V1alpha1VulnerabilityReport report) {
        if (installMode == InstallMode.AllNamespaces) {
            return true;
        }
        return targetNamespaces.contains(KubeUtil.getMetadataNamespace(report.getMetadata()));
    }

    static InstallMode resolveInstallMode(String operatorNamespace, Set<String> targetNamespaces) {
        if (targetNamespaces.isEmpty()) {
            return InstallMode.AllNamespaces;
        }
        if (targetNamespaces.size() > 1) {
            return InstallMode.MultiNamespace;
        }
        return targetNamespaces.contains(operatorNamespace) ? InstallMode.OwnNamespace : InstallMode.SingleNamespace;
    }
}

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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "kubettl.kubernetes")
public interface KubeConnectorConfiguration {

    /**
     * @return Kubernetes API server URL. If not set, the kube config file or the in-cluster configuration is used.
     */
    String getKubeApiServerUrl();

    /**
     * @return path to the kube config file. If not set, the default client configuration lookup applies.
     */
    String getKubeConfigPath();

    /**
     * @return read timeout of the Kubernetes API client, as an interval with a unit, like "30s"
     */
    @DefaultValue("60s")
    String getKubeApiClientReadTimeout();

    /**
     * @return how often the report informer triggers a full resync of its cache with the registered handlers
     */
    @DefaultValue("300000" /* 5 min */)
    long getReportInformerResyncIntervalMs();
}

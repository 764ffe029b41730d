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

package io.kubettl.controller;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.kubettl.common.runtime.KubettlRuntime;
import io.kubettl.common.runtime.internal.DefaultKubettlRuntime;
import io.kubettl.common.util.unit.TimeUnitExt;
import io.kubettl.runtime.connector.kubernetes.DefaultKubeApiFacade;
import io.kubettl.runtime.connector.kubernetes.KubeApiClients;
import io.kubettl.runtime.connector.kubernetes.KubeApiFacade;
import io.kubettl.runtime.connector.kubernetes.KubeConnectorConfiguration;
import io.kubernetes.client.openapi.ApiClient;

public class KubeClientModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(Registry.class).toInstance(new DefaultRegistry());
        bind(KubettlRuntime.class).to(DefaultKubettlRuntime.class);
        bind(KubeApiFacade.class).to(DefaultKubeApiFacade.class);
    }

    @Provides
    @Singleton
    public KubeConnectorConfiguration getKubeConnectorConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(KubeConnectorConfiguration.class);
    }

    @Provides
    @Singleton
    public ApiClient getKubeApiClient(KubeConnectorConfiguration configuration) {
        long readTimeoutMs = TimeUnitExt.toMillis(configuration.getKubeApiClientReadTimeout())
                .orElseThrow(() -> new IllegalArgumentException("Malformed kubettl.kubernetes.kubeApiClientReadTimeout: "
                        + configuration.getKubeApiClientReadTimeout()));
        return KubeApiClients.createApiClient(
                configuration.getKubeApiServerUrl(),
                configuration.getKubeConfigPath(),
                readTimeoutMs
        );
    }
}

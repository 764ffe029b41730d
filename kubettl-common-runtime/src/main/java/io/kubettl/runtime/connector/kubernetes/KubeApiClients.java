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
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;

public final class KubeApiClients {

    private KubeApiClients() {
    }

    /**
     * Creates {@link ApiClient} connected to the given API server. If the URL is not set, the kube config file
     * is used, and if that is not set either, the default lookup order of the Kubernetes client applies
     * (KUBECONFIG, $HOME/.kube/config, in-cluster service account).
     */
    public static ApiClient createApiClient(String kubeApiServerUrl,
                                            String kubeConfigPath,
                                            long readTimeoutMs) {
        ApiClient client;
        if (Strings.isNullOrEmpty(kubeApiServerUrl)) {
            try {
                if (Strings.isNullOrEmpty(kubeConfigPath)) {
                    client = Config.defaultClient();
                } else {
                    client = Config.fromConfig(kubeConfigPath);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot load Kubernetes client configuration", e);
            }
        } else {
            client = Config.fromUrl(kubeApiServerUrl);
        }

        OkHttpClient.Builder newBuilder = client.getHttpClient().newBuilder();

        // See: https://github.com/kubernetes-client/java/pull/960
        newBuilder.protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS);

        client.setHttpClient(newBuilder.build());
        return client;
    }

    public static SharedInformerFactory createSharedInformerFactory(String threadNamePrefix, ApiClient apiClient) {
        ExecutorService threadPool = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat(threadNamePrefix + "%d").setDaemon(true).build()
        );
        return new SharedInformerFactory(apiClient, threadPool);
    }
}

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

import io.kubernetes.client.openapi.models.V1ObjectMeta;

public final class KubeUtil {

    private KubeUtil() {
    }

    /**
     * Get Kube object name
     */
    public static String getMetadataName(V1ObjectMeta metadata) {
        if (metadata == null) {
            return "";
        }

        return metadata.getName();
    }

    /**
     * Get Kube object namespace. Empty string for cluster scoped objects.
     */
    public static String getMetadataNamespace(V1ObjectMeta metadata) {
        if (metadata == null || metadata.getNamespace() == null) {
            return "";
        }

        return metadata.getNamespace();
    }
}

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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "kubettl.operator")
public interface OperatorConfiguration {

    /**
     * @return namespace in which the controller is deployed. Required.
     */
    String getOperatorNamespace();

    /**
     * @return comma separated list of namespaces watched by the controller. If empty, all namespaces are watched.
     */
    @DefaultValue("")
    String getTargetNamespaces();
}

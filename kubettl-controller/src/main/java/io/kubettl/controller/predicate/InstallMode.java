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

/**
 * Set of namespaces the controller is responsible for, derived from the operator and the target namespaces.
 */
public enum InstallMode {

    /**
     * The only target namespace is the operator namespace.
     */
    OwnNamespace,

    /**
     * A single target namespace, different from the operator namespace.
     */
    SingleNamespace,

    /**
     * More than one target namespace.
     */
    MultiNamespace,

    /**
     * No target namespaces. All namespaces in the cluster are watched.
     */
    AllNamespaces
}

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

package io.kubettl.controller.model;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Identity of a namespaced resource. Two keys are equal if both namespace and name are equal.
 */
public final class ResourceKey {

    private final String namespace;
    private final String name;

    private ResourceKey(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public static ResourceKey of(String namespace, String name) {
        Preconditions.checkNotNull(namespace, "namespace is null");
        Preconditions.checkArgument(name != null && !name.isEmpty(), "name is null or empty");
        return new ResourceKey(namespace, name);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourceKey that = (ResourceKey) o;
        return Objects.equals(namespace, that.namespace) &&
                Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + '/' + name;
    }
}

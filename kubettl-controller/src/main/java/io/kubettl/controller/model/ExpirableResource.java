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

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Read-only snapshot of a resource subject to TTL based garbage collection.
 */
public final class ExpirableResource {

    private final ResourceKey key;
    private final Map<String, String> annotations;
    private final Instant referenceTimestamp;

    private ExpirableResource(ResourceKey key, Map<String, String> annotations, Instant referenceTimestamp) {
        this.key = key;
        this.annotations = annotations;
        this.referenceTimestamp = referenceTimestamp;
    }

    public ResourceKey getKey() {
        return key;
    }

    public Optional<String> getAnnotation(String name) {
        return Optional.ofNullable(annotations.get(name));
    }

    /**
     * The time the resource content was last computed. The TTL is counted from this point in time.
     * Empty if the resource does not carry any usable timestamp.
     */
    public Optional<Instant> getReferenceTimestamp() {
        return Optional.ofNullable(referenceTimestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExpirableResource that = (ExpirableResource) o;
        return Objects.equals(key, that.key) &&
                Objects.equals(annotations, that.annotations) &&
                Objects.equals(referenceTimestamp, that.referenceTimestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, annotations, referenceTimestamp);
    }

    @Override
    public String toString() {
        return "ExpirableResource{" +
                "key=" + key +
                ", annotations=" + annotations +
                ", referenceTimestamp=" + referenceTimestamp +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private ResourceKey key;
        private Map<String, String> annotations;
        private Instant referenceTimestamp;

        private Builder() {
        }

        public Builder withKey(ResourceKey key) {
            this.key = key;
            return this;
        }

        public Builder withAnnotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder withReferenceTimestamp(Instant referenceTimestamp) {
            this.referenceTimestamp = referenceTimestamp;
            return this;
        }

        public ExpirableResource build() {
            Preconditions.checkNotNull(key, "key is null");
            Map<String, String> annotationsCopy = annotations == null || annotations.isEmpty()
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new HashMap<>(annotations));
            return new ExpirableResource(key, annotationsCopy, referenceTimestamp);
        }
    }
}

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

package io.kubettl.controller.ttl;

import io.kubettl.controller.model.ResourceKey;

/**
 * Raised when the TTL of a resource cannot be computed because of the resource content. Retrying does not help,
 * until the resource is changed.
 */
public class InvalidTtlAnnotationException extends RuntimeException {

    private final ResourceKey key;
    private final String annotation;
    private final String value;

    private InvalidTtlAnnotationException(String message, ResourceKey key, String annotation, String value) {
        super(message);
        this.key = key;
        this.annotation = annotation;
        this.value = value;
    }

    public ResourceKey getKey() {
        return key;
    }

    public String getAnnotation() {
        return annotation;
    }

    public String getValue() {
        return value;
    }

    public static InvalidTtlAnnotationException malformedDuration(ResourceKey key, String annotation, String value) {
        return new InvalidTtlAnnotationException(
                String.format("Failed parsing %s with value '%s' of %s: expected duration like 24h or 1h30m", annotation, value, key),
                key,
                annotation,
                value
        );
    }

    public static InvalidTtlAnnotationException missingReferenceTimestamp(ResourceKey key, String annotation, String value) {
        return new InvalidTtlAnnotationException(
                String.format("Cannot evaluate %s=%s of %s: the resource has no update or creation timestamp", annotation, value, key),
                key,
                annotation,
                value
        );
    }
}

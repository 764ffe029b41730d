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

package io.kubettl.common.util;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A set of additional functions complementing {@link java.util.Optional} for values that may be null.
 */
public final class Evaluators {

    private Evaluators() {
    }

    /**
     * Evaluate the given consumer only if the value is not null.
     */
    public static <T> void acceptNotNull(T value, Consumer<T> consumer) {
        if (value != null) {
            consumer.accept(value);
        }
    }

    /**
     * If value is null, return null, otherwise return the result of the transformer applied to the value.
     */
    public static <T, R> R applyNotNull(T value, Function<T, R> transformer) {
        return value == null ? null : transformer.apply(value);
    }

    /**
     * Returns first non-null value.
     */
    @SafeVarargs
    public static <T> T getFirstNotNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}

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

package io.kubettl.common.util.time;

import java.time.Instant;

/**
 * Time source injected into all components that make time based decisions, so tests can drive the time explicitly.
 */
public interface Clock {

    /**
     * Time elapsed in nanoseconds. Only meaningful for measuring intervals.
     */
    long nanoTime();

    /**
     * Current time in milliseconds, equivalent to {@link System#currentTimeMillis()}.
     */
    long wallTime();

    /**
     * Current wall time as {@link Instant}.
     */
    default Instant instant() {
        return Instant.ofEpochMilli(wallTime());
    }

    /**
     * Returns true, if the current time is strictly past the given timestamp.
     */
    default boolean isPast(long timestamp) {
        return wallTime() > timestamp;
    }
}

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

package io.kubettl.common.util.retry.internal;

import java.util.Optional;

import io.kubettl.common.util.retry.Retryer;

public class ExponentialBackoffRetryer implements Retryer {

    private final Optional<Long> currentDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryer(Optional<Long> currentDelayMs, long maxDelayMs) {
        this.currentDelayMs = currentDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public Optional<Long> getDelayMs() {
        return currentDelayMs;
    }

    @Override
    public Retryer retry() {
        if (currentDelayMs.get() == maxDelayMs) {
            return this;
        }
        long nextDelayMs = currentDelayMs.get() == 0 ? 1 : currentDelayMs.get() * 2;
        return new ExponentialBackoffRetryer(Optional.of(Math.min(nextDelayMs, maxDelayMs)), maxDelayMs);
    }
}

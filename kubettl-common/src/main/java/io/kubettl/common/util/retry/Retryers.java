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

package io.kubettl.common.util.retry;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import io.kubettl.common.util.retry.internal.ExponentialBackoffRetryer;

public final class Retryers {

    private Retryers() {
    }

    public static Retryer exponentialBackoff(long initialDelay, long maxDelay, TimeUnit timeUnit) {
        Preconditions.checkArgument(initialDelay >= 0, "Initial delay cannot be negative: %s", initialDelay);
        Preconditions.checkArgument(maxDelay >= initialDelay, "Max delay (%s) must be >= initial delay (%s)", maxDelay, initialDelay);

        return new ExponentialBackoffRetryer(
                Optional.of(timeUnit.toMillis(initialDelay)),
                timeUnit.toMillis(maxDelay)
        );
    }
}

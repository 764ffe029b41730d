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

import java.time.Duration;
import java.time.Instant;

import com.google.common.base.Preconditions;
import io.kubettl.controller.model.ExpiryVerdict;

/**
 * Decides if a resource with the given TTL and reference time is expired at a given point in time.
 */
public final class ExpiryCalculator {

    private ExpiryCalculator() {
    }

    /**
     * The resource expires at {@code referenceTime + ttl}, and is expired only when {@code now} is strictly
     * after that point. At the exact expiry instant the verdict is "not expired" with zero remaining time.
     */
    public static ExpiryVerdict evaluate(Duration ttl, Instant referenceTime, Instant now) {
        Preconditions.checkNotNull(ttl, "ttl is null");
        Preconditions.checkNotNull(referenceTime, "referenceTime is null");
        Preconditions.checkNotNull(now, "now is null");

        Instant expiresAt = referenceTime.plus(ttl);
        if (now.isAfter(expiresAt)) {
            return ExpiryVerdict.expired();
        }
        return ExpiryVerdict.remaining(Duration.between(now, expiresAt));
    }
}

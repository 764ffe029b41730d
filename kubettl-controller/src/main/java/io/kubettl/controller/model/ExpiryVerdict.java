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

import java.time.Duration;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Result of the expiry evaluation. If the resource is expired, the remaining time is always {@link Duration#ZERO}.
 */
public final class ExpiryVerdict {

    private static final ExpiryVerdict EXPIRED = new ExpiryVerdict(true, Duration.ZERO);

    private final boolean expired;
    private final Duration remaining;

    private ExpiryVerdict(boolean expired, Duration remaining) {
        this.expired = expired;
        this.remaining = remaining;
    }

    public static ExpiryVerdict expired() {
        return EXPIRED;
    }

    public static ExpiryVerdict remaining(Duration remaining) {
        Preconditions.checkArgument(!remaining.isNegative(), "Negative remaining time: %s", remaining);
        return new ExpiryVerdict(false, remaining);
    }

    public boolean isExpired() {
        return expired;
    }

    public Duration getRemaining() {
        return remaining;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExpiryVerdict that = (ExpiryVerdict) o;
        return expired == that.expired &&
                Objects.equals(remaining, that.remaining);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expired, remaining);
    }

    @Override
    public String toString() {
        return "ExpiryVerdict{" +
                "expired=" + expired +
                ", remaining=" + remaining +
                '}';
    }
}

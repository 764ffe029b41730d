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

package io.kubettl.common.util.time.internal;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import io.kubettl.common.util.time.TestClock;

/**
 * Test clock starting at the epoch. Time moves only when {@link #advanceTime(long, TimeUnit)} or
 * {@link #resetTo(Instant)} is called.
 */
public class DefaultTestClock implements TestClock {

    private volatile long nanoTime;
    private volatile long wallTimeMs;

    @Override
    public long advanceTime(long interval, TimeUnit timeUnit) {
        long nanos = timeUnit.toNanos(interval);
        this.nanoTime += nanos;
        this.wallTimeMs += TimeUnit.NANOSECONDS.toMillis(nanos);
        return wallTimeMs;
    }

    @Override
    public TestClock resetTo(Instant instant) {
        this.wallTimeMs = instant.toEpochMilli();
        return this;
    }

    @Override
    public long nanoTime() {
        return nanoTime;
    }

    @Override
    public long wallTime() {
        return wallTimeMs;
    }
}

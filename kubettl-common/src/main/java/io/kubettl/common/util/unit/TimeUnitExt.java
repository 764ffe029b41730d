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

package io.kubettl.common.util.unit;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TimeUnitExt {

    private static final Pattern INTERVAL_WITH_UNIT_RE = Pattern.compile("(\\d+)(ms|s|m|h|d)");

    /**
     * Single duration component. Longer units must precede their prefixes ("ms" before "m").
     */
    private static final Pattern DURATION_PART_RE = Pattern.compile("(\\d+)(h|ms|m|s|us|µs|ns)");

    /**
     * Parses a single interval with a unit, like "30s" or "5m". Used for configuration values.
     */
    public static Optional<Duration> parse(String intervalWithUnit) {
        if (intervalWithUnit == null) {
            return Optional.empty();
        }
        Matcher matcher = INTERVAL_WITH_UNIT_RE.matcher(intervalWithUnit);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        long interval;
        try {
            interval = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        switch (matcher.group(2)) {
            case "ms":
                return Optional.of(Duration.ofMillis(interval));
            case "s":
                return Optional.of(Duration.ofSeconds(interval));
            case "m":
                return Optional.of(Duration.ofMinutes(interval));
            case "h":
                return Optional.of(Duration.ofHours(interval));
            case "d":
                return Optional.of(Duration.ofDays(interval));
        }
        return Optional.empty();
    }

    public static Optional<Long> toMillis(String intervalWithUnit) {
        return parse(intervalWithUnit).map(Duration::toMillis);
    }

    /**
     * Parses a duration string made of one or more concatenated (unsigned integer)(unit) pairs, for example
     * "1h30m" or "1500ms". Valid units are h, m, s, ms, us (or µs) and ns. The parts are summed up.
     * <p>
     * Returns {@link Optional#empty()} for null or empty text, signs, fractions, white spaces, unknown units,
     * a number without a unit, or a total exceeding the nanosecond range of a long value.
     */
    public static Optional<Duration> parseDuration(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = DURATION_PART_RE.matcher(text);
        long totalNanos = 0;
        int position = 0;
        try {
            while (position < text.length()) {
                matcher.region(position, text.length());
                if (!matcher.lookingAt()) {
                    return Optional.empty();
                }
                long value = Long.parseLong(matcher.group(1));
                long nanos = Math.multiplyExact(value, toNanosMultiplier(matcher.group(2)));
                totalNanos = Math.addExact(totalNanos, nanos);
                position = matcher.end();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(totalNanos));
    }

    private static long toNanosMultiplier(String unit) {
        switch (unit) {
            case "h":
                return TimeUnit.HOURS.toNanos(1);
            case "m":
                return TimeUnit.MINUTES.toNanos(1);
            case "s":
                return TimeUnit.SECONDS.toNanos(1);
            case "ms":
                return TimeUnit.MILLISECONDS.toNanos(1);
            case "us":
            case "µs":
                return TimeUnit.MICROSECONDS.toNanos(1);
            case "ns":
                return 1;
        }
        throw new IllegalArgumentException("Unknown duration unit: " + unit);
    }
}

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

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static io.kubettl.common.util.DateTimeExt.toTimeUnitString;
import static org.assertj.core.api.Assertions.assertThat;

public class DateTimeExtTest {

    @Test
    public void testUtcDateTimeStringConversion() {
        ZonedDateTime now = ZonedDateTime.now().truncatedTo(ChronoUnit.MILLIS);
        String expected = DateTimeFormatter.ISO_LOCAL_DATE_TIME.withZone(ZoneId.of("UTC")).format(now) + 'Z';

        String actual = DateTimeExt.toUtcDateTimeString(Instant.from(now));
        assertThat(actual).isEqualTo(expected);
        assertThat(DateTimeExt.toUtcDateTimeString(Instant.parse("2023-01-01T01:00:00Z"))).isEqualTo("2023-01-01T01:00:00Z");
        assertThat(DateTimeExt.toUtcDateTimeString((Instant) null)).isNull();
    }

    @Test
    public void testTime() {
        long msDuration = 123;
        assertThat(toTimeUnitString(msDuration)).isEqualTo("123ms");

        long secDuration = 3 * 1000 + 123;
        assertThat(toTimeUnitString(secDuration)).isEqualTo("3s 123ms");

        long minDuration = (2 * 60 + 3) * 1000 + 123;
        assertThat(toTimeUnitString(minDuration)).isEqualTo("2min 3s 123ms");

        long hourDuration = ((1 * 60 + 2) * 60 + 3) * 1000 + 123;
        assertThat(toTimeUnitString(hourDuration)).isEqualTo("1h 2min 3s 123ms");

        long zeroMillis = 0;
        assertThat(toTimeUnitString(zeroMillis)).isEqualTo("0ms");

        long twoDays = TimeUnit.DAYS.toMillis(2);
        assertThat(toTimeUnitString(twoDays)).isEqualTo("2d");
    }

    @Test
    public void testDurationTime() {
        assertThat(toTimeUnitString(Duration.ofMinutes(15))).isEqualTo("15min");
        assertThat(toTimeUnitString(Duration.ofSeconds(-90))).isEqualTo("-1min 30s");
    }
}

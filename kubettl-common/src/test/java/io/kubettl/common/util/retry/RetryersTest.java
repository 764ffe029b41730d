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

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RetryersTest {

    @Test
    public void testExponentialBackoff() {
        Retryer retryer = Retryers.exponentialBackoff(100, 1_000, TimeUnit.MILLISECONDS);
        assertThat(retryer.getDelayMs()).contains(100L);

        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(200L);
        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(400L);
        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(800L);
        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(1_000L);
        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(1_000L);
    }

    @Test
    public void testExponentialBackoffFromZero() {
        Retryer retryer = Retryers.exponentialBackoff(0, 10, TimeUnit.SECONDS);
        assertThat(retryer.getDelayMs()).contains(0L);

        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(1L);
        retryer = retryer.retry();
        assertThat(retryer.getDelayMs()).contains(2L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDelays() {
        Retryers.exponentialBackoff(10, 1, TimeUnit.SECONDS);
    }
}

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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReconcileOutcomeTest {

    @Test
    public void testRequeueAfter() {
        ReconcileOutcome outcome = ReconcileOutcome.requeueAfter(Duration.ofSeconds(5));
        assertThat(outcome.getKind()).isEqualTo(ReconcileOutcome.Kind.RequeueAfter);
        assertThat(outcome.getRequeueAfter()).isEqualTo(Duration.ofSeconds(5));
        assertThat(outcome.getError()).isEmpty();
    }

    @Test
    public void testNegativeRequeueDelayIsRejected() {
        assertThatThrownBy(() -> ReconcileOutcome.requeueAfter(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testErrors() {
        RuntimeException error = new RuntimeException("simulated error");
        assertThat(ReconcileOutcome.transientError(error).getKind()).isEqualTo(ReconcileOutcome.Kind.TransientError);
        assertThat(ReconcileOutcome.permanentError(error).getKind()).isEqualTo(ReconcileOutcome.Kind.PermanentError);
        assertThat(ReconcileOutcome.permanentError(error).getError()).contains(error);
        assertThat(ReconcileOutcome.noOp().getError()).isEmpty();
        assertThat(ReconcileOutcome.deleted().getError()).isEmpty();
    }

    @Test
    public void testResourceKey() {
        assertThat(ResourceKey.of("default", "report1")).isEqualTo(ResourceKey.of("default", "report1"));
        assertThat(ResourceKey.of("default", "report1").toString()).isEqualTo("default/report1");
        assertThatThrownBy(() -> ResourceKey.of("default", "")).isInstanceOf(IllegalArgumentException.class);
    }
}

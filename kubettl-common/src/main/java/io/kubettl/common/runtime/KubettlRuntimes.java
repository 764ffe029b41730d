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

package io.kubettl.common.runtime;

import com.netflix.spectator.api.DefaultRegistry;
import io.kubettl.common.runtime.internal.DefaultKubettlRuntime;
import io.kubettl.common.util.time.Clocks;
import io.kubettl.common.util.time.TestClock;

public final class KubettlRuntimes {

    private KubettlRuntimes() {
    }

    public static KubettlRuntime test() {
        return test(Clocks.test());
    }

    public static KubettlRuntime test(TestClock clock) {
        return new DefaultKubettlRuntime(clock, new DefaultRegistry());
    }
}

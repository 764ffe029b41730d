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

package io.kubettl.common.runtime.internal;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Registry;
import io.kubettl.common.runtime.KubettlRuntime;
import io.kubettl.common.util.time.Clock;
import io.kubettl.common.util.time.Clocks;

@Singleton
public class DefaultKubettlRuntime implements KubettlRuntime {

    private final Clock clock;
    private final Registry registry;

    @Inject
    public DefaultKubettlRuntime(Registry registry) {
        this(Clocks.system(), registry);
    }

    public DefaultKubettlRuntime(Clock clock, Registry registry) {
        this.clock = clock;
        this.registry = registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }
}

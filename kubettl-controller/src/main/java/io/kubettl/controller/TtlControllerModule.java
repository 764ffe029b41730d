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

package io.kubettl.controller;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import io.kubettl.controller.predicate.OperatorConfiguration;
import io.kubettl.controller.ttl.TtlControllerConfiguration;
import io.kubettl.controller.ttl.TtlReportController;

public class TtlControllerModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(TtlReportController.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    public OperatorConfiguration getOperatorConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(OperatorConfiguration.class);
    }

    @Provides
    @Singleton
    public TtlControllerConfiguration getTtlControllerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(TtlControllerConfiguration.class);
    }
}

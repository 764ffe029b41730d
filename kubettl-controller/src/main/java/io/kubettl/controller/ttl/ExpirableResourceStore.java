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

import java.util.Optional;

import io.kubettl.controller.model.ExpirableResource;
import io.kubettl.controller.model.ResourceKey;

/**
 * Access to the authoritative store of resources subject to TTL. Both operations are blocking, and must abort
 * with an exception when the calling thread is interrupted.
 */
public interface ExpirableResourceStore {

    /**
     * @return {@link Optional#empty()} if the resource does not exist
     */
    Optional<ExpirableResource> find(ResourceKey key);

    /**
     * @return true if the resource was deleted, false if it did not exist
     */
    boolean delete(ResourceKey key);
}

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

package io.kubettl.controller.queue;

import java.time.Duration;

import io.kubettl.controller.model.ResourceKey;

/**
 * Delivers resource keys to a reconciler. For a single key, at most one reconciliation runs at a time, and keys
 * added multiple times before being processed are delivered once. Different keys are processed concurrently.
 * The outcome of each reconciliation decides when, if ever, the key is delivered again.
 */
public interface ReconcileQueue {

    /**
     * Deliver the key as soon as possible. If the key is being reconciled right now, it is delivered again once
     * the current reconciliation completes.
     */
    void add(ResourceKey key);

    /**
     * Deliver the key no earlier than after the given delay. If the key already has an earlier delivery scheduled,
     * the call has no effect.
     */
    void addAfter(ResourceKey key, Duration delay);

    /**
     * Number of distinct keys waiting for delivery, immediately or with a delay.
     */
    int size();

    /**
     * Stops accepting new keys, cancels all scheduled deliveries, and interrupts running reconciliations.
     */
    void shutdown();
}

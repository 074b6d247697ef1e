package dev.mars.mqclient.api.adapter;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

/**
 * What a backend can do, consulted by the runtime to degrade gracefully.
 *
 * @param supportsPrefetchBatching   a single receive can return several messages in one broker round trip
 * @param supportsExplicitNack       the broker accepts a negative acknowledgment
 * @param supportsDelayedRedelivery  a nack can carry a redelivery delay
 * @param maxPrefetch                upper bound for messages requested per receive
 * @param concurrentOperationsSafe   publish, receive, ack and nack may run concurrently on one adapter
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public record BackendCapabilities(
    boolean supportsPrefetchBatching,
    boolean supportsExplicitNack,
    boolean supportsDelayedRedelivery,
    int maxPrefetch,
    boolean concurrentOperationsSafe
) {

    public BackendCapabilities {
        if (maxPrefetch < 1) {
            throw new IllegalArgumentException("Max prefetch must be at least 1, got " + maxPrefetch);
        }
        if (supportsDelayedRedelivery && !supportsExplicitNack) {
            throw new IllegalArgumentException("Delayed redelivery requires explicit nack support");
        }
    }

    /**
     * Clamps a requested prefetch into {@code [1, maxPrefetch]}.
     */
    public int clampPrefetch(int requested) {
        return Math.max(1, Math.min(requested, maxPrefetch));
    }
}

package dev.mars.mqclient.api.metrics;

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

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/**
 * No-operation implementation of MetricsProvider, used when metrics collection is
 * disabled so callers never need to null-check.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class NoOpMetricsProvider implements MetricsProvider {

    /**
     * Singleton instance. Use this instead of creating new instances.
     */
    public static final NoOpMetricsProvider INSTANCE = new NoOpMetricsProvider();

    private NoOpMetricsProvider() {
    }

    @Override
    public void recordMessageSent(String queue) {
        // No-op
    }

    @Override
    public void recordMessagesReceived(String queue, int count) {
        // No-op
    }

    @Override
    public void recordMessageProcessed(String queue, Duration processingTime) {
        // No-op
    }

    @Override
    public void recordMessageFailed(String queue, String reason) {
        // No-op
    }

    @Override
    public void recordMessageRetried(String queue, int retryCount) {
        // No-op
    }

    @Override
    public void recordMessageDropped(String queue, String reason) {
        // No-op
    }

    @Override
    public void recordAckDeadlineExpired(String queue) {
        // No-op
    }

    @Override
    public void recordReconnect(String brokerClient, boolean successful) {
        // No-op
    }

    @Override
    public Map<String, Number> getAllMetrics() {
        return Collections.emptyMap();
    }

    @Override
    public String getInstanceId() {
        return "noop";
    }
}

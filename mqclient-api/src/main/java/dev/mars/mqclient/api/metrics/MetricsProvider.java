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
import java.util.Map;

/**
 * Metrics hooks used by publishers, consumers and connections.
 *
 * Implementations must never be null - use {@link NoOpMetricsProvider} when metrics
 * collection is disabled - and must never let a metrics failure escape into messaging.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface MetricsProvider {

    // ========================================================================
    // Message lifecycle
    // ========================================================================

    void recordMessageSent(String queue);

    void recordMessagesReceived(String queue, int count);

    void recordMessageProcessed(String queue, Duration processingTime);

    /**
     * @param reason short failure classification, usually the exception's simple class name
     */
    void recordMessageFailed(String queue, String reason);

    void recordMessageRetried(String queue, int retryCount);

    /**
     * Records a message that was acknowledged without being processed successfully,
     * for example after its retries were used up.
     */
    void recordMessageDropped(String queue, String reason);

    void recordAckDeadlineExpired(String queue);

    // ========================================================================
    // Connection lifecycle
    // ========================================================================

    void recordReconnect(String brokerClient, boolean successful);

    // ========================================================================
    // Query
    // ========================================================================

    /**
     * @return metric names mapped to their current values
     */
    Map<String, Number> getAllMetrics();

    String getInstanceId();
}

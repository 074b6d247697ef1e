package dev.mars.mqclient.core.metrics;

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

import dev.mars.mqclient.api.metrics.MetricsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MetricsProvider} backed by {@link MqClientMetrics}. A failure to record a
 * metric is logged and never reaches the messaging code.
 */
public class MicrometerMetricsProvider implements MetricsProvider {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsProvider.class);

    private final MqClientMetrics metrics;

    public MicrometerMetricsProvider(MqClientMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        logger.info("Initialized MicrometerMetricsProvider with instance ID: {}", metrics.getInstanceId());
    }

    @Override
    public void recordMessageSent(String queue) {
        try {
            metrics.recordMessageSent(queue);
        } catch (Exception e) {
            logger.warn("Failed to record message sent metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordMessagesReceived(String queue, int count) {
        try {
            metrics.recordMessagesReceived(queue, count);
        } catch (Exception e) {
            logger.warn("Failed to record messages received metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordMessageProcessed(String queue, Duration processingTime) {
        try {
            metrics.recordMessageProcessed(queue, processingTime);
        } catch (Exception e) {
            logger.warn("Failed to record message processed metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordMessageFailed(String queue, String reason) {
        try {
            metrics.recordMessageFailed(queue, reason);
        } catch (Exception e) {
            logger.warn("Failed to record message failed metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordMessageRetried(String queue, int retryCount) {
        try {
            metrics.recordMessageRetried(queue, retryCount);
        } catch (Exception e) {
            logger.warn("Failed to record message retried metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordMessageDropped(String queue, String reason) {
        try {
            metrics.recordMessageDropped(queue, reason);
        } catch (Exception e) {
            logger.warn("Failed to record message dropped metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordAckDeadlineExpired(String queue) {
        try {
            metrics.recordAckDeadlineExpired(queue);
        } catch (Exception e) {
            logger.warn("Failed to record ack deadline metric for queue: {}", queue, e);
        }
    }

    @Override
    public void recordReconnect(String brokerClient, boolean successful) {
        try {
            metrics.recordReconnect(brokerClient, successful);
        } catch (Exception e) {
            logger.warn("Failed to record reconnect metric for broker: {}", brokerClient, e);
        }
    }

    @Override
    public Map<String, Number> getAllMetrics() {
        return metrics.getAllMetrics();
    }

    @Override
    public String getInstanceId() {
        return metrics.getInstanceId();
    }
}

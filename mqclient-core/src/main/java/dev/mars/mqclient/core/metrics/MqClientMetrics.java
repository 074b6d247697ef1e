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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the queue client.
 *
 * <p>Totals are tagged with the instance id only. Each event also increments a
 * {@code .by.queue} counter tagged with the queue name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class MqClientMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(MqClientMetrics.class);

    private final String instanceId;
    private MeterRegistry registry;

    // Counters
    private Counter messagesSent;
    private Counter messagesReceived;
    private Counter messagesProcessed;
    private Counter messagesFailed;
    private Counter messagesRetried;
    private Counter messagesDropped;
    private Counter ackDeadlinesExpired;
    private Counter reconnects;

    // Timers
    private Timer messageProcessingTime;

    public MqClientMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        messagesSent = Counter.builder("mqclient.messages.sent")
            .description("Total number of messages published and confirmed by the broker")
            .tag("instance", instanceId)
            .register(registry);

        messagesReceived = Counter.builder("mqclient.messages.received")
            .description("Total number of messages received from queues")
            .tag("instance", instanceId)
            .register(registry);

        messagesProcessed = Counter.builder("mqclient.messages.processed")
            .description("Total number of messages successfully processed and acknowledged")
            .tag("instance", instanceId)
            .register(registry);

        messagesFailed = Counter.builder("mqclient.messages.failed")
            .description("Total number of failed processing attempts")
            .tag("instance", instanceId)
            .register(registry);

        messagesRetried = Counter.builder("mqclient.messages.retried")
            .description("Total number of scheduled message retries")
            .tag("instance", instanceId)
            .register(registry);

        messagesDropped = Counter.builder("mqclient.messages.dropped")
            .description("Total number of messages acknowledged after exhausting their retries")
            .tag("instance", instanceId)
            .register(registry);

        ackDeadlinesExpired = Counter.builder("mqclient.messages.deadline_expired")
            .description("Total number of messages whose ack deadline expired before settlement")
            .tag("instance", instanceId)
            .register(registry);

        reconnects = Counter.builder("mqclient.connection.reconnects")
            .description("Total number of reconnect attempts after a lost broker connection")
            .tag("instance", instanceId)
            .register(registry);

        messageProcessingTime = Timer.builder("mqclient.message.processing.time")
            .description("Time taken to process messages")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("MQClient metrics registered for instance: {}", instanceId);
    }

    public void recordMessageSent(String queue) {
        if (messagesSent != null) {
            messagesSent.increment();
        }
        incrementByQueue("mqclient.messages.sent.by.queue", queue, 1);
    }

    public void recordMessagesReceived(String queue, int count) {
        if (messagesReceived != null) {
            messagesReceived.increment(count);
        }
        incrementByQueue("mqclient.messages.received.by.queue", queue, count);
    }

    public void recordMessageProcessed(String queue, Duration processingTime) {
        if (messagesProcessed != null) {
            messagesProcessed.increment();
        }
        incrementByQueue("mqclient.messages.processed.by.queue", queue, 1);

        if (messageProcessingTime != null) {
            messageProcessingTime.record(processingTime);
        }
        if (registry != null) {
            Timer.builder("mqclient.message.processing.time.by.queue")
                .tag("instance", instanceId)
                .tag("queue", queue)
                .register(registry)
                .record(processingTime);
        }
    }

    public void recordMessageFailed(String queue, String errorType) {
        if (messagesFailed != null) {
            messagesFailed.increment();
        }
        if (registry != null) {
            Counter.builder("mqclient.messages.failed.by.queue")
                .tag("instance", instanceId)
                .tag("queue", queue)
                .tag("error_type", errorType)
                .register(registry)
                .increment();
        }
    }

    public void recordMessageRetried(String queue, int retryCount) {
        if (messagesRetried != null) {
            messagesRetried.increment();
        }
        if (registry != null) {
            Counter.builder("mqclient.messages.retried.by.queue")
                .tag("instance", instanceId)
                .tag("queue", queue)
                .tag("retry_count", String.valueOf(retryCount))
                .register(registry)
                .increment();
        }
    }

    public void recordMessageDropped(String queue, String reason) {
        if (messagesDropped != null) {
            messagesDropped.increment();
        }
        if (registry != null) {
            Counter.builder("mqclient.messages.dropped.by.queue")
                .tag("instance", instanceId)
                .tag("queue", queue)
                .tag("reason", reason)
                .register(registry)
                .increment();
        }
    }

    public void recordAckDeadlineExpired(String queue) {
        if (ackDeadlinesExpired != null) {
            ackDeadlinesExpired.increment();
        }
        incrementByQueue("mqclient.messages.deadline_expired.by.queue", queue, 1);
    }

    public void recordReconnect(String brokerClient, boolean successful) {
        if (reconnects != null) {
            reconnects.increment();
        }
        if (registry != null) {
            Counter.builder("mqclient.connection.reconnects.by.broker")
                .tag("instance", instanceId)
                .tag("broker", brokerClient)
                .tag("outcome", successful ? "success" : "failure")
                .register(registry)
                .increment();
        }
    }

    private void incrementByQueue(String name, String queue, double amount) {
        if (registry != null) {
            Counter.builder(name)
                .tag("instance", instanceId)
                .tag("queue", queue)
                .register(registry)
                .increment(amount);
        }
    }

    public Map<String, Number> getAllMetrics() {
        Map<String, Number> metrics = new HashMap<>();

        if (messagesSent != null) {
            metrics.put("messages_sent", messagesSent.count());
        }
        if (messagesReceived != null) {
            metrics.put("messages_received", messagesReceived.count());
        }
        if (messagesProcessed != null) {
            metrics.put("messages_processed", messagesProcessed.count());
        }
        if (messagesFailed != null) {
            metrics.put("messages_failed", messagesFailed.count());
        }
        if (messagesRetried != null) {
            metrics.put("messages_retried", messagesRetried.count());
        }
        if (messagesDropped != null) {
            metrics.put("messages_dropped", messagesDropped.count());
        }
        if (ackDeadlinesExpired != null) {
            metrics.put("ack_deadlines_expired", ackDeadlinesExpired.count());
        }
        if (reconnects != null) {
            metrics.put("reconnects", reconnects.count());
        }
        if (messageProcessingTime != null) {
            metrics.put("processing_time_mean_ms", messageProcessingTime.mean(TimeUnit.MILLISECONDS));
        }
        return metrics;
    }

    public String getInstanceId() {
        return instanceId;
    }
}

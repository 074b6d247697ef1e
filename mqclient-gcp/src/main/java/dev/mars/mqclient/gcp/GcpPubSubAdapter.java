package dev.mars.mqclient.gcp;

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

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.ReceivedMessage;
import com.google.pubsub.v1.TopicName;
import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.adapter.BackendAdapter;
import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.adapter.BrokerClients;
import dev.mars.mqclient.api.adapter.BrokerSession;
import dev.mars.mqclient.api.adapter.RedeliveryTracker;
import dev.mars.mqclient.api.adapter.SettledDeliveries;
import dev.mars.mqclient.api.error.AckException;
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.ConnectionLostException;
import dev.mars.mqclient.api.error.MqClientException;
import dev.mars.mqclient.api.error.PublishException;
import dev.mars.mqclient.api.error.QueueConflictException;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Google Cloud Pub/Sub adapter.
 *
 * <p>The address is the GCP project id. The queue is a topic with one pull subscription
 * named {@code <queue>-<subscription>}, created with the configured ack deadline
 * clamped to the 10 to 600 seconds Pub/Sub accepts. When {@code PUBSUB_EMULATOR_HOST}
 * (or the {@code gcp.emulator.host} adapter property) is set the adapter talks to the
 * emulator without credentials.</p>
 *
 * <p>Pub/Sub rejects a message without data and attributes, so an empty payload is sent
 * with a marker attribute that is removed again on receipt.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class GcpPubSubAdapter implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(GcpPubSubAdapter.class);

    public static final BackendCapabilities CAPABILITIES =
        new BackendCapabilities(true, true, true, 1000, true);

    static final String EMULATOR_HOST_ENV = "PUBSUB_EMULATOR_HOST";
    static final String EMULATOR_HOST_PROPERTY = "gcp.emulator.host";
    static final String EMPTY_PAYLOAD_ATTRIBUTE = "mqclient-empty-payload";
    static final Duration EMPTY_PULL_PAUSE = Duration.ofMillis(50);
    static final int MIN_ACK_DEADLINE_SECONDS = 10;
    static final int MAX_ACK_DEADLINE_SECONDS = 600;

    private static final Set<StatusCode.Code> TRANSPORT_FAILURES = EnumSet.of(
        StatusCode.Code.UNAVAILABLE, StatusCode.Code.CANCELLED, StatusCode.Code.DEADLINE_EXCEEDED,
        StatusCode.Code.UNKNOWN, StatusCode.Code.INTERNAL, StatusCode.Code.ABORTED);

    private final PubSubOperationsFactory operationsFactory;
    private final Map<String, String> environment;
    private final AtomicLong generation = new AtomicLong();
    private final SettledDeliveries settled = new SettledDeliveries(10_000);
    private final RedeliveryTracker redeliveries = new RedeliveryTracker(10_000);

    private volatile PubSubOperations operations;
    private volatile QueueConfiguration configuration;
    private volatile TopicName topic;
    private volatile ProjectSubscriptionName subscription;

    public GcpPubSubAdapter() {
        this(GrpcPubSubOperations::open, System.getenv());
    }

    GcpPubSubAdapter(PubSubOperationsFactory operationsFactory, Map<String, String> environment) {
        this.operationsFactory = operationsFactory;
        this.environment = environment;
    }

    @Override
    public String getBrokerClient() {
        return BrokerClients.GCP;
    }

    @Override
    public BackendCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public BrokerSession connect(QueueConfiguration configuration) {
        String projectId = configuration.getAddress().trim();
        String emulatorHost = configuration.getAdapterProperty(EMULATOR_HOST_PROPERTY, environment.get(EMULATOR_HOST_ENV));
        try {
            this.operations = operationsFactory.open(configuration, emulatorHost);
        } catch (IOException | RuntimeException e) {
            throw new BrokerConnectException(getBrokerClient(), projectId,
                "Failed to create Pub/Sub clients: " + e.getMessage(), e);
        }
        this.configuration = configuration;
        long sessionNumber = generation.incrementAndGet();
        String endpoint = emulatorHost != null && !emulatorHost.isBlank()
            ? "emulator://" + emulatorHost + "/" + projectId
            : "gcp://" + projectId;
        logger.info("Pub/Sub clients opened for {} (session {})", endpoint, sessionNumber);
        return BrokerSession.open(getBrokerClient(), endpoint, sessionNumber);
    }

    @Override
    public void declareQueue(String queueName, QueueConfiguration configuration) {
        PubSubOperations current = requireOperations();
        String projectId = configuration.getAddress().trim();
        TopicName topicName = TopicName.of(projectId, queueName);
        ProjectSubscriptionName subscriptionName =
            ProjectSubscriptionName.of(projectId, queueName + "-" + configuration.getSubscriptionName());
        try {
            current.ensureTopic(topicName);
            String attachedTopic = current.ensureSubscription(subscriptionName, topicName,
                ackDeadlineSeconds(configuration.getAckDeadline()));
            if (!topicName.toString().equals(attachedTopic)) {
                throw new QueueConflictException(getBrokerClient(), queueName,
                    "subscription " + subscriptionName.getSubscription() + " is attached to " + attachedTopic);
            }
        } catch (ApiException e) {
            throw new BrokerConnectException(getBrokerClient(), projectId,
                "Failed to declare topic " + queueName + ": " + e.getMessage(), e);
        }
        this.topic = topicName;
        this.subscription = subscriptionName;
        logger.debug("Declared Pub/Sub topic {} with subscription {}", topicName, subscriptionName);
    }

    @Override
    public PublishReceipt publish(byte[] payload) {
        PubSubOperations current = requireOperations();
        PubsubMessage.Builder message = PubsubMessage.newBuilder().setData(ByteString.copyFrom(payload));
        if (payload.length == 0) {
            message.putAttributes(EMPTY_PAYLOAD_ATTRIBUTE, "true");
        }
        try {
            return PublishReceipt.of(current.publish(topic, message.build(), configuration.getReceiveTimeout()));
        } catch (ApiException e) {
            throw classify(e, () -> new PublishException(getBrokerClient(), topic.getTopic(),
                "Publish failed: " + e.getStatusCode().getCode(), e));
        } catch (TimeoutException e) {
            throw new PublishException(getBrokerClient(), topic.getTopic(), "Publish was not confirmed in time", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(getBrokerClient(), topic.getTopic(), "Interrupted while publishing", e);
        } catch (IllegalStateException e) {
            throw new PublishException(getBrokerClient(), topic.getTopic(), e.getMessage(), e);
        }
    }

    @Override
    public List<Message> receive(int maxCount, Duration timeout) {
        PubSubOperations current = requireOperations();
        long deadline = System.nanoTime() + timeout.toNanos();
        int batch = CAPABILITIES.clampPrefetch(maxCount);
        while (true) {
            List<ReceivedMessage> pulled;
            try {
                pulled = current.pull(subscription, batch, Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
            } catch (ApiException e) {
                if (operations != current) {
                    return List.of();
                }
                throw classify(e, () -> new MqClientException("Pull failed: " + e.getMessage(), getBrokerClient(), e));
            }
            if (!pulled.isEmpty()) {
                List<Message> messages = new ArrayList<>(pulled.size());
                for (ReceivedMessage received : pulled) {
                    messages.add(toMessage(received));
                }
                return messages;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || operations != current) {
                return List.of();
            }
            try {
                // The emulator answers an empty pull at once.
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, EMPTY_PULL_PAUSE.toNanos()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
    }

    @Override
    public void ack(Message message) {
        GcpReceipt receipt = message.getReceipt(GcpReceipt.class);
        if (!settled.markSettled(receipt)) {
            return;
        }
        try {
            requireOperations().acknowledge(subscription, receipt.ackId());
            redeliveries.forget(message.getDeliveryId());
        } catch (ApiException e) {
            throw classify(e, () -> new AckException(getBrokerClient(), message.getDeliveryId(), "ack failed", e));
        }
    }

    @Override
    public void nack(Message message) {
        nack(message, Duration.ZERO);
    }

    @Override
    public void nack(Message message, Duration delay) {
        GcpReceipt receipt = message.getReceipt(GcpReceipt.class);
        if (!settled.markSettled(receipt)) {
            return;
        }
        // Whole seconds, rounded up so a sub-second backoff still delays redelivery.
        long delayMillis = Math.max(0, delay.toMillis());
        int seconds = (int) Math.min(MAX_ACK_DEADLINE_SECONDS, (delayMillis + 999) / 1000);
        try {
            requireOperations().modifyAckDeadline(subscription, receipt.ackId(), seconds);
        } catch (ApiException e) {
            throw classify(e, () -> new AckException(getBrokerClient(), message.getDeliveryId(), "nack failed", e));
        }
    }

    @Override
    public boolean isConnected() {
        return operations != null;
    }

    @Override
    public void disconnect() {
        PubSubOperations current = operations;
        operations = null;
        if (current != null) {
            try {
                current.close();
                logger.info("Pub/Sub clients closed");
            } catch (RuntimeException e) {
                logger.warn("Error closing Pub/Sub clients: {}", e.getMessage());
            }
        }
    }

    static int ackDeadlineSeconds(Duration ackDeadline) {
        long seconds = ackDeadline.toSeconds();
        return (int) Math.max(MIN_ACK_DEADLINE_SECONDS, Math.min(MAX_ACK_DEADLINE_SECONDS, seconds));
    }

    private Message toMessage(ReceivedMessage received) {
        PubsubMessage pubsubMessage = received.getMessage();
        Map<String, String> attributes = new HashMap<>(pubsubMessage.getAttributesMap());
        attributes.remove(EMPTY_PAYLOAD_ATTRIBUTE);
        int brokerCount = Math.max(0, received.getDeliveryAttempt() - 1);
        Instant publishedAt = pubsubMessage.hasPublishTime()
            ? Instant.ofEpochSecond(pubsubMessage.getPublishTime().getSeconds(), pubsubMessage.getPublishTime().getNanos())
            : Instant.now();
        return Message.builder()
            .deliveryId(pubsubMessage.getMessageId())
            .payload(pubsubMessage.getData().toByteArray())
            .enqueuedAt(publishedAt)
            .redeliveryCount(redeliveries.observe(pubsubMessage.getMessageId(), brokerCount, false))
            .attributes(attributes)
            .receipt(new GcpReceipt(received.getAckId()))
            .build();
    }

    private PubSubOperations requireOperations() {
        PubSubOperations current = operations;
        if (current == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        return current;
    }

    private RuntimeException classify(ApiException e, Supplier<RuntimeException> otherwise) {
        if (TRANSPORT_FAILURES.contains(e.getStatusCode().getCode())) {
            return new ConnectionLostException(getBrokerClient(),
                "Pub/Sub call failed with " + e.getStatusCode().getCode(), e);
        }
        return otherwise.get();
    }
}

package dev.mars.mqclient.pulsar;

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

import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.adapter.BackendAdapter;
import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.adapter.BrokerClients;
import dev.mars.mqclient.api.adapter.BrokerSession;
import dev.mars.mqclient.api.adapter.SettledDeliveries;
import dev.mars.mqclient.api.error.AckException;
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.ConnectionLostException;
import dev.mars.mqclient.api.error.PublishException;
import dev.mars.mqclient.api.error.QueueConflictException;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.PublishReceipt;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.ConsumerBuilder;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.SubscriptionInitialPosition;
import org.apache.pulsar.client.api.SubscriptionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Apache Pulsar adapter.
 *
 * <p>The queue is a topic read through one shared subscription, so every connection
 * using the same subscription name competes for messages. The subscription is created
 * when the queue is declared, before the producer, so messages published afterwards are
 * retained even when no consumer is polling. Subscriptions start at the earliest
 * position.</p>
 *
 * <p>The unacknowledged-message timeout comes from the
 * {@code PULSAR_UNACKED_MESSAGES_TIMEOUT_SEC} environment variable and is only applied
 * above 10 seconds. On disconnect unacknowledged messages are handed back to the broker
 * before the consumer closes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class PulsarAdapter implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(PulsarAdapter.class);

    public static final BackendCapabilities CAPABILITIES =
        new BackendCapabilities(true, true, false, 1000, true);

    static final String UNACKED_TIMEOUT_ENV = "PULSAR_UNACKED_MESSAGES_TIMEOUT_SEC";
    static final int MIN_UNACKED_TIMEOUT_SECONDS = 10;

    private final PulsarClientFactory clientFactory;
    private final Map<String, String> environment;
    private final AtomicLong generation = new AtomicLong();
    private final SettledDeliveries settled = new SettledDeliveries(10_000);

    private volatile PulsarClient client;
    private volatile Consumer<byte[]> consumer;
    private volatile Producer<byte[]> producer;
    private volatile QueueConfiguration configuration;

    public PulsarAdapter() {
        this(PulsarClientFactory.standard(), System.getenv());
    }

    PulsarAdapter(PulsarClientFactory clientFactory, Map<String, String> environment) {
        this.clientFactory = clientFactory;
        this.environment = environment;
    }

    @Override
    public String getBrokerClient() {
        return BrokerClients.PULSAR;
    }

    @Override
    public BackendCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public BrokerSession connect(QueueConfiguration configuration) {
        String serviceUrl = BrokerClients.withScheme("pulsar", configuration.getAddress());
        try {
            this.client = clientFactory.create(serviceUrl, configuration);
        } catch (PulsarClientException e) {
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to create Pulsar client: " + e.getMessage(), e);
        }
        this.configuration = configuration;
        settled.clear();
        long sessionNumber = generation.incrementAndGet();
        logger.info("Pulsar client created for {} (session {})", serviceUrl, sessionNumber);
        return BrokerSession.open(getBrokerClient(), serviceUrl, sessionNumber);
    }

    @Override
    public void declareQueue(String queueName, QueueConfiguration configuration) {
        PulsarClient current = requireClient();
        checkPartitions(current, queueName, configuration);
        try {
            ConsumerBuilder<byte[]> builder = current.newConsumer()
                .topic(queueName)
                .subscriptionName(configuration.getSubscriptionName())
                .subscriptionType(SubscriptionType.Shared)
                .subscriptionInitialPosition(SubscriptionInitialPosition.Earliest)
                .receiverQueueSize(CAPABILITIES.clampPrefetch(configuration.getPrefetch()))
                .negativeAckRedeliveryDelay(0, TimeUnit.MILLISECONDS);
            int unackedTimeout = unackedTimeoutSeconds();
            if (unackedTimeout > MIN_UNACKED_TIMEOUT_SECONDS) {
                builder.ackTimeout(unackedTimeout, TimeUnit.SECONDS);
            }
            Consumer<byte[]> subscribed = builder.subscribe();
            Producer<byte[]> created = current.newProducer().topic(queueName).create();
            Consumer<byte[]> previousConsumer = consumer;
            Producer<byte[]> previousProducer = producer;
            this.consumer = subscribed;
            this.producer = created;
            closeQuietly(previousConsumer, previousProducer);
            logger.debug("Subscribed to Pulsar topic {} as {}", queueName, configuration.getSubscriptionName());
        } catch (PulsarClientException.ConsumerBusyException
                 | PulsarClientException.IncompatibleSchemaException
                 | PulsarClientException.NotAllowedException e) {
            throw new QueueConflictException(getBrokerClient(), queueName, e.getMessage(), e);
        } catch (PulsarClientException e) {
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to declare topic " + queueName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public PublishReceipt publish(byte[] payload) {
        Producer<byte[]> current = producer;
        if (current == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        try {
            MessageId messageId = current.send(payload);
            return PublishReceipt.of(messageId.toString());
        } catch (PulsarClientException.AlreadyClosedException e) {
            throw lost(e);
        } catch (PulsarClientException e) {
            throw new PublishException(getBrokerClient(), current.getTopic(), "Publish failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Message> receive(int maxCount, Duration timeout) {
        Consumer<byte[]> current = requireConsumer();
        long sessionNumber = generation.get();
        List<Message> messages = new ArrayList<>();
        try {
            int waitMillis = (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
            org.apache.pulsar.client.api.Message<byte[]> received = current.receive(waitMillis, TimeUnit.MILLISECONDS);
            while (received != null) {
                messages.add(toMessage(received, sessionNumber));
                if (messages.size() >= maxCount) {
                    break;
                }
                // Drain what is already prefetched without waiting again.
                received = current.receive(0, TimeUnit.MILLISECONDS);
            }
            return messages;
        } catch (PulsarClientException.AlreadyClosedException e) {
            if (consumer != current) {
                return messages;
            }
            throw lost(e);
        } catch (PulsarClientException e) {
            if (consumer != current) {
                return messages;
            }
            throw new ConnectionLostException(getBrokerClient(), "Receive failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ack(Message message) {
        PulsarReceipt receipt = message.getReceipt(PulsarReceipt.class);
        if (!acceptSettlement(message, receipt)) {
            return;
        }
        try {
            requireConsumer().acknowledge(receipt.messageId());
        } catch (PulsarClientException.AlreadyClosedException e) {
            throw lost(e);
        } catch (PulsarClientException e) {
            throw new AckException(getBrokerClient(), message.getDeliveryId(), "ack failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void nack(Message message) {
        PulsarReceipt receipt = message.getReceipt(PulsarReceipt.class);
        if (!acceptSettlement(message, receipt)) {
            return;
        }
        requireConsumer().negativeAcknowledge(receipt.messageId());
    }

    @Override
    public boolean isConnected() {
        PulsarClient currentClient = client;
        Consumer<byte[]> currentConsumer = consumer;
        return currentClient != null && !currentClient.isClosed()
            && (currentConsumer == null || currentConsumer.isConnected());
    }

    @Override
    public void disconnect() {
        Consumer<byte[]> currentConsumer = consumer;
        Producer<byte[]> currentProducer = producer;
        PulsarClient currentClient = client;
        consumer = null;
        producer = null;
        client = null;
        closeQuietly(currentConsumer, currentProducer);
        if (currentClient != null) {
            try {
                currentClient.close();
                logger.info("Pulsar client closed");
            } catch (PulsarClientException e) {
                logger.warn("Error closing Pulsar client: {}", e.getMessage());
            }
        }
    }

    /**
     * Compares the topic's partition count with {@code pulsar.partitions} when that property is set.
     * A non-partitioned topic counts as one partition.
     */
    void checkPartitions(PulsarClient current, String queueName, QueueConfiguration configuration) {
        int expected = configuration.getAdapterProperty("pulsar.partitions", 0);
        if (expected < 1) {
            return;
        }
        List<String> partitions;
        try {
            partitions = current.getPartitionsForTopic(queueName)
                .get(configuration.getReceiveTimeout().toMillis() + 10_000, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to look up partitions of " + queueName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Interrupted while looking up partitions of " + queueName, e);
        }
        if (partitions.size() != expected) {
            throw new QueueConflictException(getBrokerClient(), queueName,
                "topic has " + partitions.size() + " partition(s), expected " + expected);
        }
    }

    int unackedTimeoutSeconds() {
        String value = environment.get(UNACKED_TIMEOUT_ENV);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', ignoring", UNACKED_TIMEOUT_ENV, value);
            return 0;
        }
    }

    private Message toMessage(org.apache.pulsar.client.api.Message<byte[]> received, long sessionNumber) {
        MessageId messageId = received.getMessageId();
        byte[] data = received.getData();
        long publishTime = received.getPublishTime();
        return Message.builder()
            .deliveryId(messageId.toString())
            .payload(data == null ? new byte[0] : data)
            .enqueuedAt(publishTime > 0 ? Instant.ofEpochMilli(publishTime) : Instant.now())
            .redeliveryCount(received.getRedeliveryCount())
            .attributes(received.getProperties())
            .receipt(new PulsarReceipt(sessionNumber, messageId))
            .build();
    }

    private boolean acceptSettlement(Message message, PulsarReceipt receipt) {
        if (receipt.sessionNumber() != generation.get()) {
            logger.debug("Ignoring settlement of {} from closed session {}", message.getDeliveryId(), receipt.sessionNumber());
            return false;
        }
        return settled.markSettled(receipt);
    }

    private PulsarClient requireClient() {
        PulsarClient current = client;
        if (current == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        return current;
    }

    private Consumer<byte[]> requireConsumer() {
        Consumer<byte[]> current = consumer;
        if (current == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        return current;
    }

    private static void closeQuietly(Consumer<byte[]> oldConsumer, Producer<byte[]> oldProducer) {
        if (oldConsumer != null) {
            try {
                oldConsumer.redeliverUnacknowledgedMessages();
                oldConsumer.close();
            } catch (PulsarClientException e) {
                logger.debug("Error closing Pulsar consumer: {}", e.getMessage());
            }
        }
        if (oldProducer != null) {
            try {
                oldProducer.close();
            } catch (PulsarClientException e) {
                logger.debug("Error closing Pulsar producer: {}", e.getMessage());
            }
        }
    }

    private ConnectionLostException lost(PulsarClientException cause) {
        return new ConnectionLostException(getBrokerClient(), "Pulsar client closed: " + cause.getMessage(), cause);
    }
}

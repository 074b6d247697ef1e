package dev.mars.mqclient.rabbitmq;

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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
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
import dev.mars.mqclient.api.error.PublishException;
import dev.mars.mqclient.api.error.QueueConflictException;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RabbitMQ adapter over the AMQP 0-9-1 Java client.
 *
 * <p>Publishing uses publisher confirms on a dedicated channel. Receiving polls with
 * {@code basic.get} so that a receive call never holds more than {@code maxCount}
 * unacknowledged deliveries. Delivery tags belong to the channel that produced them,
 * so receipts carry the session generation and settlements from an older session are
 * dropped.</p>
 *
 * <p>Adapter properties:</p>
 * <ul>
 *   <li>{@code rabbitmq.durable} - declare the queue durable (default false)</li>
 *   <li>{@code rabbitmq.poll.interval.ms} - pause between empty polls (default 50)</li>
 *   <li>{@code rabbitmq.persistent} - publish with delivery mode 2 (default false)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class RabbitMqAdapter implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RabbitMqAdapter.class);

    public static final BackendCapabilities CAPABILITIES =
        new BackendCapabilities(false, true, false, 65535, false);

    static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    private final ConnectionFactory connectionFactory;
    private final AtomicLong generation = new AtomicLong();
    private final SettledDeliveries settled = new SettledDeliveries(10_000);
    private final RedeliveryTracker redeliveries = new RedeliveryTracker(10_000);

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile String queueName;
    private volatile QueueConfiguration configuration;

    public RabbitMqAdapter() {
        this(new ConnectionFactory());
    }

    public RabbitMqAdapter(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public String getBrokerClient() {
        return BrokerClients.RABBITMQ;
    }

    @Override
    public BackendCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public BrokerSession connect(QueueConfiguration configuration) {
        String uri = BrokerClients.withScheme("amqp", configuration.getAddress());
        Connection opened = null;
        try {
            connectionFactory.setUri(uri);
            if (configuration.hasAuthToken()) {
                connectionFactory.setPassword(configuration.getAuthToken());
            }
            connectionFactory.setAutomaticRecoveryEnabled(false);
            opened = connectionFactory.newConnection("mqclient-" + configuration.getQueueName());
            Channel opening = opened.createChannel();
            opening.confirmSelect();
            opening.basicQos(CAPABILITIES.clampPrefetch(configuration.getPrefetch()), true);

            this.connection = opened;
            this.channel = opening;
            this.configuration = configuration;
            settled.clear();
            long sessionNumber = generation.incrementAndGet();
            logger.info("Connected to RabbitMQ at {} (session {})", opened.getAddress(), sessionNumber);
            return BrokerSession.open(getBrokerClient(), uri, sessionNumber);
        } catch (IOException | TimeoutException | URISyntaxException | GeneralSecurityException e) {
            closeQuietly(opened);
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to connect: " + e.getMessage(), e);
        } catch (ShutdownSignalException e) {
            closeQuietly(opened);
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Broker closed the connection: " + e.getMessage(), e);
        }
    }

    @Override
    public void declareQueue(String queueName, QueueConfiguration configuration) {
        Channel current = requireChannel();
        boolean durable = configuration.getAdapterProperty("rabbitmq.durable", false);
        try {
            current.queueDeclare(queueName, durable, false, false, null);
            this.queueName = queueName;
            logger.debug("Declared RabbitMQ queue {} (durable={})", queueName, durable);
        } catch (IOException | ShutdownSignalException e) {
            if (isPreconditionFailed(e)) {
                throw new QueueConflictException(getBrokerClient(), queueName,
                    "queue exists with different arguments (durable=" + durable + " requested)", e);
            }
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to declare queue " + queueName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public PublishReceipt publish(byte[] payload) {
        Channel current = requireChannel();
        String messageId = UUID.randomUUID().toString();
        boolean persistent = configuration.getAdapterProperty("rabbitmq.persistent", false);
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .messageId(messageId)
            .timestamp(new Date())
            .deliveryMode(persistent ? 2 : 1)
            .build();
        try {
            synchronized (current) {
                current.basicPublish("", queueName, properties, payload);
                current.waitForConfirmsOrDie(configuration.getReceiveTimeout().toMillis());
            }
            return PublishReceipt.of(messageId);
        } catch (AlreadyClosedException e) {
            throw lost(e);
        } catch (ShutdownSignalException e) {
            if (e.isHardError() || !current.isOpen()) {
                throw lost(e);
            }
            throw new PublishException(getBrokerClient(), queueName, "Broker rejected the message", e);
        } catch (TimeoutException e) {
            throw new PublishException(getBrokerClient(), queueName, "Publish was not confirmed in time", e);
        } catch (IOException e) {
            if (!current.isOpen()) {
                throw lost(e);
            }
            throw new PublishException(getBrokerClient(), queueName, "Publish failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(getBrokerClient(), queueName, "Interrupted while waiting for confirm", e);
        }
    }

    @Override
    public List<Message> receive(int maxCount, Duration timeout) {
        requireChannel();
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollInterval = configuration.getAdapterProperty("rabbitmq.poll.interval.ms", 50);
        long sessionNumber = generation.get();
        List<Message> messages = new ArrayList<>();
        while (true) {
            Channel current = channel;
            if (current == null) {
                // Disconnected while waiting.
                return messages;
            }
            try {
                while (messages.size() < maxCount) {
                    GetResponse response = current.basicGet(queueName, false);
                    if (response == null) {
                        break;
                    }
                    messages.add(toMessage(response, sessionNumber));
                }
            } catch (IOException | ShutdownSignalException e) {
                if (channel == null) {
                    return messages;
                }
                throw lost(e);
            }
            long remaining = deadline - System.nanoTime();
            if (!messages.isEmpty() || remaining <= 0) {
                return messages;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(pollInterval)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return messages;
            }
        }
    }

    @Override
    public void ack(Message message) {
        RabbitReceipt receipt = message.getReceipt(RabbitReceipt.class);
        if (!acceptSettlement(message, receipt)) {
            return;
        }
        try {
            requireChannel().basicAck(receipt.deliveryTag(), false);
            redeliveries.forget(message.getDeliveryId());
        } catch (AlreadyClosedException e) {
            throw lost(e);
        } catch (IOException e) {
            throw settlementFailure(message, "ack", e);
        }
    }

    @Override
    public void nack(Message message) {
        RabbitReceipt receipt = message.getReceipt(RabbitReceipt.class);
        if (!acceptSettlement(message, receipt)) {
            return;
        }
        try {
            requireChannel().basicNack(receipt.deliveryTag(), false, true);
        } catch (AlreadyClosedException e) {
            throw lost(e);
        } catch (IOException e) {
            throw settlementFailure(message, "nack", e);
        }
    }

    @Override
    public boolean isConnected() {
        Channel current = channel;
        return current != null && current.isOpen();
    }

    @Override
    public void disconnect() {
        Connection current = connection;
        channel = null;
        connection = null;
        if (current != null) {
            closeQuietly(current);
            logger.info("Disconnected from RabbitMQ");
        }
    }

    private Message toMessage(GetResponse response, long sessionNumber) {
        AMQP.BasicProperties properties = response.getProps();
        long deliveryTag = response.getEnvelope().getDeliveryTag();
        String deliveryId = properties != null && properties.getMessageId() != null
            ? properties.getMessageId()
            : Long.toString(deliveryTag);

        Map<String, String> attributes = new HashMap<>();
        int brokerCount = 0;
        if (properties != null && properties.getHeaders() != null) {
            for (Map.Entry<String, Object> header : properties.getHeaders().entrySet()) {
                if (header.getValue() == null) {
                    continue;
                }
                if (DELIVERY_COUNT_HEADER.equals(header.getKey()) && header.getValue() instanceof Number count) {
                    brokerCount = count.intValue();
                }
                attributes.put(header.getKey(), header.getValue().toString());
            }
        }
        Instant enqueuedAt = properties != null && properties.getTimestamp() != null
            ? properties.getTimestamp().toInstant()
            : Instant.now();

        return Message.builder()
            .deliveryId(deliveryId)
            .payload(response.getBody() == null ? new byte[0] : response.getBody())
            .enqueuedAt(enqueuedAt)
            .redeliveryCount(redeliveries.observe(deliveryId, brokerCount, response.getEnvelope().isRedeliver()))
            .attributes(Collections.unmodifiableMap(attributes))
            .receipt(new RabbitReceipt(sessionNumber, deliveryTag))
            .build();
    }

    private boolean acceptSettlement(Message message, RabbitReceipt receipt) {
        if (receipt.sessionNumber() != generation.get()) {
            // The broker already requeued deliveries of the closed channel.
            logger.debug("Ignoring settlement of {} from session {}", message.getDeliveryId(), receipt.sessionNumber());
            return false;
        }
        return settled.markSettled(receipt);
    }

    private Channel requireChannel() {
        Channel current = channel;
        if (current == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        return current;
    }

    private RuntimeException settlementFailure(Message message, String operation, IOException e) {
        Channel current = channel;
        if (current == null || !current.isOpen()) {
            return lost(e);
        }
        return new AckException(getBrokerClient(), message.getDeliveryId(), operation + " failed: " + e.getMessage(), e);
    }

    private ConnectionLostException lost(Exception cause) {
        return new ConnectionLostException(getBrokerClient(), "RabbitMQ channel closed: " + cause.getMessage(), cause);
    }

    static boolean isPreconditionFailed(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof ShutdownSignalException signal
                && signal.getReason() instanceof AMQP.Channel.Close close
                && close.getReplyCode() == AMQP.PRECONDITION_FAILED) {
                return true;
            }
        }
        return false;
    }

    private static void closeQuietly(Connection opened) {
        if (opened == null) {
            return;
        }
        try {
            if (opened.isOpen()) {
                opened.close();
            }
        } catch (IOException | AlreadyClosedException e) {
            logger.debug("Error closing RabbitMQ connection: {}", e.getMessage());
        }
    }
}

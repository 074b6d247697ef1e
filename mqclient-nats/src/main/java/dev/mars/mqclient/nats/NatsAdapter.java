package dev.mars.mqclient.nats;

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
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.ConnectionLostException;
import dev.mars.mqclient.api.error.PublishException;
import dev.mars.mqclient.api.error.QueueConflictException;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.PublishReceipt;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamOptions;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.PublishAck;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NATS JetStream adapter.
 *
 * <p>Each queue is a work-queue stream with a single subject, read through a durable
 * pull consumer with explicit acks. Stream, subject and consumer names are derived
 * from the queue name with characters NATS does not allow replaced by {@code _}.
 * The consumer's ack wait is the configured ack deadline and its max-ack-pending is
 * the clamped prefetch.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class NatsAdapter implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(NatsAdapter.class);

    public static final BackendCapabilities CAPABILITIES =
        new BackendCapabilities(true, true, true, 256, true);

    static final int STREAM_NOT_FOUND = 10059;

    private final NatsConnector connector;
    private final AtomicLong generation = new AtomicLong();
    private final SettledDeliveries settled = new SettledDeliveries(10_000);

    private volatile Connection connection;
    private volatile JetStream jetStream;
    private volatile JetStreamSubscription subscription;
    private volatile String subject;

    public NatsAdapter() {
        this(NatsConnector.standard());
    }

    public NatsAdapter(NatsConnector connector) {
        this.connector = connector;
    }

    @Override
    public String getBrokerClient() {
        return BrokerClients.NATS;
    }

    @Override
    public BackendCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public BrokerSession connect(QueueConfiguration configuration) {
        String server = BrokerClients.withScheme("nats", configuration.getAddress());
        Connection opened;
        try {
            opened = connector.connect(buildOptions(server, configuration));
        } catch (IOException e) {
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to connect: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Interrupted while connecting", e);
        }
        try {
            this.jetStream = opened.jetStream(JetStreamOptions.builder()
                .requestTimeout(Duration.ofMillis(configuration.getAdapterProperty("nats.request.timeout.ms", 5_000)))
                .build());
        } catch (IOException e) {
            closeQuietly(opened);
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "JetStream is not available: " + e.getMessage(), e);
        }
        this.connection = opened;
        settled.clear();
        long sessionNumber = generation.incrementAndGet();
        logger.info("Connected to NATS at {} (session {})", server, sessionNumber);
        return BrokerSession.open(getBrokerClient(), server, sessionNumber);
    }

    static Options buildOptions(String server, QueueConfiguration configuration) {
        Options.Builder builder = new Options.Builder()
            .server(server)
            .connectionName("mqclient-" + configuration.getQueueName())
            .connectionTimeout(Duration.ofMillis(configuration.getAdapterProperty("nats.connect.timeout.ms", 5_000)))
            .noReconnect();
        if (configuration.hasAuthToken()) {
            builder.token(configuration.getAuthToken().toCharArray());
        }
        String credentialsPath = configuration.getCredentialsPath();
        if (credentialsPath != null && !credentialsPath.isBlank()) {
            builder.authHandler(Nats.credentials(credentialsPath));
        }
        return builder.build();
    }

    @Override
    public void declareQueue(String queueName, QueueConfiguration configuration) {
        Connection current = requireConnection();
        String name = sanitize(queueName);
        String durable = sanitize(queueName + "-" + configuration.getSubscriptionName());
        try {
            JetStreamManagement management = current.jetStreamManagement();
            ensureStream(management, name, queueName);
            management.addOrUpdateConsumer(name, ConsumerConfiguration.builder()
                .durable(durable)
                .filterSubject(name)
                .ackPolicy(AckPolicy.Explicit)
                .deliverPolicy(DeliverPolicy.All)
                .ackWait(configuration.getAckDeadline())
                .maxAckPending(CAPABILITIES.clampPrefetch(configuration.getPrefetch()))
                .build());
            JetStreamSubscription bound = jetStream.subscribe(name, PullSubscribeOptions.bind(name, durable));
            JetStreamSubscription previous = subscription;
            this.subscription = bound;
            this.subject = name;
            unsubscribeQuietly(previous);
            logger.debug("Bound to JetStream stream {} as {}", name, durable);
        } catch (JetStreamApiException e) {
            throw new QueueConflictException(getBrokerClient(), queueName,
                "JetStream rejected the declaration (" + e.getApiErrorCode() + "): " + e.getErrorDescription(), e);
        } catch (IOException e) {
            throw new BrokerConnectException(getBrokerClient(), configuration.getAddress(),
                "Failed to declare stream " + name + ": " + e.getMessage(), e);
        }
    }

    private void ensureStream(JetStreamManagement management, String name, String queueName)
            throws IOException, JetStreamApiException {
        try {
            StreamInfo info = management.getStreamInfo(name);
            List<String> subjects = info.getConfiguration().getSubjects();
            if (!subjects.contains(name)) {
                throw new QueueConflictException(getBrokerClient(), queueName,
                    "stream " + name + " has subjects " + subjects);
            }
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != STREAM_NOT_FOUND) {
                throw e;
            }
            management.addStream(StreamConfiguration.builder()
                .name(name)
                .subjects(name)
                .retentionPolicy(RetentionPolicy.WorkQueue)
                .storageType(StorageType.File)
                .build());
            logger.info("Created JetStream stream {}", name);
        }
    }

    @Override
    public PublishReceipt publish(byte[] payload) {
        requireConnection();
        try {
            PublishAck ack = jetStream.publish(subject, payload);
            return PublishReceipt.of(ack.getStream() + ":" + ack.getSeqno());
        } catch (JetStreamApiException e) {
            throw new PublishException(getBrokerClient(), subject, "JetStream rejected the message: " + e.getMessage(), e);
        } catch (IOException e) {
            if (!isConnected()) {
                throw lost(e);
            }
            throw new PublishException(getBrokerClient(), subject, "Publish was not acknowledged: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw lost(e);
        }
    }

    @Override
    public List<Message> receive(int maxCount, Duration timeout) {
        JetStreamSubscription current = subscription;
        if (current == null || connection == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        long sessionNumber = generation.get();
        List<io.nats.client.Message> fetched;
        try {
            fetched = current.fetch(CAPABILITIES.clampPrefetch(maxCount), timeout);
        } catch (IllegalStateException e) {
            if (subscription != current) {
                return List.of();
            }
            throw lost(e);
        }
        List<Message> messages = new ArrayList<>(fetched.size());
        for (io.nats.client.Message received : fetched) {
            if (received.isJetStream()) {
                messages.add(toMessage(received, sessionNumber));
            }
        }
        return messages;
    }

    @Override
    public void ack(Message message) {
        NatsReceipt receipt = message.getReceipt(NatsReceipt.class);
        if (acceptSettlement(message, receipt)) {
            settle(() -> receipt.message().ack());
        }
    }

    @Override
    public void nack(Message message) {
        NatsReceipt receipt = message.getReceipt(NatsReceipt.class);
        if (acceptSettlement(message, receipt)) {
            settle(() -> receipt.message().nak());
        }
    }

    @Override
    public void nack(Message message, Duration delay) {
        NatsReceipt receipt = message.getReceipt(NatsReceipt.class);
        if (acceptSettlement(message, receipt)) {
            settle(() -> receipt.message().nakWithDelay(delay));
        }
    }

    @Override
    public boolean isConnected() {
        Connection current = connection;
        return current != null && current.getStatus() == Connection.Status.CONNECTED;
    }

    @Override
    public void disconnect() {
        Connection current = connection;
        JetStreamSubscription currentSubscription = subscription;
        connection = null;
        subscription = null;
        unsubscribeQuietly(currentSubscription);
        if (current != null) {
            closeQuietly(current);
            logger.info("Disconnected from NATS");
        }
    }

    static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private Message toMessage(io.nats.client.Message received, long sessionNumber) {
        NatsJetStreamMetaData meta = received.metaData();
        Map<String, String> attributes = new HashMap<>();
        Headers headers = received.getHeaders();
        if (headers != null) {
            for (String key : headers.keySet()) {
                attributes.put(key, headers.getFirst(key));
            }
        }
        Instant enqueuedAt = meta.timestamp() != null ? meta.timestamp().toInstant() : Instant.now();
        byte[] data = received.getData();
        return Message.builder()
            .deliveryId(meta.getStream() + ":" + meta.streamSequence())
            .payload(data == null ? new byte[0] : data)
            .enqueuedAt(enqueuedAt)
            .redeliveryCount((int) Math.max(0, meta.deliveredCount() - 1))
            .attributes(attributes)
            .receipt(new NatsReceipt(sessionNumber, received))
            .build();
    }

    private boolean acceptSettlement(Message message, NatsReceipt receipt) {
        if (receipt.sessionNumber() != generation.get()) {
            logger.debug("Ignoring settlement of {} from closed session {}", message.getDeliveryId(), receipt.sessionNumber());
            return false;
        }
        return settled.markSettled(receipt);
    }

    private void settle(Runnable settlement) {
        try {
            settlement.run();
        } catch (IllegalStateException e) {
            throw lost(e);
        }
    }

    private Connection requireConnection() {
        Connection current = connection;
        if (current == null) {
            throw new ConnectionLostException(getBrokerClient(), "Not connected", null);
        }
        return current;
    }

    private ConnectionLostException lost(Exception cause) {
        return new ConnectionLostException(getBrokerClient(), "NATS connection unusable: " + cause.getMessage(), cause);
    }

    private static void unsubscribeQuietly(JetStreamSubscription previous) {
        if (previous == null) {
            return;
        }
        try {
            previous.unsubscribe();
        } catch (IllegalStateException e) {
            logger.debug("Error unsubscribing: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Connection opened) {
        try {
            opened.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing NATS connection");
        }
    }
}

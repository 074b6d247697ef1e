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

import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.PublishReceipt;

import java.time.Duration;
import java.util.List;

/**
 * Contract every broker integration implements.
 *
 * <p>Adapters are flat: one class per broker, selected at runtime by the
 * {@code broker_client} configuration value. An adapter instance serves exactly one
 * queue of one connection. Lifecycle calls ({@link #connect}, {@link #disconnect}) are
 * never issued concurrently by the owning connection; whether I/O calls may overlap is
 * declared through {@link BackendCapabilities#concurrentOperationsSafe()}.</p>
 *
 * <p>Transport failures during I/O are reported as
 * {@link dev.mars.mqclient.api.error.ConnectionLostException} so the owning connection
 * can reconnect. Other broker failures map to the matching client error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface BackendAdapter {

    /**
     * @return the {@code broker_client} value this adapter is registered under
     */
    String getBrokerClient();

    BackendCapabilities getCapabilities();

    /**
     * Opens the broker connection.
     *
     * @throws dev.mars.mqclient.api.error.BrokerConnectException if the broker cannot be reached
     */
    BrokerSession connect(QueueConfiguration configuration);

    /**
     * Creates the queue (and subscription, where the broker needs one) if absent.
     * Idempotent.
     *
     * @throws dev.mars.mqclient.api.error.QueueConflictException if it exists with incompatible settings
     */
    void declareQueue(String queueName, QueueConfiguration configuration);

    /**
     * Publishes and waits for the broker's confirmation.
     *
     * @throws dev.mars.mqclient.api.error.PublishException if the broker did not confirm
     */
    PublishReceipt publish(byte[] payload);

    /**
     * Receives at most {@code maxCount} messages, blocking no longer than {@code timeout}.
     * Returns an empty list on timeout.
     */
    List<Message> receive(int maxCount, Duration timeout);

    /**
     * Acknowledges a message this adapter produced. Repeated calls for the same
     * delivery are ignored.
     */
    void ack(Message message);

    /**
     * Returns a message to the broker for redelivery. Repeated calls for the same
     * delivery are ignored.
     *
     * @throws UnsupportedOperationException if {@link BackendCapabilities#supportsExplicitNack()} is false
     */
    void nack(Message message);

    /**
     * Returns a message to the broker, to be redelivered no sooner than {@code delay}.
     *
     * @throws UnsupportedOperationException if {@link BackendCapabilities#supportsDelayedRedelivery()} is false
     */
    default void nack(Message message, Duration delay) {
        throw new UnsupportedOperationException(getBrokerClient() + " does not support delayed redelivery");
    }

    boolean isConnected();

    /**
     * Releases every broker resource. Safe to call any number of times, and from a
     * thread other than one blocked in {@link #receive}.
     */
    void disconnect();
}

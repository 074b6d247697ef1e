package dev.mars.mqclient.api;

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

import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.health.HealthStatusInfo;
import dev.mars.mqclient.api.messaging.MessageConsumer;
import dev.mars.mqclient.api.messaging.MessagePublisher;

/**
 * A connection to one queue on one broker. Owns the backend adapter's lifecycle:
 * opening it, reconnecting it after transport loss and closing it.
 *
 * <p>Connections are explicit objects passed by reference; there is no global
 * connection. Closing is final: publishers, consumers and message handles created from
 * a closed connection raise {@link dev.mars.mqclient.api.error.ConnectionClosedException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface QueueConnection extends AutoCloseable {

    /**
     * Connects and declares the queue, retrying transient connect failures with
     * exponential backoff up to the configured number of attempts.
     *
     * @throws dev.mars.mqclient.api.error.BrokerConnectException once the attempts are used up
     * @throws dev.mars.mqclient.api.error.QueueConflictException if the queue exists with other settings
     */
    void open();

    MessagePublisher createPublisher();

    MessageConsumer createConsumer();

    ConnectionState getState();

    default boolean isOpen() {
        return getState() == ConnectionState.OPEN;
    }

    HealthStatusInfo checkHealth();

    BackendCapabilities getCapabilities();

    QueueConfiguration getConfiguration();

    default String getBrokerClient() {
        return getConfiguration().getBrokerClient();
    }

    /**
     * Closes the connection. Idempotent.
     */
    @Override
    void close();
}

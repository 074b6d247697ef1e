package dev.mars.mqclient.api.messaging;

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

import java.util.Map;

/**
 * Sends messages to the queue of the connection that created it.
 *
 * <p>Sends are synchronous and unbuffered: when {@link #send(byte[])} returns the
 * broker has confirmed the message.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface MessagePublisher extends AutoCloseable {

    /**
     * Publishes raw bytes.
     *
     * @throws dev.mars.mqclient.api.error.PublishException if the broker did not confirm the message
     * @throws dev.mars.mqclient.api.error.ConnectionClosedException if the connection is closed
     */
    PublishReceipt send(byte[] payload);

    /**
     * Publishes {@code data} wrapped in a JSON envelope together with string headers.
     */
    PublishReceipt sendEnvelope(Object data, Map<String, String> headers);

    String getQueueName();

    @Override
    void close();
}

package dev.mars.mqclient.core.connection;

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

import dev.mars.mqclient.api.messaging.MessagePublisher;
import dev.mars.mqclient.api.messaging.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Synchronous publisher. Each send goes straight to the adapter and returns once the
 * broker confirmed it.
 */
class DefaultMessagePublisher implements MessagePublisher {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessagePublisher.class);

    private final DefaultQueueConnection connection;
    private final String queueName;
    private volatile boolean closed;

    DefaultMessagePublisher(DefaultQueueConnection connection) {
        this.connection = connection;
        this.queueName = connection.getConfiguration().getQueueName();
    }

    @Override
    public PublishReceipt send(byte[] payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        connection.checkNotClosed();
        if (closed) {
            throw new IllegalStateException("Publisher for queue '" + queueName + "' is closed");
        }
        byte[] copy = payload.clone();
        PublishReceipt receipt = connection.execute("publish", true, adapter -> adapter.publish(copy));
        connection.getMetrics().recordMessageSent(queueName);
        logger.debug("Published {} bytes to queue '{}' as {}", copy.length, queueName, receipt.messageId());
        return receipt;
    }

    @Override
    public PublishReceipt sendEnvelope(Object data, Map<String, String> headers) {
        return send(connection.getEnvelopeCodec().encode(data, headers));
    }

    @Override
    public String getQueueName() {
        return queueName;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.debug("Publisher for queue '{}' closed", queueName);
        }
    }
}

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

import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.error.ConnectionClosedException;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.MessageConsumer;
import dev.mars.mqclient.api.messaging.MessageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Pull consumer. Every poll is one blocking receive on the adapter, bounded by the
 * configured receive timeout, with the batch size clamped to the backend maximum.
 */
class DefaultMessageConsumer implements MessageConsumer {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageConsumer.class);

    private final DefaultQueueConnection connection;
    private final QueueConfiguration configuration;
    private final BackendCapabilities capabilities;
    private volatile boolean closed;

    DefaultMessageConsumer(DefaultQueueConnection connection) {
        this.connection = connection;
        this.configuration = connection.getConfiguration();
        this.capabilities = connection.getCapabilities();
        if (configuration.getPrefetch() > capabilities.maxPrefetch()) {
            logger.warn("Prefetch {} for queue '{}' exceeds the {} maximum of {}, using {}",
                configuration.getPrefetch(), configuration.getQueueName(), connection.getBrokerClient(),
                capabilities.maxPrefetch(), capabilities.maxPrefetch());
        }
    }

    @Override
    public List<MessageHandle> poll(int maxCount) {
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be at least 1, got " + maxCount);
        }
        connection.checkNotClosed();
        if (closed) {
            throw new IllegalStateException("Consumer for queue '" + configuration.getQueueName() + "' is closed");
        }

        int effective = capabilities.clampPrefetch(maxCount);
        Duration timeout = configuration.getReceiveTimeout();
        List<Message> received = connection.execute("receive", true, adapter -> adapter.receive(effective, timeout));
        if (received == null || received.isEmpty()) {
            return Collections.emptyList();
        }

        List<MessageHandle> handles = new ArrayList<>(received.size());
        for (Message message : received) {
            handles.add(connection.track(message));
        }
        connection.getMetrics().recordMessagesReceived(configuration.getQueueName(), handles.size());
        logger.debug("Received {} message(s) from queue '{}' (requested {}, clamped to {})",
            handles.size(), configuration.getQueueName(), maxCount, effective);
        return handles;
    }

    @Override
    public List<MessageHandle> poll() {
        return poll(configuration.getPrefetch());
    }

    @Override
    public Iterable<MessageHandle> messages(Duration inactivityTimeout) {
        Objects.requireNonNull(inactivityTimeout, "inactivityTimeout cannot be null");
        if (inactivityTimeout.isNegative()) {
            throw new IllegalArgumentException("inactivityTimeout cannot be negative: " + inactivityTimeout);
        }
        return () -> new MessageIterator(inactivityTimeout);
    }

    @Override
    public int getEffectivePrefetch() {
        return capabilities.clampPrefetch(configuration.getPrefetch());
    }

    @Override
    public String getQueueName() {
        return configuration.getQueueName();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.debug("Consumer for queue '{}' closed", configuration.getQueueName());
        }
    }

    /**
     * Yields handles one at a time and stops after a quiet period of the inactivity timeout,
     * or when the consumer or its connection is closed.
     */
    private final class MessageIterator implements Iterator<MessageHandle> {

        private final long inactivityNanos;
        private final Deque<MessageHandle> buffer = new ArrayDeque<>();
        private long lastActivity;
        private boolean finished;

        MessageIterator(Duration inactivityTimeout) {
            this.inactivityNanos = inactivityTimeout.toNanos();
        }

        @Override
        public boolean hasNext() {
            // The quiet period starts when the caller asks for more, not when the last message was handed out.
            lastActivity = System.nanoTime();
            while (buffer.isEmpty() && !finished) {
                if (closed || connection.isClosed()) {
                    finished = true;
                    break;
                }
                try {
                    buffer.addAll(poll());
                } catch (ConnectionClosedException e) {
                    logger.debug("Connection closed, ending message iteration on queue '{}'",
                        configuration.getQueueName());
                    finished = true;
                    break;
                }
                long now = System.nanoTime();
                if (!buffer.isEmpty()) {
                    lastActivity = now;
                } else if (now - lastActivity >= inactivityNanos) {
                    logger.debug("No message on queue '{}' for {}, ending message iteration",
                        configuration.getQueueName(), Duration.ofNanos(inactivityNanos));
                    finished = true;
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public MessageHandle next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more messages");
            }
            return buffer.poll();
        }
    }
}

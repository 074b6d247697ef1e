package dev.mars.mqclient.test.memory;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * A small broker living in memory, shared by any number of {@link InMemoryBackendAdapter}s.
 *
 * <p>Behaves like a work queue with a visibility timeout: a received message is invisible
 * until it is acked, nacked, its visibility timeout passes or the session that received
 * it goes away. Tests can inject connect and publish failures and sever all connections
 * to exercise reconnect paths.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class InMemoryBroker {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBroker.class);

    private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messagesAvailable = lock.newCondition();
    private final Map<String, QueueState> queues = new HashMap<>();
    private final AtomicLong deliveryTags = new AtomicLong();
    private final AtomicLong sessions = new AtomicLong();

    private long epoch;
    private int pendingConnectFailures;
    private int pendingPublishFailures;
    private long connectAttempts;
    private long acks;
    private long nacks;

    /**
     * Makes the next {@code count} connect attempts fail.
     */
    public void failNextConnects(int count) {
        lock.lock();
        try {
            pendingConnectFailures = count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes the next {@code count} publishes fail without storing the message.
     */
    public void failNextPublishes(int count) {
        lock.lock();
        try {
            pendingPublishFailures = count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every open session, as a broker restart would. Unsettled messages become
     * visible again and adapters see their next operation fail with a lost connection.
     */
    public void severConnections() {
        lock.lock();
        try {
            epoch++;
            for (QueueState queue : queues.values()) {
                requeueWhere(queue, inFlight -> true);
            }
            messagesAvailable.signalAll();
            logger.debug("Severed all in-memory broker connections, epoch now {}", epoch);
        } finally {
            lock.unlock();
        }
    }

    Connection connect() {
        lock.lock();
        try {
            connectAttempts++;
            if (pendingConnectFailures > 0) {
                pendingConnectFailures--;
                throw new IllegalStateException("Connection refused (injected failure)");
            }
            return new Connection(sessions.incrementAndGet(), epoch);
        } finally {
            lock.unlock();
        }
    }

    boolean isAlive(Connection connection) {
        lock.lock();
        try {
            return connection.epoch == epoch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if a queue with this name exists with different settings
     */
    boolean declare(String queueName, Map<String, String> settings, Duration visibilityTimeout) {
        lock.lock();
        try {
            QueueState existing = queues.get(queueName);
            if (existing == null) {
                queues.put(queueName, new QueueState(settings, visibilityTimeout));
                logger.debug("Declared in-memory queue '{}' with settings {}", queueName, settings);
                return true;
            }
            return existing.settings.equals(settings);
        } finally {
            lock.unlock();
        }
    }

    String publish(Connection connection, String queueName, byte[] payload) {
        lock.lock();
        try {
            checkAlive(connection);
            if (pendingPublishFailures > 0) {
                pendingPublishFailures--;
                throw new IllegalStateException("Publish rejected (injected failure)");
            }
            QueueState queue = queue(queueName);
            StoredMessage stored = new StoredMessage(UUID.randomUUID().toString(), payload.clone(), Instant.now());
            queue.ready.addLast(stored);
            messagesAvailable.signalAll();
            return stored.id;
        } finally {
            lock.unlock();
        }
    }

    List<Delivery> receive(Connection connection, String queueName, int maxCount, Duration timeout,
                           BooleanSupplier stillOpen) {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                checkAlive(connection);
                QueueState queue = queue(queueName);
                long now = System.nanoTime();
                requeueWhere(queue, inFlight -> inFlight.expiresAtNanos <= now);

                List<Delivery> deliveries = take(connection, queue, maxCount, now);
                if (!deliveries.isEmpty()) {
                    return deliveries;
                }
                long remaining = deadline - now;
                if (remaining <= 0 || !stillOpen.getAsBoolean()) {
                    return Collections.emptyList();
                }
                messagesAvailable.awaitNanos(Math.min(remaining, MAX_WAIT_SLICE_NANOS));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the delivery was still in flight for this session
     */
    boolean ack(Connection connection, String queueName, long deliveryTag) {
        lock.lock();
        try {
            checkAlive(connection);
            InFlight inFlight = queue(queueName).inFlight.get(deliveryTag);
            if (inFlight == null || inFlight.sessionId != connection.sessionId) {
                return false;
            }
            queue(queueName).inFlight.remove(deliveryTag);
            acks++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean nack(Connection connection, String queueName, long deliveryTag, Duration delay) {
        lock.lock();
        try {
            checkAlive(connection);
            QueueState queue = queue(queueName);
            InFlight inFlight = queue.inFlight.get(deliveryTag);
            if (inFlight == null || inFlight.sessionId != connection.sessionId) {
                return false;
            }
            queue.inFlight.remove(deliveryTag);
            inFlight.message.notBeforeNanos = System.nanoTime() + delay.toNanos();
            queue.ready.addLast(inFlight.message);
            nacks++;
            messagesAvailable.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes everything the session still holds visible again.
     */
    void release(Connection connection) {
        lock.lock();
        try {
            for (QueueState queue : queues.values()) {
                requeueWhere(queue, inFlight -> inFlight.sessionId == connection.sessionId);
            }
            messagesAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void wakeUp() {
        lock.lock();
        try {
            messagesAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasQueue(String queueName) {
        lock.lock();
        try {
            return queues.containsKey(queueName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Messages waiting to be received, including ones waiting out a redelivery delay.
     */
    public int readyCount(String queueName) {
        lock.lock();
        try {
            QueueState queue = queues.get(queueName);
            return queue == null ? 0 : queue.ready.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount(String queueName) {
        lock.lock();
        try {
            QueueState queue = queues.get(queueName);
            return queue == null ? 0 : queue.inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public long getConnectAttempts() {
        lock.lock();
        try {
            return connectAttempts;
        } finally {
            lock.unlock();
        }
    }

    public long getAckCount() {
        lock.lock();
        try {
            return acks;
        } finally {
            lock.unlock();
        }
    }

    public long getNackCount() {
        lock.lock();
        try {
            return nacks;
        } finally {
            lock.unlock();
        }
    }

    private void checkAlive(Connection connection) {
        if (connection.epoch != epoch) {
            throw new BrokerConnectionLost("Session " + connection.sessionId + " was severed");
        }
    }

    private QueueState queue(String queueName) {
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            throw new IllegalStateException("Queue '" + queueName + "' has not been declared");
        }
        return queue;
    }

    private List<Delivery> take(Connection connection, QueueState queue, int maxCount, long now) {
        List<Delivery> deliveries = new ArrayList<>();
        Iterator<StoredMessage> iterator = queue.ready.iterator();
        while (iterator.hasNext() && deliveries.size() < maxCount) {
            StoredMessage message = iterator.next();
            if (message.notBeforeNanos > now) {
                continue;
            }
            iterator.remove();
            message.deliveries++;
            long tag = deliveryTags.incrementAndGet();
            queue.inFlight.put(tag, new InFlight(message, connection.sessionId,
                now + queue.visibilityTimeout.toNanos()));
            deliveries.add(new Delivery(tag, message.id, message.payload.clone(), message.enqueuedAt,
                message.deliveries - 1));
        }
        return deliveries;
    }

    private void requeueWhere(QueueState queue, Predicate<InFlight> condition) {
        Iterator<InFlight> iterator = queue.inFlight.values().iterator();
        while (iterator.hasNext()) {
            InFlight inFlight = iterator.next();
            if (condition.test(inFlight)) {
                iterator.remove();
                inFlight.message.notBeforeNanos = Long.MIN_VALUE;
                queue.ready.addLast(inFlight.message);
            }
        }
    }

    static final class Connection {
        final long sessionId;
        final long epoch;

        Connection(long sessionId, long epoch) {
            this.sessionId = sessionId;
            this.epoch = epoch;
        }
    }

    static final class Delivery {
        final long deliveryTag;
        final String messageId;
        final byte[] payload;
        final Instant enqueuedAt;
        final int redeliveryCount;

        Delivery(long deliveryTag, String messageId, byte[] payload, Instant enqueuedAt, int redeliveryCount) {
            this.deliveryTag = deliveryTag;
            this.messageId = messageId;
            this.payload = payload;
            this.enqueuedAt = enqueuedAt;
            this.redeliveryCount = redeliveryCount;
        }
    }

    static final class BrokerConnectionLost extends RuntimeException {
        private static final long serialVersionUID = 1L;

        BrokerConnectionLost(String message) {
            super(message);
        }
    }

    private static final class QueueState {
        final Map<String, String> settings;
        final Duration visibilityTimeout;
        final Deque<StoredMessage> ready = new ArrayDeque<>();
        final Map<Long, InFlight> inFlight = new LinkedHashMap<>();

        QueueState(Map<String, String> settings, Duration visibilityTimeout) {
            this.settings = Map.copyOf(Objects.requireNonNull(settings));
            this.visibilityTimeout = visibilityTimeout;
        }
    }

    private static final class StoredMessage {
        final String id;
        final byte[] payload;
        final Instant enqueuedAt;
        int deliveries;
        long notBeforeNanos = Long.MIN_VALUE;

        StoredMessage(String id, byte[] payload, Instant enqueuedAt) {
            this.id = id;
            this.payload = payload;
            this.enqueuedAt = enqueuedAt;
        }
    }

    private static final class InFlight {
        final StoredMessage message;
        final long sessionId;
        final long expiresAtNanos;

        InFlight(StoredMessage message, long sessionId, long expiresAtNanos) {
            this.message = message;
            this.sessionId = sessionId;
            this.expiresAtNanos = expiresAtNanos;
        }
    }
}

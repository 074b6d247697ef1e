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

import dev.mars.mqclient.api.error.DoubleAckException;
import dev.mars.mqclient.api.messaging.AckState;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.MessageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Message handle whose {@link AckState} only ever moves out of {@code PENDING} once,
 * by compare-and-set. The thread that wins the transition is the only one that talks
 * to the broker.
 *
 * <ul>
 *   <li>Repeating the outcome already recorded returns {@code false}.</li>
 *   <li>Asking for the opposite outcome raises {@link DoubleAckException}.</li>
 *   <li>After the ack deadline expired every ack and nack returns {@code false}.</li>
 *   <li>Settling a pending handle of a closed connection raises
 *       {@link dev.mars.mqclient.api.error.ConnectionClosedException}.</li>
 * </ul>
 */
final class DefaultMessageHandle implements MessageHandle {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageHandle.class);

    private final Message message;
    private final DefaultQueueConnection connection;
    private final long deadlineNanos;
    private final AtomicReference<AckState> state = new AtomicReference<>(AckState.PENDING);
    private volatile Future<?> deadlineTimer;

    DefaultMessageHandle(Message message, DefaultQueueConnection connection, Duration ackDeadline) {
        this.message = message;
        this.connection = connection;
        this.deadlineNanos = System.nanoTime() + ackDeadline.toNanos();
    }

    @Override
    public Message getMessage() {
        return message;
    }

    @Override
    public AckState getState() {
        return state.get();
    }

    @Override
    public Duration getRemainingDeadline() {
        if (state.get() != AckState.PENDING) {
            return Duration.ZERO;
        }
        long remaining = deadlineNanos - System.nanoTime();
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }

    @Override
    public boolean ack() {
        return settle(AckState.ACKED, null);
    }

    @Override
    public boolean nack() {
        return settle(AckState.NACKED, null);
    }

    @Override
    public boolean nack(Duration delay) {
        return settle(AckState.NACKED, delay);
    }

    @Override
    public <T> T readData(Class<T> type) {
        return connection.getEnvelopeCodec().readData(message.getPayload(), type);
    }

    @Override
    public Map<String, String> readHeaders() {
        return connection.getEnvelopeCodec().readHeaders(message.getPayload());
    }

    private boolean settle(AckState target, Duration delay) {
        while (true) {
            AckState current = state.get();
            if (current == target) {
                logger.debug("Message {} already {}, ignoring repeated {}", message.getDeliveryId(), current, target);
                return false;
            }
            if (current == AckState.TIMED_OUT) {
                logger.warn("Ignoring {} of message {}: its ack deadline already expired",
                    target, message.getDeliveryId());
                return false;
            }
            if (current != AckState.PENDING) {
                throw new DoubleAckException(message.getDeliveryId(), current, target);
            }
            connection.checkOpenForSettlement(message.getDeliveryId());
            if (state.compareAndSet(AckState.PENDING, target)) {
                cancelDeadline();
                connection.settle(this, target, delay);
                return true;
            }
        }
    }

    void attachDeadline(Future<?> timer) {
        this.deadlineTimer = timer;
        if (state.get() != AckState.PENDING) {
            timer.cancel(false);
        }
    }

    void cancelDeadline() {
        Future<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    void expire() {
        if (state.compareAndSet(AckState.PENDING, AckState.TIMED_OUT)) {
            connection.onDeadlineExpired(this);
        }
    }

    @Override
    public String toString() {
        return "MessageHandle{deliveryId='" + message.getDeliveryId() + "', state=" + state.get() + '}';
    }
}

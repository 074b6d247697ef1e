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

import java.time.Duration;
import java.util.Map;

/**
 * A received message together with its acknowledgment state.
 *
 * <p>Exactly one outcome is ever committed per handle:</p>
 * <ul>
 *   <li>repeating the committed outcome is a no-op and returns {@code false};</li>
 *   <li>asking for the opposite outcome raises
 *       {@link dev.mars.mqclient.api.error.DoubleAckException};</li>
 *   <li>after the ack deadline expired ({@link AckState#TIMED_OUT}) both calls are
 *       accepted no-ops and the message is never resurrected;</li>
 *   <li>once the owning connection is closed both calls raise
 *       {@link dev.mars.mqclient.api.error.ConnectionClosedException}.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface MessageHandle {

    Message getMessage();

    default String getDeliveryId() {
        return getMessage().getDeliveryId();
    }

    default byte[] getPayload() {
        return getMessage().getPayload();
    }

    AckState getState();

    /**
     * Time left before the ack deadline expires, zero once it has.
     */
    Duration getRemainingDeadline();

    /**
     * Marks the message processed.
     *
     * @return true if this call committed the outcome
     */
    boolean ack();

    /**
     * Hands the message back to the broker for redelivery.
     *
     * @return true if this call committed the outcome
     */
    boolean nack();

    /**
     * Hands the message back to the broker, asking it to wait {@code delay} before
     * redelivering. Falls back to an immediate nack on backends without delayed
     * redelivery.
     *
     * @return true if this call committed the outcome
     */
    boolean nack(Duration delay);

    /**
     * Decodes the {@code data} part of a payload written by
     * {@link MessagePublisher#sendEnvelope(Object, Map)}.
     */
    <T> T readData(Class<T> type);

    /**
     * Decodes the {@code headers} part of a payload written by
     * {@link MessagePublisher#sendEnvelope(Object, Map)}.
     */
    Map<String, String> readHeaders();
}

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

/**
 * Acknowledgment state of a received message.
 *
 * <p>A handle starts {@link #PENDING} and moves to exactly one terminal state.
 * {@link #TIMED_OUT} is only ever applied by the runtime when the ack deadline
 * passes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public enum AckState {
    /**
     * Delivered to the application, no outcome yet.
     */
    PENDING,

    /**
     * Processing succeeded, the broker has been told to forget the message.
     */
    ACKED,

    /**
     * Processing failed, the message was handed back to the broker for redelivery.
     */
    NACKED,

    /**
     * The ack deadline passed before an outcome was committed.
     */
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

package dev.mars.mqclient.api.error;

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

import dev.mars.mqclient.api.messaging.AckState;

/**
 * Raised when a handle that already committed one outcome is asked for the opposite
 * one, for example a nack after an ack. Repeating the same outcome is not an error.
 */
public class DoubleAckException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String deliveryId;
    private final AckState currentState;
    private final AckState requestedState;

    public DoubleAckException(String deliveryId, AckState currentState, AckState requestedState) {
        super(String.format("Message %s is already %s, cannot move to %s",
            deliveryId, currentState, requestedState));
        this.deliveryId = deliveryId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    public AckState getCurrentState() {
        return currentState;
    }

    public AckState getRequestedState() {
        return requestedState;
    }
}

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
 * Reported to the error sink when processing finished after the handle's ack deadline
 * expired. The late outcome was discarded and the broker will redeliver the message.
 */
public class StaleAckException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String deliveryId;
    private final AckState attemptedState;

    public StaleAckException(String deliveryId, AckState attemptedState) {
        super(String.format("Ack deadline for message %s expired before it could be %s",
            deliveryId, attemptedState));
        this.deliveryId = deliveryId;
        this.attemptedState = attemptedState;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    public AckState getAttemptedState() {
        return attemptedState;
    }
}

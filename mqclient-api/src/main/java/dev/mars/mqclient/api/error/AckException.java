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

/**
 * Raised when the broker rejects an acknowledgment or negative acknowledgment. The
 * handle keeps its committed state; the broker will redeliver the message if the
 * outcome never reached it.
 */
public class AckException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String deliveryId;

    public AckException(String brokerClient, String deliveryId, String message, Throwable cause) {
        super(String.format("Settling message %s failed: %s", deliveryId, message), brokerClient, cause);
        this.deliveryId = deliveryId;
    }

    public String getDeliveryId() {
        return deliveryId;
    }
}

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
 * Reported to the error sink when a message failed processing more times than the
 * configured retry budget allows. The message has been acknowledged and dropped.
 */
public class RetriesExhaustedException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String deliveryId;
    private final int attempts;

    public RetriesExhaustedException(String deliveryId, int attempts, Throwable lastFailure) {
        super(String.format("Message %s dropped after %d failed attempt(s)", deliveryId, attempts), lastFailure);
        this.deliveryId = deliveryId;
        this.attempts = attempts;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    /**
     * @return number of times processing was invoked for the message
     */
    public int getAttempts() {
        return attempts;
    }
}

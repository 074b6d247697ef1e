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

import java.time.Instant;
import java.util.Objects;

/**
 * Broker confirmation of a publish.
 *
 * @param messageId broker assigned (or publisher assigned) message id
 * @param confirmedAt when the confirmation was received
 */
public record PublishReceipt(String messageId, Instant confirmedAt) {

    public PublishReceipt {
        Objects.requireNonNull(messageId, "Message id cannot be null");
        Objects.requireNonNull(confirmedAt, "Confirmation time cannot be null");
    }

    public static PublishReceipt of(String messageId) {
        return new PublishReceipt(messageId, Instant.now());
    }
}

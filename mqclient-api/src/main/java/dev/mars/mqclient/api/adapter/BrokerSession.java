package dev.mars.mqclient.api.adapter;

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
 * Describes one established broker connection.
 *
 * @param brokerClient  broker client the session belongs to
 * @param endpoint      normalized address that was connected to
 * @param sessionNumber increases by one every time the adapter connects
 * @param connectedAt   when the connection was established
 */
public record BrokerSession(String brokerClient, String endpoint, long sessionNumber, Instant connectedAt) {

    public BrokerSession {
        Objects.requireNonNull(brokerClient, "Broker client cannot be null");
        Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        Objects.requireNonNull(connectedAt, "Connect time cannot be null");
    }

    public static BrokerSession open(String brokerClient, String endpoint, long sessionNumber) {
        return new BrokerSession(brokerClient, endpoint, sessionNumber, Instant.now());
    }
}

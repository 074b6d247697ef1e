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
 * Raised when a connection to the broker cannot be established, or re-established,
 * within the configured attempt budget. Fatal for the connection that raised it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class BrokerConnectException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String address;
    private final int attempts;

    public BrokerConnectException(String brokerClient, String address, String message, Throwable cause) {
        this(brokerClient, address, 1, message, cause);
    }

    public BrokerConnectException(String brokerClient, String address, int attempts, String message, Throwable cause) {
        super(String.format("Failed to connect to %s after %d attempt(s): %s", address, attempts, message),
            brokerClient, cause);
        this.address = address;
        this.attempts = attempts;
    }

    public String getAddress() {
        return address;
    }

    public int getAttempts() {
        return attempts;
    }
}

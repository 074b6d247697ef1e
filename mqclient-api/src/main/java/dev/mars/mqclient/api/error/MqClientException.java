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
 * Base class for every error raised by the message queue client.
 *
 * <p>All client errors are unchecked. Checked exceptions thrown by the underlying
 * broker libraries are wrapped and kept as the cause.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class MqClientException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String brokerClient;

    public MqClientException(String message) {
        this(message, null, null);
    }

    public MqClientException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public MqClientException(String message, String brokerClient, Throwable cause) {
        super(formatMessage(message, brokerClient), cause);
        this.brokerClient = brokerClient;
    }

    /**
     * @return the broker client the error originated from, or null when not broker specific
     */
    public String getBrokerClient() {
        return brokerClient;
    }

    private static String formatMessage(String message, String brokerClient) {
        if (brokerClient == null) {
            return message;
        }
        return String.format("[%s] %s", brokerClient, message);
    }
}

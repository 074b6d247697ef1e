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
 * Raised by queue declaration when a queue, topic or subscription with the requested
 * name already exists with incompatible settings.
 */
public class QueueConflictException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String queueName;

    public QueueConflictException(String brokerClient, String queueName, String message) {
        this(brokerClient, queueName, message, null);
    }

    public QueueConflictException(String brokerClient, String queueName, String message, Throwable cause) {
        super(String.format("Queue '%s' conflicts with existing declaration: %s", queueName, message),
            brokerClient, cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}

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
 * Raised when the broker does not confirm a publish. The message may or may not have
 * reached the broker; callers that retry must tolerate a duplicate.
 */
public class PublishException extends MqClientException {

    private static final long serialVersionUID = 1L;

    private final String queueName;

    public PublishException(String brokerClient, String queueName, String message, Throwable cause) {
        super(String.format("Publish to queue '%s' failed: %s", queueName, message), brokerClient, cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}

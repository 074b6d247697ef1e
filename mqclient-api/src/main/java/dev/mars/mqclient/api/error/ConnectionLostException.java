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
 * Raised by a backend adapter when the transport to the broker dropped during an
 * operation. The owning connection treats it as transient and reconnects; callers only
 * see it through the error sink.
 */
public class ConnectionLostException extends MqClientException {

    private static final long serialVersionUID = 1L;

    public ConnectionLostException(String brokerClient, String message, Throwable cause) {
        super(message, brokerClient, cause);
    }
}

package dev.mars.mqclient.api;

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

import java.util.Set;

/**
 * Creates queue connections for whichever broker the configuration selects.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface QueueConnectionProvider {

    /**
     * Creates a connection without opening it.
     *
     * @throws IllegalArgumentException if no adapter is registered for the broker client
     */
    QueueConnection createConnection(QueueConfiguration configuration);

    /**
     * Creates and opens a connection.
     */
    default QueueConnection openConnection(QueueConfiguration configuration) {
        QueueConnection connection = createConnection(configuration);
        try {
            connection.open();
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    Set<String> getSupportedTypes();

    boolean isTypeSupported(String brokerClient);
}

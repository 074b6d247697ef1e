package dev.mars.mqclient.pulsar;

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

import dev.mars.mqclient.api.QueueConfiguration;
import org.apache.pulsar.client.api.AuthenticationFactory;
import org.apache.pulsar.client.api.ClientBuilder;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;

import java.util.concurrent.TimeUnit;

/**
 * Builds the {@link PulsarClient} for a session.
 */
@FunctionalInterface
public interface PulsarClientFactory {

    PulsarClient create(String serviceUrl, QueueConfiguration configuration) throws PulsarClientException;

    /**
     * Client with token authentication when the configuration carries a token.
     */
    static PulsarClientFactory standard() {
        return (serviceUrl, configuration) -> {
            ClientBuilder builder = PulsarClient.builder()
                .serviceUrl(serviceUrl)
                .connectionTimeout(configuration.getAdapterProperty("pulsar.connect.timeout.ms", 10_000), TimeUnit.MILLISECONDS)
                .operationTimeout(configuration.getAdapterProperty("pulsar.operation.timeout.ms", 30_000), TimeUnit.MILLISECONDS);
            if (configuration.hasAuthToken()) {
                builder.authentication(AuthenticationFactory.token(configuration.getAuthToken()));
            }
            return builder.build();
        };
    }
}

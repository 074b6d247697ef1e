package dev.mars.mqclient.nats;

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
import dev.mars.mqclient.api.adapter.BackendAdapter;
import dev.mars.mqclient.test.categories.TestCategories;
import dev.mars.mqclient.test.containers.BrokerTestContainers;
import dev.mars.mqclient.test.contract.BackendAdapterContractTest;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;

/**
 * Runs the adapter contract against a JetStream-enabled NATS server in Docker.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers
class NatsAdapterIntegrationTest extends BackendAdapterContractTest {

    @Container
    static final GenericContainer<?> nats = BrokerTestContainers.nats();

    @Override
    protected BackendAdapter createAdapter() {
        return new NatsAdapter();
    }

    @Override
    protected QueueConfiguration.Builder configurationFor(String queueName) {
        return QueueConfiguration.builder()
            .brokerClient("nats")
            .address(BrokerTestContainers.natsAddress(nats))
            .queueName(queueName)
            .prefetch(10)
            .receiveTimeout(Duration.ofMillis(500));
    }
}

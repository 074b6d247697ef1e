package dev.mars.mqclient.test.containers;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PubSubEmulatorContainer;
import org.testcontainers.containers.PulsarContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.utility.DockerImageName;

/**
 * Standardized broker containers for integration tests, one image version per broker
 * across all modules.
 *
 * <pre>{@code
 * @Container
 * static RabbitMQContainer rabbit = BrokerTestContainers.rabbitMq();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class BrokerTestContainers {

    private static final Logger logger = LoggerFactory.getLogger(BrokerTestContainers.class);

    public static final String RABBITMQ_IMAGE = "rabbitmq:3.13-alpine";
    public static final String PULSAR_IMAGE = "apachepulsar/pulsar:3.2.3";
    public static final String PUBSUB_EMULATOR_IMAGE =
        "gcr.io/google.com/cloudsdktool/google-cloud-cli:475.0.0-emulators";
    public static final String NATS_IMAGE = "nats:2.10-alpine";

    public static final int NATS_CLIENT_PORT = 4222;

    /**
     * Project id used with the Pub/Sub emulator, which accepts any value.
     */
    public static final String PUBSUB_TEST_PROJECT = "mqclient-test";

    private BrokerTestContainers() {
    }

    public static RabbitMQContainer rabbitMq() {
        logger.info("Creating RabbitMQ container with image {}", RABBITMQ_IMAGE);
        return new RabbitMQContainer(DockerImageName.parse(RABBITMQ_IMAGE));
    }

    public static PulsarContainer pulsar() {
        logger.info("Creating Pulsar container with image {}", PULSAR_IMAGE);
        return new PulsarContainer(DockerImageName.parse(PULSAR_IMAGE));
    }

    public static PubSubEmulatorContainer pubSubEmulator() {
        logger.info("Creating Pub/Sub emulator container with image {}", PUBSUB_EMULATOR_IMAGE);
        return new PubSubEmulatorContainer(DockerImageName.parse(PUBSUB_EMULATOR_IMAGE));
    }

    /**
     * NATS server with JetStream enabled.
     */
    public static GenericContainer<?> nats() {
        logger.info("Creating NATS container with image {}", NATS_IMAGE);
        return new GenericContainer<>(DockerImageName.parse(NATS_IMAGE))
            .withCommand("-js")
            .withExposedPorts(NATS_CLIENT_PORT)
            .waitingFor(Wait.forLogMessage(".*Server is ready.*", 1));
    }

    public static String natsAddress(GenericContainer<?> container) {
        return "nats://" + container.getHost() + ":" + container.getMappedPort(NATS_CLIENT_PORT);
    }
}

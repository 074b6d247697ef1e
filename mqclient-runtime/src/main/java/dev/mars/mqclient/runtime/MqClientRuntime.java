package dev.mars.mqclient.runtime;

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

import dev.mars.mqclient.api.ErrorSink;
import dev.mars.mqclient.api.QueueConnection;
import dev.mars.mqclient.api.metrics.MetricsProvider;
import dev.mars.mqclient.api.metrics.NoOpMetricsProvider;
import dev.mars.mqclient.core.config.MqClientConfiguration;
import dev.mars.mqclient.core.metrics.MicrometerMetricsProvider;
import dev.mars.mqclient.core.metrics.MqClientMetrics;
import dev.mars.mqclient.core.provider.MqQueueConnectionProvider;
import dev.mars.mqclient.gcp.GcpPubSubAdapterRegistrar;
import dev.mars.mqclient.nats.NatsAdapterRegistrar;
import dev.mars.mqclient.pulsar.PulsarAdapterRegistrar;
import dev.mars.mqclient.rabbitmq.RabbitMqAdapterRegistrar;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single entry point for creating queue connections.
 *
 * <p>Wires the adapter modules into a {@link MqQueueConnectionProvider} so callers only
 * depend on the API types.</p>
 *
 * <pre>{@code
 * // Everything from mqclient.* properties, environment and system properties
 * try (QueueConnection connection = MqClientRuntime.openConnection(new MqClientConfiguration())) {
 *     connection.createPublisher().send(payload);
 * }
 *
 * // Or a provider limited to some brokers
 * MqQueueConnectionProvider provider = MqClientRuntime.createProvider(
 *     RuntimeConfig.builder().enableGcp(false).build());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public final class MqClientRuntime {

    private static final Logger logger = LoggerFactory.getLogger(MqClientRuntime.class);

    private MqClientRuntime() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates a provider with every adapter registered.
     */
    public static MqQueueConnectionProvider createProvider() {
        return createProvider(RuntimeConfig.defaults());
    }

    public static MqQueueConnectionProvider createProvider(RuntimeConfig config) {
        return createProvider(config, ErrorSink.logging(), NoOpMetricsProvider.INSTANCE);
    }

    public static MqQueueConnectionProvider createProvider(RuntimeConfig config, ErrorSink errorSink,
                                                           MetricsProvider metrics) {
        Objects.requireNonNull(config, "RuntimeConfig cannot be null");
        logger.info("Creating queue connection provider with config: {}", config);

        MqQueueConnectionProvider provider = new MqQueueConnectionProvider(errorSink, metrics);
        if (config.isPulsarEnabled()) {
            PulsarAdapterRegistrar.registerWith(provider);
        }
        if (config.isRabbitMqEnabled()) {
            RabbitMqAdapterRegistrar.registerWith(provider);
        }
        if (config.isGcpEnabled()) {
            GcpPubSubAdapterRegistrar.registerWith(provider);
        }
        if (config.isNatsEnabled()) {
            NatsAdapterRegistrar.registerWith(provider);
        }

        logger.info("Queue connection provider ready for {}", provider.getSupportedTypes());
        return provider;
    }

    /**
     * Opens a connection described by {@code configuration}, recording metrics in a
     * private {@link SimpleMeterRegistry} when metrics are enabled.
     */
    public static QueueConnection openConnection(MqClientConfiguration configuration) {
        return openConnection(configuration, RuntimeConfig.defaults(), new SimpleMeterRegistry());
    }

    /**
     * Opens a connection, binding its metrics to {@code meterRegistry} when
     * {@code mqclient.metrics.enabled} is true.
     */
    public static QueueConnection openConnection(MqClientConfiguration configuration, RuntimeConfig config,
                                                 MeterRegistry meterRegistry) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");
        MqQueueConnectionProvider provider = createProvider(config, ErrorSink.logging(),
            createMetrics(configuration, meterRegistry));
        return provider.openConnection(configuration.toQueueConfiguration());
    }

    static MetricsProvider createMetrics(MqClientConfiguration configuration, MeterRegistry meterRegistry) {
        if (!configuration.isMetricsEnabled()) {
            logger.debug("Metrics disabled for {}", configuration.getInstanceId());
            return NoOpMetricsProvider.INSTANCE;
        }
        MqClientMetrics metrics = new MqClientMetrics(configuration.getInstanceId());
        metrics.bindTo(meterRegistry);
        return new MicrometerMetricsProvider(metrics);
    }
}

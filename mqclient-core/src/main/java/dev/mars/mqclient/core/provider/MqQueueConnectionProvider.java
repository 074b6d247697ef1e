package dev.mars.mqclient.core.provider;

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

import dev.mars.mqclient.api.BackendAdapterRegistrar;
import dev.mars.mqclient.api.ErrorSink;
import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.QueueConnection;
import dev.mars.mqclient.api.QueueConnectionProvider;
import dev.mars.mqclient.api.adapter.BackendAdapter;
import dev.mars.mqclient.api.adapter.BackendAdapterCreator;
import dev.mars.mqclient.api.adapter.BrokerClients;
import dev.mars.mqclient.api.error.MqClientException;
import dev.mars.mqclient.api.metrics.MetricsProvider;
import dev.mars.mqclient.api.metrics.NoOpMetricsProvider;
import dev.mars.mqclient.core.connection.DefaultQueueConnection;
import dev.mars.mqclient.core.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of backend adapters keyed on the {@code broker_client} value.
 *
 * <p>The provider knows no broker itself. Adapter modules register a creator through
 * {@link BackendAdapterRegistrar}, usually via their {@code <Broker>AdapterRegistrar}.
 * Keys are case-insensitive.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class MqQueueConnectionProvider implements QueueConnectionProvider, BackendAdapterRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(MqQueueConnectionProvider.class);

    // Registry of adapter creators
    private final Map<String, BackendAdapterCreator> adapterCreators = new ConcurrentHashMap<>();

    private final ErrorSink errorSink;
    private final MetricsProvider metrics;
    private final Sleeper sleeper;

    public MqQueueConnectionProvider() {
        this(ErrorSink.logging(), NoOpMetricsProvider.INSTANCE);
    }

    public MqQueueConnectionProvider(ErrorSink errorSink, MetricsProvider metrics) {
        this(errorSink, metrics, Sleeper.SYSTEM);
    }

    public MqQueueConnectionProvider(ErrorSink errorSink, MetricsProvider metrics, Sleeper sleeper) {
        this.errorSink = Objects.requireNonNull(errorSink, "errorSink cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    @Override
    public void registerAdapter(String brokerClient, BackendAdapterCreator creator) {
        if (brokerClient == null || brokerClient.trim().isEmpty()) {
            throw new IllegalArgumentException("Broker client cannot be null or empty");
        }
        Objects.requireNonNull(creator, "creator cannot be null");
        String key = BrokerClients.normalize(brokerClient);
        if (adapterCreators.put(key, creator) != null) {
            logger.info("Replaced backend adapter registration for: {}", key);
        } else {
            logger.info("Registered backend adapter: {}", key);
        }
    }

    @Override
    public void unregisterAdapter(String brokerClient) {
        if (brokerClient != null && adapterCreators.remove(BrokerClients.normalize(brokerClient)) != null) {
            logger.info("Unregistered backend adapter: {}", brokerClient);
        }
    }

    @Override
    public QueueConnection createConnection(QueueConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        String brokerClient = configuration.getBrokerClient();

        if (adapterCreators.isEmpty()) {
            throw new IllegalStateException("No backend adapters are registered. Register at least one with "
                + "PulsarAdapterRegistrar.registerWith(), RabbitMqAdapterRegistrar.registerWith(), "
                + "GcpAdapterRegistrar.registerWith() or NatsAdapterRegistrar.registerWith().");
        }

        BackendAdapterCreator creator = adapterCreators.get(brokerClient);
        if (creator == null) {
            throw new IllegalArgumentException("Unsupported broker client: " + brokerClient
                + ". Available types: " + Set.copyOf(adapterCreators.keySet())
                + ". Please ensure the requested adapter module is registered.");
        }

        BackendAdapter adapter;
        try {
            adapter = creator.create(configuration);
        } catch (MqClientException | IllegalArgumentException e) {
            logger.error("Failed to create {} adapter for queue '{}': {}", brokerClient,
                configuration.getQueueName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to create {} adapter for queue '{}'", brokerClient, configuration.getQueueName(), e);
            throw new MqClientException("Failed to create backend adapter: " + e.getMessage(), brokerClient, e);
        }
        logger.info("Created {} connection for queue '{}'", brokerClient, configuration.getQueueName());
        return new DefaultQueueConnection(adapter, configuration, errorSink, metrics, sleeper);
    }

    @Override
    public Set<String> getSupportedTypes() {
        return Set.copyOf(adapterCreators.keySet());
    }

    @Override
    public boolean isTypeSupported(String brokerClient) {
        return brokerClient != null && adapterCreators.containsKey(BrokerClients.normalize(brokerClient));
    }

    public MetricsProvider getMetrics() {
        return metrics;
    }

    public ErrorSink getErrorSink() {
        return errorSink;
    }
}

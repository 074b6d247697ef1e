package dev.mars.mqclient.core.config;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;

/**
 * Property-based configuration for the queue client.
 *
 * <p>Sources are applied in order, each overriding the previous one:</p>
 * <ol>
 *   <li>{@code /mqclient-default.properties} on the classpath</li>
 *   <li>{@code /mqclient-<profile>.properties} for any profile other than {@code default}</li>
 *   <li>{@code MQCLIENT_*} environment variables, lower-cased with {@code _} turned into {@code .}</li>
 *   <li>{@code mqclient.*} system properties</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * <p>Keys under {@code mqclient.adapter.} are handed to the backend adapter with that
 * prefix removed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class MqClientConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(MqClientConfiguration.class);

    public static final String PREFIX = "mqclient.";
    public static final String ADAPTER_PREFIX = "mqclient.adapter.";

    public static final String BROKER_CLIENT = "mqclient.broker.client";
    public static final String ADDRESS = "mqclient.address";
    public static final String AUTH_TOKEN = "mqclient.auth.token";
    public static final String CREDENTIALS_PATH = "mqclient.credentials.path";
    public static final String QUEUE_NAME = "mqclient.queue.name";
    public static final String SUBSCRIPTION_NAME = "mqclient.subscription.name";
    public static final String PREFETCH = "mqclient.prefetch";
    public static final String ACK_DEADLINE = "mqclient.ack.deadline";
    public static final String MAX_RETRIES = "mqclient.max.retries";
    public static final String BACKOFF_INITIAL = "mqclient.backoff.initial";
    public static final String BACKOFF_MULTIPLIER = "mqclient.backoff.multiplier";
    public static final String BACKOFF_CAP = "mqclient.backoff.cap";
    public static final String RECEIVE_TIMEOUT = "mqclient.receive.timeout";
    public static final String CONNECT_MAX_ATTEMPTS = "mqclient.connect.max.attempts";
    public static final String METRICS_ENABLED = "mqclient.metrics.enabled";
    public static final String METRICS_INSTANCE_ID = "mqclient.metrics.instance.id";

    private final Properties properties;
    private final String profile;

    public MqClientConfiguration() {
        this(getActiveProfile());
    }

    public MqClientConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * @param overrides properties applied last, used for programmatic configuration
     */
    public MqClientConfiguration(String profile, Properties overrides) {
        this(profile, overrides, System.getenv());
    }

    MqClientConfiguration(String profile, Properties overrides, Map<String, String> environment) {
        this.profile = profile != null ? profile : "default";
        this.properties = loadProperties(this.profile, environment);
        if (overrides != null) {
            overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        }
        validateConfiguration();
        logger.info("Loaded MQClient configuration for profile: {}", this.profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("mqclient.profile",
               System.getenv("MQCLIENT_PROFILE") != null ? System.getenv("MQCLIENT_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/mqclient-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/mqclient-" + profile + ".properties");
        }

        // Environment first, system properties after it so -D wins
        environment.forEach((key, value) -> {
            if (key.startsWith("MQCLIENT_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(PREFIX)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateBrokerConfig(errors);
        validateConsumerConfig(errors);
        validateBackoffConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateBrokerConfig(List<String> errors) {
        if (getString(BROKER_CLIENT, "").isBlank()) {
            errors.add("Broker client is required");
        }
        if (getString(ADDRESS, "").isBlank()) {
            errors.add("Broker address is required");
        }
        if (getString(QUEUE_NAME, "").isBlank()) {
            errors.add("Queue name is required");
        }
        if (getInt(CONNECT_MAX_ATTEMPTS, QueueConfiguration.DEFAULT_CONNECT_MAX_ATTEMPTS) < 1) {
            errors.add("Connect max attempts must be at least 1");
        }
    }

    private void validateConsumerConfig(List<String> errors) {
        if (getInt(PREFETCH, QueueConfiguration.DEFAULT_PREFETCH) < 1) {
            errors.add("Prefetch must be at least 1");
        }
        if (getInt(MAX_RETRIES, QueueConfiguration.DEFAULT_MAX_RETRIES) < 0) {
            errors.add("Max retries must be non-negative");
        }
        Duration ackDeadline = getDuration(ACK_DEADLINE, QueueConfiguration.DEFAULT_ACK_DEADLINE);
        if (ackDeadline.isZero() || ackDeadline.isNegative()) {
            errors.add("Ack deadline must be positive");
        }
        Duration receiveTimeout = getDuration(RECEIVE_TIMEOUT, QueueConfiguration.DEFAULT_RECEIVE_TIMEOUT);
        if (receiveTimeout.isZero() || receiveTimeout.isNegative()) {
            errors.add("Receive timeout must be positive");
        }
    }

    private void validateBackoffConfig(List<String> errors) {
        Duration initial = getDuration(BACKOFF_INITIAL, QueueConfiguration.DEFAULT_BACKOFF_INITIAL);
        Duration cap = getDuration(BACKOFF_CAP, QueueConfiguration.DEFAULT_BACKOFF_CAP);
        if (initial.isNegative()) {
            errors.add("Backoff initial delay must be non-negative");
        }
        if (cap.compareTo(initial) < 0) {
            errors.add("Backoff cap must be greater than or equal to the initial delay");
        }
        if (getDouble(BACKOFF_MULTIPLIER, QueueConfiguration.DEFAULT_BACKOFF_MULTIPLIER) < 1.0) {
            errors.add("Backoff multiplier must be at least 1.0");
        }
    }

    // Configuration getters with defaults and validation
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * @return the {@code mqclient.adapter.*} properties with the prefix removed
     */
    public Map<String, String> getAdapterProperties() {
        Map<String, String> adapterProperties = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(ADAPTER_PREFIX) && key.length() > ADAPTER_PREFIX.length()) {
                adapterProperties.put(key.substring(ADAPTER_PREFIX.length()), properties.getProperty(key));
            }
        }
        return adapterProperties;
    }

    // Specific configuration builders
    public QueueConfiguration toQueueConfiguration() {
        QueueConfiguration.Builder builder = QueueConfiguration.builder()
            .brokerClient(getString(BROKER_CLIENT))
            .address(getString(ADDRESS))
            .queueName(getString(QUEUE_NAME))
            .subscriptionName(getString(SUBSCRIPTION_NAME, QueueConfiguration.DEFAULT_SUBSCRIPTION_NAME))
            .prefetch(getInt(PREFETCH, QueueConfiguration.DEFAULT_PREFETCH))
            .ackDeadline(getDuration(ACK_DEADLINE, QueueConfiguration.DEFAULT_ACK_DEADLINE))
            .maxRetries(getInt(MAX_RETRIES, QueueConfiguration.DEFAULT_MAX_RETRIES))
            .backoffInitial(getDuration(BACKOFF_INITIAL, QueueConfiguration.DEFAULT_BACKOFF_INITIAL))
            .backoffMultiplier(getDouble(BACKOFF_MULTIPLIER, QueueConfiguration.DEFAULT_BACKOFF_MULTIPLIER))
            .backoffCap(getDuration(BACKOFF_CAP, QueueConfiguration.DEFAULT_BACKOFF_CAP))
            .receiveTimeout(getDuration(RECEIVE_TIMEOUT, QueueConfiguration.DEFAULT_RECEIVE_TIMEOUT))
            .connectMaxAttempts(getInt(CONNECT_MAX_ATTEMPTS, QueueConfiguration.DEFAULT_CONNECT_MAX_ATTEMPTS))
            .adapterProperties(getAdapterProperties());

        String authToken = getString(AUTH_TOKEN, "");
        if (!authToken.isBlank()) {
            builder.authToken(authToken);
        }
        String credentialsPath = getString(CREDENTIALS_PATH, "");
        if (!credentialsPath.isBlank()) {
            builder.credentialsPath(credentialsPath);
        }
        return builder.build();
    }

    public boolean isMetricsEnabled() {
        return getBoolean(METRICS_ENABLED, true);
    }

    public String getInstanceId() {
        return getString(METRICS_INSTANCE_ID, "mqclient-" + getString(QUEUE_NAME, "default"));
    }

    public String getProfile() {
        return profile;
    }

    @Override
    public String toString() {
        return "MqClientConfiguration{profile='" + profile + "', brokerClient='" + getString(BROKER_CLIENT, "")
            + "', address='" + getString(ADDRESS, "") + "', queueName='" + getString(QUEUE_NAME, "") + "'}";
    }
}

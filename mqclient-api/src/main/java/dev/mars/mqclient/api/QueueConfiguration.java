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

import dev.mars.mqclient.api.adapter.BrokerClients;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for one queue connection.
 *
 * <p>Built with {@link #builder()}; {@link Builder#build()} validates every field and
 * reports all violations at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class QueueConfiguration {

    public static final String DEFAULT_SUBSCRIPTION_NAME = "mqclient-sub";
    public static final int DEFAULT_PREFETCH = 1;
    public static final Duration DEFAULT_ACK_DEADLINE = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF_INITIAL = Duration.ofSeconds(1);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_BACKOFF_CAP = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RECEIVE_TIMEOUT = Duration.ofMillis(1000);
    public static final int DEFAULT_CONNECT_MAX_ATTEMPTS = 3;

    private final String brokerClient;
    private final String address;
    private final String authToken;
    private final String credentialsPath;
    private final String queueName;
    private final String subscriptionName;
    private final int prefetch;
    private final Duration ackDeadline;
    private final int maxRetries;
    private final Duration backoffInitial;
    private final double backoffMultiplier;
    private final Duration backoffCap;
    private final Duration receiveTimeout;
    private final int connectMaxAttempts;
    private final Map<String, String> adapterProperties;

    private QueueConfiguration(Builder builder) {
        this.brokerClient = BrokerClients.normalize(builder.brokerClient);
        this.address = builder.address;
        this.authToken = builder.authToken;
        this.credentialsPath = builder.credentialsPath;
        this.queueName = builder.queueName;
        this.subscriptionName = builder.subscriptionName;
        this.prefetch = builder.prefetch;
        this.ackDeadline = builder.ackDeadline;
        this.maxRetries = builder.maxRetries;
        this.backoffInitial = builder.backoffInitial;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.backoffCap = builder.backoffCap;
        this.receiveTimeout = builder.receiveTimeout;
        this.connectMaxAttempts = builder.connectMaxAttempts;
        this.adapterProperties = Collections.unmodifiableMap(new HashMap<>(builder.adapterProperties));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBrokerClient() { return brokerClient; }
    public String getAddress() { return address; }
    public String getAuthToken() { return authToken; }
    public boolean hasAuthToken() { return authToken != null && !authToken.isEmpty(); }
    public String getCredentialsPath() { return credentialsPath; }
    public String getQueueName() { return queueName; }
    public String getSubscriptionName() { return subscriptionName; }
    public int getPrefetch() { return prefetch; }
    public Duration getAckDeadline() { return ackDeadline; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getBackoffInitial() { return backoffInitial; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public Duration getBackoffCap() { return backoffCap; }
    public Duration getReceiveTimeout() { return receiveTimeout; }
    public int getConnectMaxAttempts() { return connectMaxAttempts; }
    public Map<String, String> getAdapterProperties() { return adapterProperties; }

    public String getAdapterProperty(String key, String defaultValue) {
        return adapterProperties.getOrDefault(key, defaultValue);
    }

    public int getAdapterProperty(String key, int defaultValue) {
        String value = adapterProperties.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Adapter property " + key + " is not an integer: " + value, e);
        }
    }

    public boolean getAdapterProperty(String key, boolean defaultValue) {
        String value = adapterProperties.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * Returns a builder pre-filled with this configuration.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
            .brokerClient(brokerClient)
            .address(address)
            .authToken(authToken)
            .credentialsPath(credentialsPath)
            .queueName(queueName)
            .subscriptionName(subscriptionName)
            .prefetch(prefetch)
            .ackDeadline(ackDeadline)
            .maxRetries(maxRetries)
            .backoffInitial(backoffInitial)
            .backoffMultiplier(backoffMultiplier)
            .backoffCap(backoffCap)
            .receiveTimeout(receiveTimeout)
            .connectMaxAttempts(connectMaxAttempts);
        builder.adapterProperties.putAll(adapterProperties);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueConfiguration that = (QueueConfiguration) o;
        return prefetch == that.prefetch &&
               maxRetries == that.maxRetries &&
               Double.compare(that.backoffMultiplier, backoffMultiplier) == 0 &&
               connectMaxAttempts == that.connectMaxAttempts &&
               Objects.equals(brokerClient, that.brokerClient) &&
               Objects.equals(address, that.address) &&
               Objects.equals(authToken, that.authToken) &&
               Objects.equals(credentialsPath, that.credentialsPath) &&
               Objects.equals(queueName, that.queueName) &&
               Objects.equals(subscriptionName, that.subscriptionName) &&
               Objects.equals(ackDeadline, that.ackDeadline) &&
               Objects.equals(backoffInitial, that.backoffInitial) &&
               Objects.equals(backoffCap, that.backoffCap) &&
               Objects.equals(receiveTimeout, that.receiveTimeout) &&
               Objects.equals(adapterProperties, that.adapterProperties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(brokerClient, address, authToken, credentialsPath, queueName, subscriptionName,
            prefetch, ackDeadline, maxRetries, backoffInitial, backoffMultiplier, backoffCap, receiveTimeout,
            connectMaxAttempts, adapterProperties);
    }

    /**
     * The auth token is masked.
     */
    @Override
    public String toString() {
        return "QueueConfiguration{" +
                "brokerClient='" + brokerClient + '\'' +
                ", address='" + address + '\'' +
                ", authToken=" + (hasAuthToken() ? "'****'" : "none") +
                ", queueName='" + queueName + '\'' +
                ", subscriptionName='" + subscriptionName + '\'' +
                ", prefetch=" + prefetch +
                ", ackDeadline=" + ackDeadline +
                ", maxRetries=" + maxRetries +
                ", backoffInitial=" + backoffInitial +
                ", backoffMultiplier=" + backoffMultiplier +
                ", backoffCap=" + backoffCap +
                ", receiveTimeout=" + receiveTimeout +
                ", connectMaxAttempts=" + connectMaxAttempts +
                '}';
    }

    public static class Builder {
        private String brokerClient;
        private String address;
        private String authToken;
        private String credentialsPath;
        private String queueName;
        private String subscriptionName = DEFAULT_SUBSCRIPTION_NAME;
        private int prefetch = DEFAULT_PREFETCH;
        private Duration ackDeadline = DEFAULT_ACK_DEADLINE;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration backoffInitial = DEFAULT_BACKOFF_INITIAL;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private Duration backoffCap = DEFAULT_BACKOFF_CAP;
        private Duration receiveTimeout = DEFAULT_RECEIVE_TIMEOUT;
        private int connectMaxAttempts = DEFAULT_CONNECT_MAX_ATTEMPTS;
        private final Map<String, String> adapterProperties = new HashMap<>();

        public Builder brokerClient(String brokerClient) {
            this.brokerClient = brokerClient;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder credentialsPath(String credentialsPath) {
            this.credentialsPath = credentialsPath;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder subscriptionName(String subscriptionName) {
            this.subscriptionName = subscriptionName;
            return this;
        }

        public Builder prefetch(int prefetch) {
            this.prefetch = prefetch;
            return this;
        }

        public Builder ackDeadline(Duration ackDeadline) {
            this.ackDeadline = ackDeadline;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffInitial(Duration backoffInitial) {
            this.backoffInitial = backoffInitial;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder backoffCap(Duration backoffCap) {
            this.backoffCap = backoffCap;
            return this;
        }

        public Builder receiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = receiveTimeout;
            return this;
        }

        public Builder connectMaxAttempts(int connectMaxAttempts) {
            this.connectMaxAttempts = connectMaxAttempts;
            return this;
        }

        public Builder adapterProperty(String key, String value) {
            this.adapterProperties.put(key, value);
            return this;
        }

        public Builder adapterProperties(Map<String, String> properties) {
            this.adapterProperties.putAll(properties);
            return this;
        }

        public QueueConfiguration build() {
            List<String> errors = new ArrayList<>();
            if (isBlank(brokerClient)) {
                errors.add("broker client is required");
            }
            if (isBlank(address)) {
                errors.add("address is required");
            }
            if (isBlank(queueName)) {
                errors.add("queue name is required");
            }
            if (isBlank(subscriptionName)) {
                errors.add("subscription name cannot be empty");
            }
            if (prefetch < 1) {
                errors.add("prefetch must be at least 1");
            }
            if (!isPositive(ackDeadline)) {
                errors.add("ack deadline must be positive");
            }
            if (maxRetries < 0) {
                errors.add("max retries must be non-negative");
            }
            if (backoffInitial == null || backoffInitial.isNegative()) {
                errors.add("backoff initial must be zero or positive");
            }
            if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
                errors.add("backoff multiplier must be at least 1.0");
            }
            if (backoffCap == null || (backoffInitial != null && backoffCap.compareTo(backoffInitial) < 0)) {
                errors.add("backoff cap must be greater than or equal to backoff initial");
            }
            if (!isPositive(receiveTimeout)) {
                errors.add("receive timeout must be positive");
            }
            if (connectMaxAttempts < 1) {
                errors.add("connect max attempts must be at least 1");
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid queue configuration: " + String.join(", ", errors));
            }
            return new QueueConfiguration(this);
        }

        private static boolean isBlank(String value) {
            return value == null || value.trim().isEmpty();
        }

        private static boolean isPositive(Duration value) {
            return value != null && !value.isZero() && !value.isNegative();
        }
    }
}

package dev.mars.mqclient.api.adapter;

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

import java.util.List;
import java.util.Locale;

/**
 * Known values of the {@code broker_client} setting.
 */
public final class BrokerClients {

    public static final String PULSAR = "pulsar";
    public static final String RABBITMQ = "rabbitmq";
    public static final String GCP = "gcp";
    public static final String NATS = "nats";

    public static final List<String> ALL = List.of(PULSAR, RABBITMQ, GCP, NATS);

    private BrokerClients() {
    }

    public static String normalize(String brokerClient) {
        return brokerClient == null ? null : brokerClient.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Prefixes {@code address} with {@code scheme + "://"} unless it already names a scheme.
     */
    public static String withScheme(String scheme, String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address cannot be empty");
        }
        String trimmed = address.trim();
        return trimmed.contains("://") ? trimmed : scheme + "://" + trimmed;
    }
}

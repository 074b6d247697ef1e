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

import dev.mars.mqclient.api.BackendAdapterRegistrar;
import dev.mars.mqclient.api.adapter.BrokerClients;

/**
 * Registers the NATS JetStream adapter under {@code nats}.
 */
public final class NatsAdapterRegistrar {

    private NatsAdapterRegistrar() {
    }

    public static void registerWith(BackendAdapterRegistrar registrar) {
        registrar.registerAdapter(BrokerClients.NATS, configuration -> new NatsAdapter());
    }
}

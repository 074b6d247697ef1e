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

import dev.mars.mqclient.api.adapter.BackendAdapterCreator;

/**
 * Registration side of the connection provider, used by adapter modules to plug
 * themselves in without the provider depending on them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface BackendAdapterRegistrar {

    /**
     * Registers a creator for a {@code broker_client} value. A later registration for the
     * same value replaces the earlier one.
     */
    void registerAdapter(String brokerClient, BackendAdapterCreator creator);

    void unregisterAdapter(String brokerClient);
}

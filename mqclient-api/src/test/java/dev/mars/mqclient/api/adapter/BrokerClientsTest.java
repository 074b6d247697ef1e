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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class BrokerClientsTest {

    @Test
    void testWithSchemeAddsPrefixOnlyWhenMissing() {
        assertEquals("amqp://localhost", BrokerClients.withScheme("amqp", "localhost"));
        assertEquals("amqps://host:5671", BrokerClients.withScheme("amqp", "amqps://host:5671"));
        assertEquals("pulsar://broker:6650", BrokerClients.withScheme("pulsar", " broker:6650 "));
        assertThrows(IllegalArgumentException.class, () -> BrokerClients.withScheme("nats", " "));
    }

    @Test
    void testNormalize() {
        assertEquals("gcp", BrokerClients.normalize(" GCP "));
        assertNull(BrokerClients.normalize(null));
    }
}

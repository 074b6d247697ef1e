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

import dev.mars.mqclient.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class RuntimeConfigTest {

    @Test
    void defaults_allAdaptersEnabled() {
        RuntimeConfig config = RuntimeConfig.defaults();

        assertTrue(config.isPulsarEnabled());
        assertTrue(config.isRabbitMqEnabled());
        assertTrue(config.isGcpEnabled());
        assertTrue(config.isNatsEnabled());
    }

    @Test
    void builder_withMixedSettings_correctConfiguration() {
        RuntimeConfig config = RuntimeConfig.builder()
                .enablePulsar(false)
                .enableGcp(false)
                .build();

        assertFalse(config.isPulsarEnabled());
        assertTrue(config.isRabbitMqEnabled());
        assertFalse(config.isGcpEnabled());
        assertTrue(config.isNatsEnabled());
    }

    @Test
    void toString_containsAllSettings() {
        String result = RuntimeConfig.builder().enableNats(false).build().toString();

        assertTrue(result.contains("enablePulsar=true"));
        assertTrue(result.contains("enableNats=false"));
    }
}

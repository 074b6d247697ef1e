package dev.mars.mqclient.test.categories;

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

/**
 * Test category constants for use with JUnit 5 {@code @Tag}.
 *
 * <ul>
 *   <li><strong>CORE</strong> - fast unit tests, no external infrastructure</li>
 *   <li><strong>INTEGRATION</strong> - tests against real brokers started with Testcontainers (needs Docker)</li>
 *   <li><strong>PERFORMANCE</strong> - throughput and load tests</li>
 *   <li><strong>SLOW</strong> - long-running tests</li>
 *   <li><strong>FLAKY</strong> - unstable tests needing investigation</li>
 * </ul>
 *
 * <pre>{@code
 * mvn test                        # core tests
 * mvn test -Pintegration-tests    # broker-backed tests
 * mvn test -Pall-tests            # everything except flaky
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class TestCategories {

    public static final String CORE = "core";

    public static final String INTEGRATION = "integration";

    public static final String PERFORMANCE = "performance";

    public static final String SLOW = "slow";

    public static final String FLAKY = "flaky";

    private TestCategories() {
    }
}

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
class RedeliveryTrackerTest {

    @Test
    void testFirstDeliveryUsesBrokerValues() {
        RedeliveryTracker tracker = new RedeliveryTracker(10);

        assertEquals(0, tracker.observe("a", 0, false));
        assertEquals(1, tracker.observe("b", 0, true));
        assertEquals(4, tracker.observe("c", 4, true));
    }

    @Test
    void testCountStrictlyIncreasesEvenWhenBrokerOnlyFlagsRedelivery() {
        RedeliveryTracker tracker = new RedeliveryTracker(10);

        int first = tracker.observe("m", 0, false);
        int second = tracker.observe("m", 0, true);
        int third = tracker.observe("m", 0, true);

        assertTrue(first < second);
        assertTrue(second < third);
    }

    @Test
    void testBrokerCountWinsWhenAhead() {
        RedeliveryTracker tracker = new RedeliveryTracker(10);
        tracker.observe("m", 0, false);
        assertEquals(5, tracker.observe("m", 5, true));
    }

    @Test
    void testForgetAndEviction() {
        RedeliveryTracker tracker = new RedeliveryTracker(2);
        tracker.observe("a", 0, false);
        tracker.observe("b", 0, false);
        tracker.observe("c", 0, false);
        assertEquals(2, tracker.size());

        tracker.forget("c");
        assertEquals(1, tracker.size());
        assertEquals(0, tracker.observe("c", 0, false));
    }
}

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps redelivery counts strictly increasing for brokers that only report whether a
 * delivery is a redelivery, or that count from a different base.
 *
 * <p>Remembers the last count handed out per delivery id, evicting the least recently
 * seen ids once {@code capacity} is reached.</p>
 */
public final class RedeliveryTracker {

    private final Map<String, Integer> lastSeen;

    public RedeliveryTracker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.lastSeen = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Records a delivery and returns the redelivery count to expose for it.
     *
     * @param deliveryId    stable id of the logical message
     * @param brokerCount   the count the broker reported, 0 if it reports none
     * @param redeliverFlag whether the broker flagged the delivery as a redelivery
     */
    public synchronized int observe(String deliveryId, int brokerCount, boolean redeliverFlag) {
        Integer previous = lastSeen.get(deliveryId);
        int count = Math.max(brokerCount, redeliverFlag ? 1 : 0);
        if (previous != null) {
            count = Math.max(count, previous + 1);
        }
        lastSeen.put(deliveryId, count);
        return count;
    }

    /**
     * Stops tracking a delivery id once its message is settled for good.
     */
    public synchronized void forget(String deliveryId) {
        lastSeen.remove(deliveryId);
    }

    public synchronized int size() {
        return lastSeen.size();
    }
}

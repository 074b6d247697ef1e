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
 * Remembers which broker receipts were already settled so adapters can make ack and
 * nack idempotent even when the broker itself treats a second settlement as an error.
 */
public final class SettledDeliveries {

    private final Map<Object, Boolean> settled;

    public SettledDeliveries(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.settled = new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Object, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * @return true if the receipt had not been settled before and is now marked
     */
    public synchronized boolean markSettled(Object receipt) {
        return settled.putIfAbsent(receipt, Boolean.TRUE) == null;
    }

    public synchronized boolean isSettled(Object receipt) {
        return settled.containsKey(receipt);
    }

    /**
     * Clears everything, used when a new broker session starts and old receipts lose meaning.
     */
    public synchronized void clear() {
        settled.clear();
    }
}

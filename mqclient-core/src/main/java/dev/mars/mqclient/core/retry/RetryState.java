package dev.mars.mqclient.core.retry;

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

import java.time.Duration;

/**
 * Retry bookkeeping for one logical message, threaded through the consumer loop
 * across redeliveries.
 */
public final class RetryState {

    private final String deliveryId;
    private int attempts;
    private int retriesUsed;
    private Duration lastDelay;

    RetryState(String deliveryId) {
        this.deliveryId = deliveryId;
    }

    /**
     * Lifts the retry count to what the broker reports, so retries are counted even
     * when this state was created after earlier deliveries. The last delay is lifted
     * with it so the next backoff continues from there.
     */
    void observeRedeliveryCount(int redeliveryCount, BackoffPolicy backoff) {
        if (redeliveryCount <= retriesUsed) {
            return;
        }
        retriesUsed = redeliveryCount;
        Duration floor = backoff.delayFor(redeliveryCount);
        if (lastDelay == null || lastDelay.compareTo(floor) < 0) {
            lastDelay = floor;
        }
    }

    int beginAttempt() {
        return ++attempts;
    }

    /**
     * Consumes one retry and returns the delay to wait before it.
     */
    Duration scheduleRetry(BackoffPolicy backoff) {
        retriesUsed++;
        lastDelay = backoff.next(lastDelay);
        return lastDelay;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    /**
     * @return processing invocations observed by this consumer
     */
    public int getAttempts() {
        return attempts;
    }

    public int getRetriesUsed() {
        return retriesUsed;
    }

    public Duration getLastDelay() {
        return lastDelay;
    }
}

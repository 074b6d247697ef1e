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

import dev.mars.mqclient.api.QueueConfiguration;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: {@code initial, initial * multiplier, ...}, never above {@code cap}.
 *
 * <p>Successive delays are non-decreasing because the multiplier is at least 1.0 and
 * the cap is applied last.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public final class BackoffPolicy {

    private final Duration initial;
    private final double multiplier;
    private final Duration cap;

    public BackoffPolicy(Duration initial, double multiplier, Duration cap) {
        this.initial = Objects.requireNonNull(initial, "initial cannot be null");
        this.cap = Objects.requireNonNull(cap, "cap cannot be null");
        if (initial.isNegative()) {
            throw new IllegalArgumentException("Initial backoff cannot be negative: " + initial);
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0: " + multiplier);
        }
        if (cap.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Backoff cap " + cap + " is below initial " + initial);
        }
        this.multiplier = multiplier;
    }

    public static BackoffPolicy from(QueueConfiguration configuration) {
        return new BackoffPolicy(configuration.getBackoffInitial(), configuration.getBackoffMultiplier(),
            configuration.getBackoffCap());
    }

    /**
     * Delay after {@code previous}; {@code null} means no delay was used yet.
     */
    public Duration next(Duration previous) {
        if (previous == null) {
            return initial;
        }
        double scaledNanos = previous.toNanos() * multiplier;
        if (scaledNanos >= cap.toNanos()) {
            return cap;
        }
        return Duration.ofNanos((long) scaledNanos);
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("Retry number is 1-based, got " + retry);
        }
        Duration delay = initial;
        for (int i = 1; i < retry && delay.compareTo(cap) < 0; i++) {
            delay = next(delay);
        }
        return delay;
    }

    public Duration getInitial() {
        return initial;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getCap() {
        return cap;
    }

    @Override
    public String toString() {
        return "BackoffPolicy{initial=" + initial + ", multiplier=" + multiplier + ", cap=" + cap + '}';
    }
}

package dev.mars.mqclient.api.messaging;

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
import java.util.List;

/**
 * Pulls messages from the queue of the connection that created it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface MessageConsumer extends AutoCloseable {

    /**
     * Receives up to {@code maxCount} messages, clamped to what the backend allows,
     * blocking at most for the configured receive timeout. Returns an empty list when
     * nothing arrived in time.
     */
    List<MessageHandle> poll(int maxCount);

    /**
     * Receives up to the configured prefetch.
     */
    List<MessageHandle> poll();

    /**
     * Iterates over incoming messages one at a time. Iteration ends once no message
     * arrives within {@code inactivityTimeout}.
     */
    Iterable<MessageHandle> messages(Duration inactivityTimeout);

    /**
     * Prefetch after clamping to the backend's maximum.
     */
    int getEffectivePrefetch();

    String getQueueName();

    @Override
    void close();
}

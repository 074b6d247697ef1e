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

import dev.mars.mqclient.api.error.ConnectionClosedException;
import dev.mars.mqclient.api.error.MqClientException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class ErrorSinkTest {

    @Test
    void testAndThenCallsBothEvenIfFirstThrows() {
        List<MqClientException> seen = new ArrayList<>();
        ErrorSink failing = error -> {
            throw new IllegalStateException("boom");
        };
        ErrorSink chained = failing.andThen(seen::add);

        assertThrows(IllegalStateException.class, () -> chained.accept(new ConnectionClosedException("closed")));
        assertEquals(1, seen.size());
    }

    @Test
    void testLoggingSinkDoesNotThrow() {
        assertDoesNotThrow(() -> ErrorSink.logging().accept(new MqClientException("logged", "nats", null)));
    }
}

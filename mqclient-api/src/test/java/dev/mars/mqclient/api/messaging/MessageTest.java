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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class MessageTest {

    @Test
    void testPayloadIsCopiedOnBuildAndRead() {
        byte[] payload = {1, 2, 3};
        Message message = Message.builder().deliveryId("d-1").payload(payload).build();

        payload[0] = 99;
        assertArrayEquals(new byte[]{1, 2, 3}, message.getPayload());

        message.getPayload()[1] = 42;
        assertArrayEquals(new byte[]{1, 2, 3}, message.getPayload());
    }

    @Test
    void testNullPayloadBecomesEmpty() {
        Message message = Message.builder().deliveryId("d-1").build();
        assertEquals(0, message.getPayloadSize());
        assertArrayEquals(new byte[0], message.getPayload());
    }

    @Test
    void testDeliveryIdIsRequired() {
        assertThrows(NullPointerException.class, () -> Message.builder().payload(new byte[]{1}).build());
    }

    @Test
    void testNegativeRedeliveryCountRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> Message.builder().deliveryId("d").redeliveryCount(-1).build());
    }

    @Test
    void testAttributesAreImmutable() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("origin", "test");
        Message message = Message.builder().deliveryId("d").attributes(attributes).build();

        attributes.put("late", "value");
        assertEquals(1, message.getAttributes().size());
        assertThrows(UnsupportedOperationException.class, () -> message.getAttributes().put("x", "y"));
    }

    @Test
    void testTypedReceipt() {
        Message message = Message.builder().deliveryId("d").receipt(42L).build();

        assertEquals(42L, message.getReceipt(Long.class));
        assertThrows(IllegalArgumentException.class, () -> message.getReceipt(String.class));
    }

    @Test
    void testRedelivered() {
        assertFalse(Message.builder().deliveryId("d").build().isRedelivered());
        assertTrue(Message.builder().deliveryId("d").redeliveryCount(2).build().isRedelivered());
    }

    @Test
    void testEqualityIgnoresReceiptAndEnqueueTime() {
        Message a = Message.builder().deliveryId("d").payload(new byte[]{7})
            .receipt("a").enqueuedAt(Instant.EPOCH).build();
        Message b = Message.builder().deliveryId("d").payload(new byte[]{7})
            .receipt("b").enqueuedAt(Instant.now()).build();
        Message redelivered = Message.builder().deliveryId("d").payload(new byte[]{7}).redeliveryCount(1).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, redelivered);
    }

    @Test
    void testToStringDoesNotDumpPayload() {
        Message message = Message.builder().deliveryId("d-9").payload("secret".getBytes()).build();
        assertTrue(message.toString().contains("d-9"));
        assertFalse(message.toString().contains("secret"));
    }
}

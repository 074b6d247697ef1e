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

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable message as received from a broker.
 *
 * <p>The delivery id identifies the logical message and stays the same when the broker
 * redelivers it; the redelivery count grows by at least one on every redelivery. The
 * receipt is the broker specific token the adapter needs to settle this particular
 * delivery and is opaque to everything else.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class Message {

    private final String deliveryId;
    private final byte[] payload;
    private final Instant enqueuedAt;
    private final int redeliveryCount;
    private final Map<String, String> attributes;
    private final Object receipt;

    private Message(Builder builder) {
        this.deliveryId = Objects.requireNonNull(builder.deliveryId, "Delivery id cannot be null");
        this.payload = builder.payload != null ? builder.payload.clone() : new byte[0];
        this.enqueuedAt = builder.enqueuedAt != null ? builder.enqueuedAt : Instant.now();
        if (builder.redeliveryCount < 0) {
            throw new IllegalArgumentException("Redelivery count cannot be negative: " + builder.redeliveryCount);
        }
        this.redeliveryCount = builder.redeliveryCount;
        this.attributes = builder.attributes != null ? Map.copyOf(builder.attributes) : Collections.emptyMap();
        this.receipt = builder.receipt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    /**
     * @return a copy of the payload bytes
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadSize() {
        return payload.length;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public int getRedeliveryCount() {
        return redeliveryCount;
    }

    public boolean isRedelivered() {
        return redeliveryCount > 0;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Adapter specific settlement token. Only the adapter that produced this message
     * knows its type.
     */
    public Object getReceipt() {
        return receipt;
    }

    /**
     * Returns the receipt cast to the type the calling adapter expects.
     *
     * @throws IllegalArgumentException if the receipt was produced by a different adapter
     */
    public <T> T getReceipt(Class<T> type) {
        if (!type.isInstance(receipt)) {
            throw new IllegalArgumentException(String.format("Message %s carries a %s receipt, expected %s",
                deliveryId, receipt == null ? "null" : receipt.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(receipt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message that = (Message) o;
        return redeliveryCount == that.redeliveryCount &&
               deliveryId.equals(that.deliveryId) &&
               Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deliveryId, redeliveryCount) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return String.format("Message{deliveryId='%s', payloadSize=%d, enqueuedAt=%s, redeliveryCount=%d}",
            deliveryId, payload.length, enqueuedAt, redeliveryCount);
    }

    public static class Builder {
        private String deliveryId;
        private byte[] payload;
        private Instant enqueuedAt;
        private int redeliveryCount;
        private Map<String, String> attributes;
        private Object receipt;

        public Builder deliveryId(String deliveryId) {
            this.deliveryId = deliveryId;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder redeliveryCount(int redeliveryCount) {
            this.redeliveryCount = redeliveryCount;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder receipt(Object receipt) {
            this.receipt = receipt;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}

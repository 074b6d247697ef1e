package dev.mars.mqclient.core.serialization;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.mqclient.api.error.MqClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes and decodes {@link MessageEnvelope} payloads with Jackson.
 *
 * <p>The wire form is a JSON object {@code {"headers": {...}, "data": ...}}. Any value
 * Jackson can serialize may be used as data, including {@code java.time} types.</p>
 */
public class EnvelopeCodec {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeCodec.class);

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this(createDefaultObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public byte[] encode(Object data, Map<String, String> headers) {
        MessageEnvelope envelope = new MessageEnvelope(headers, objectMapper.valueToTree(data));
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new MqClientException("Failed to encode message envelope: " + e.getOriginalMessage(), e);
        }
    }

    public MessageEnvelope decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MqClientException("Cannot decode an empty payload as a message envelope");
        }
        try {
            MessageEnvelope envelope = objectMapper.readValue(payload, MessageEnvelope.class);
            if (envelope == null) {
                throw new MqClientException("Payload is not a message envelope");
            }
            return envelope;
        } catch (IOException e) {
            logger.debug("Payload of {} bytes is not a valid message envelope: {}", payload.length, e.getMessage());
            throw new MqClientException("Failed to decode message envelope: " + e.getMessage(), e);
        }
    }

    public <T> T readData(byte[] payload, Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        JsonNode data = decode(payload).data();
        if (data == null || data.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new MqClientException("Envelope data is not a " + type.getSimpleName() + ": "
                + e.getOriginalMessage(), e);
        }
    }

    public Map<String, String> readHeaders(byte[] payload) {
        return decode(payload).headers();
    }

    /**
     * Creates a default ObjectMapper with JSR310 support for Java 8 time types.
     */
    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

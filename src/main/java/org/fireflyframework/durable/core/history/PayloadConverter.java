/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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


package org.fireflyframework.durable.core.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Converts between workflow/activity values and the JSON-compatible trees
 * stored in event payloads, and serializes whole events for persistent logs.
 *
 * <p>Values are normalized to trees when they are recorded, so a workflow
 * replaying from an in-memory log observes exactly what it would observe
 * after the log was written to disk and read back.
 */
public class PayloadConverter {

    private static final TypeReference<Object> TREE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public PayloadConverter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public PayloadConverter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Object toPayload(Object value) {
        if (value == null) return null;
        try {
            return mapper.convertValue(value, TREE);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Failed to convert " + value.getClass().getName() + " to a payload", e);
        }
    }

    public <T> T fromPayload(Object payload, Class<T> type) {
        if (payload == null || type == Void.class || type == void.class) return null;
        if (type.isInstance(payload)) return type.cast(payload);
        try {
            return mapper.convertValue(payload, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Failed to convert payload to " + type.getName(), e);
        }
    }

    public String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public byte[] serializeToBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName() + " to bytes", e);
        }
    }

    public HistoryEvent deserializeEvent(String json) {
        try {
            return mapper.readValue(json, HistoryEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize HistoryEvent", e);
        }
    }

    public <T> T deserialize(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getType(), e);
        }
    }
}

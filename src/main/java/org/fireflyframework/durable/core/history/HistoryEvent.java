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

import org.fireflyframework.durable.core.model.EventType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable entry of a run's history. {@code seq} starts at 0 and is
 * contiguous within a run. Payload values are JSON-compatible trees.
 */
public record HistoryEvent(long seq, EventType type, Map<String, Object> payload, Instant timestamp) {

    public HistoryEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (seq < 0) throw new IllegalArgumentException("seq must be >= 0");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object get(String key) {
        return payload.get(key);
    }

    public String getString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    public int getInt(String key) {
        Object value = payload.get(key);
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) return Integer.parseInt(s);
        throw new IllegalStateException("Event " + seq + " (" + type + ") has no numeric '" + key + "'");
    }

    public boolean getBoolean(String key) {
        Object value = payload.get(key);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /** Command id referenced by this event, or -1 when it has none. */
    public int commandId() {
        Object value = payload.get(HistoryEvents.COMMAND_ID);
        return value instanceof Number n ? n.intValue() : -1;
    }
}

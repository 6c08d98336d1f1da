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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event that has not been numbered yet. The lock holder assigns the
 * sequence number and timestamp right before appending.
 */
public record PendingEvent(EventType type, Map<String, Object> payload) {

    public PendingEvent {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? Map.of() : payload;
    }

    public PendingEvent withPayload(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.put(key, value);
        return new PendingEvent(type, copy);
    }

    public HistoryEvent toHistoryEvent(long seq, Instant timestamp) {
        return new HistoryEvent(seq, type, payload, timestamp);
    }
}

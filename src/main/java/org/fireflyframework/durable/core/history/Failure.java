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

import org.fireflyframework.durable.core.exception.DurableException;
import org.fireflyframework.durable.core.exception.NonRetryableActivityException;
import org.fireflyframework.durable.core.exception.WorkflowExecutionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializable description of an error as recorded in history.
 */
public record Failure(String type, String message, boolean nonRetryable) {

    public static Failure from(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        if (error instanceof NonRetryableActivityException nre) {
            return new Failure(nre.getErrorType(), message, true);
        }
        if (error instanceof WorkflowExecutionException wee) {
            return new Failure(wee.getErrorType(), message, true);
        }
        if (error instanceof DurableException de) {
            return new Failure(de.getErrorCode(), message, false);
        }
        return new Failure(error.getClass().getSimpleName(), message, false);
    }

    public static Failure of(String type, String message) {
        return new Failure(type, message, false);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("message", message);
        map.put("nonRetryable", nonRetryable);
        return map;
    }

    @SuppressWarnings("unchecked")
    public static Failure fromPayload(Object payload) {
        if (!(payload instanceof Map<?, ?> raw)) {
            return new Failure("Unknown", String.valueOf(payload), false);
        }
        Map<String, Object> map = (Map<String, Object>) raw;
        Object nonRetryable = map.get("nonRetryable");
        return new Failure(
                String.valueOf(map.get("type")),
                String.valueOf(map.get("message")),
                nonRetryable instanceof Boolean b && b);
    }
}

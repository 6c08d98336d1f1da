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


package org.fireflyframework.durable.core.exception;

import org.fireflyframework.durable.core.model.RunKey;

public final class EventLogConflictException extends DurableException {
    private final long expectedSeq;
    private final long actualLength;

    public EventLogConflictException(RunKey runKey, long expectedSeq, long actualLength) {
        super("Append to " + runKey + " expected seq " + expectedSeq + " but log length is " + actualLength,
                "DURABLE_EVENT_LOG_CONFLICT");
        this.expectedSeq = expectedSeq;
        this.actualLength = actualLength;
    }

    public long getExpectedSeq() {
        return expectedSeq;
    }

    public long getActualLength() {
        return actualLength;
    }
}

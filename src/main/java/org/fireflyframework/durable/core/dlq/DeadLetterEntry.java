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


package org.fireflyframework.durable.core.dlq;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.fireflyframework.durable.core.model.RunKey;

import java.time.Instant;

/**
 * A run halted by the engine because its logic no longer matches its history.
 * {@code commandId} is the first command whose replay diverged.
 */
public record DeadLetterEntry(
        String workflowType,
        String workflowId,
        String runId,
        int commandId,
        String errorType,
        String errorMessage,
        Instant createdAt,
        Instant releasedAt
) {
    public static DeadLetterEntry of(String workflowType, RunKey runKey, int commandId, Throwable error, Instant now) {
        return new DeadLetterEntry(workflowType, runKey.workflowId(), runKey.runId(), commandId,
                error != null ? error.getClass().getName() : null,
                error != null ? error.getMessage() : null,
                now, null);
    }

    @JsonIgnore
    public RunKey runKey() {
        return RunKey.of(workflowId, runId);
    }

    public boolean isReleased() {
        return releasedAt != null;
    }

    public DeadLetterEntry released(Instant now) {
        return new DeadLetterEntry(workflowType, workflowId, runId, commandId, errorType, errorMessage, createdAt, now);
    }
}

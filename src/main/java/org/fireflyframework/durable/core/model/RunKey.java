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


package org.fireflyframework.durable.core.model;

import java.util.Objects;

/**
 * Identifies one run of a workflow. The event log, the run lock and the
 * task queue entries of a run are all partitioned by this key.
 */
public record RunKey(String workflowId, String runId) {

    public RunKey {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(runId, "runId");
        if (workflowId.isBlank()) throw new IllegalArgumentException("workflowId must not be blank");
        if (runId.isBlank()) throw new IllegalArgumentException("runId must not be blank");
    }

    public static RunKey of(String workflowId, String runId) {
        return new RunKey(workflowId, runId);
    }

    /**
     * Parses the {@code workflowId/runId} form produced by {@link #toString()}.
     * The run id never contains a slash, so the last one separates the parts.
     */
    public static RunKey parse(String value) {
        int idx = value.lastIndexOf('/');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Not a run key: " + value);
        }
        return new RunKey(value.substring(0, idx), value.substring(idx + 1));
    }

    @Override
    public String toString() {
        return workflowId + "/" + runId;
    }
}

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


package org.fireflyframework.durable.workflow.search;

import org.fireflyframework.durable.core.model.RunStatus;

import java.time.Instant;

/**
 * Criteria for listing runs. {@code null} fields match everything;
 * {@code limit <= 0} means unlimited.
 */
public record WorkflowFilter(
        String workflowType,
        RunStatus status,
        String workflowId,
        Instant startedAfter,
        Instant startedBefore,
        int limit
) {
    public static WorkflowFilter all() {
        return new WorkflowFilter(null, null, null, null, null, 0);
    }

    public WorkflowFilter withWorkflowType(String type) {
        return new WorkflowFilter(type, status, workflowId, startedAfter, startedBefore, limit);
    }

    public WorkflowFilter withStatus(RunStatus runStatus) {
        return new WorkflowFilter(workflowType, runStatus, workflowId, startedAfter, startedBefore, limit);
    }

    public WorkflowFilter withWorkflowId(String id) {
        return new WorkflowFilter(workflowType, status, id, startedAfter, startedBefore, limit);
    }

    public WorkflowFilter withStartWindow(Instant after, Instant before) {
        return new WorkflowFilter(workflowType, status, workflowId, after, before, limit);
    }

    public WorkflowFilter withLimit(int max) {
        return new WorkflowFilter(workflowType, status, workflowId, startedAfter, startedBefore, max);
    }

    public boolean matches(WorkflowSummary summary) {
        if (workflowType != null && !workflowType.equals(summary.workflowType())) return false;
        if (status != null && status != summary.status()) return false;
        if (workflowId != null && !workflowId.equals(summary.workflowId())) return false;
        if (startedAfter != null && summary.startTime().isBefore(startedAfter)) return false;
        return startedBefore == null || summary.startTime().isBefore(startedBefore);
    }
}

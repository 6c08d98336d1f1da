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


package org.fireflyframework.durable.client;

import org.fireflyframework.durable.core.model.RunKey;

import java.util.Objects;

/**
 * Reference to a workflow run. A handle without a runId addresses the
 * workflowId's current run.
 */
public record WorkflowHandle(String workflowId, String runId) {

    public WorkflowHandle {
        Objects.requireNonNull(workflowId, "workflowId");
    }

    public static WorkflowHandle of(String workflowId) {
        return new WorkflowHandle(workflowId, null);
    }

    public static WorkflowHandle of(RunKey runKey) {
        return new WorkflowHandle(runKey.workflowId(), runKey.runId());
    }

    public boolean hasRunId() {
        return runId != null;
    }
}

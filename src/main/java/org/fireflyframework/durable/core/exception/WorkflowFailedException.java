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

/**
 * Raised to a {@code getResult} caller when the run ended in {@code FAILED}.
 */
public class WorkflowFailedException extends DurableException {
    private final String workflowId;
    private final String errorType;

    public WorkflowFailedException(String workflowId, String errorType, String message) {
        super("Workflow '" + workflowId + "' failed: " + message, "DURABLE_WORKFLOW_FAILED");
        this.workflowId = workflowId;
        this.errorType = errorType;
    }

    public String getWorkflowId() { return workflowId; }
    public String getErrorType() { return errorType; }
}

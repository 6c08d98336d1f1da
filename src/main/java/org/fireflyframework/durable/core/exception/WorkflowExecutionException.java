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
 * Workflow logic explicitly failed the run. Throwing it from a workflow
 * records {@code WorkflowFailed} with the given error type.
 */
public class WorkflowExecutionException extends DurableException {
    private final String errorType;

    public WorkflowExecutionException(String message) {
        this(null, message);
    }

    public WorkflowExecutionException(String errorType, String message) {
        super(message, "DURABLE_WORKFLOW_EXECUTION_ERROR");
        this.errorType = errorType;
    }

    public WorkflowExecutionException(String errorType, String message, Throwable cause) {
        super(message, "DURABLE_WORKFLOW_EXECUTION_ERROR", cause);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType != null ? errorType : getClass().getSimpleName();
    }
}

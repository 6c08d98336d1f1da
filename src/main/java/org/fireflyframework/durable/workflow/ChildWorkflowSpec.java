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


package org.fireflyframework.durable.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes one child execution to start from a parent workflow.
 *
 * @param workflowType registered type of the child
 * @param input        child input
 * @param workflowId   explicit child workflow id, or {@code null} to derive one from the parent
 * @param taskQueue    task queue of the child, or {@code null} for the parent's
 * @param runTimeout   run timeout of the child, or {@code null} for none
 */
public record ChildWorkflowSpec(
        String workflowType,
        Object input,
        String workflowId,
        String taskQueue,
        Duration runTimeout
) {
    public ChildWorkflowSpec {
        Objects.requireNonNull(workflowType, "workflowType");
    }

    public static ChildWorkflowSpec of(String workflowType, Object input) {
        return new ChildWorkflowSpec(workflowType, input, null, null, null);
    }

    public ChildWorkflowSpec withWorkflowId(String id) {
        return new ChildWorkflowSpec(workflowType, input, id, taskQueue, runTimeout);
    }

    public ChildWorkflowSpec withTaskQueue(String queue) {
        return new ChildWorkflowSpec(workflowType, input, workflowId, queue, runTimeout);
    }

    public ChildWorkflowSpec withRunTimeout(Duration timeout) {
        return new ChildWorkflowSpec(workflowType, input, workflowId, taskQueue, timeout);
    }
}

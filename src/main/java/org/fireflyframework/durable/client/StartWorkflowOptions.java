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

import java.time.Duration;

/**
 * Options of {@code startWorkflow}. Unset values fall back to the workflow
 * definition: a random workflowId, its default task queue and run timeout.
 */
public record StartWorkflowOptions(String workflowId, String taskQueue, Duration runTimeout) {

    public static StartWorkflowOptions defaults() {
        return new StartWorkflowOptions(null, null, null);
    }

    public static StartWorkflowOptions withId(String workflowId) {
        return new StartWorkflowOptions(workflowId, null, null);
    }

    public StartWorkflowOptions withWorkflowId(String id) {
        return new StartWorkflowOptions(id, taskQueue, runTimeout);
    }

    public StartWorkflowOptions withTaskQueue(String queue) {
        return new StartWorkflowOptions(workflowId, queue, runTimeout);
    }

    public StartWorkflowOptions withRunTimeout(Duration timeout) {
        return new StartWorkflowOptions(workflowId, taskQueue, timeout);
    }
}

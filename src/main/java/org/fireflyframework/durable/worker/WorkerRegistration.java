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


package org.fireflyframework.durable.worker;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * What a worker declared it can run, and where it polls.
 */
public record WorkerRegistration(
        String workerId,
        List<String> taskQueues,
        List<String> workflowTypes,
        List<String> activityTypes,
        Instant registeredAt
) {
    public WorkerRegistration {
        Objects.requireNonNull(workerId, "workerId");
        taskQueues = taskQueues != null ? List.copyOf(taskQueues) : List.of();
        workflowTypes = workflowTypes != null ? List.copyOf(workflowTypes) : List.of();
        activityTypes = activityTypes != null ? List.copyOf(activityTypes) : List.of();
    }
}

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


package org.fireflyframework.durable.workflow.registry;

import org.fireflyframework.durable.workflow.Workflow;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Registration of one workflow type under a stable name.
 *
 * @param workflowType      stable identifier clients start the workflow by
 * @param inputType         type the recorded input is converted to
 * @param factory           creates a fresh instance for every decision cycle
 * @param defaultTaskQueue  task queue used when the start request names none
 * @param defaultRunTimeout run timeout used when the start request names none, {@code null} for none
 * @param activityTypes     activity names the workflow schedules, validated when a worker registers it
 */
public record WorkflowDefinition<I, R>(
        String workflowType,
        Class<I> inputType,
        Supplier<? extends Workflow<I, R>> factory,
        String defaultTaskQueue,
        Duration defaultRunTimeout,
        Set<String> activityTypes
) {
    public static final String DEFAULT_TASK_QUEUE = "default";

    public WorkflowDefinition {
        Objects.requireNonNull(workflowType, "workflowType");
        Objects.requireNonNull(inputType, "inputType");
        Objects.requireNonNull(factory, "factory");
        if (workflowType.isBlank()) throw new IllegalArgumentException("workflowType must not be blank");
        defaultTaskQueue = defaultTaskQueue != null ? defaultTaskQueue : DEFAULT_TASK_QUEUE;
        activityTypes = activityTypes != null ? Set.copyOf(activityTypes) : Set.of();
    }

    public static <I, R> WorkflowDefinition<I, R> of(String workflowType, Class<I> inputType,
                                                     Supplier<? extends Workflow<I, R>> factory) {
        return new WorkflowDefinition<>(workflowType, inputType, factory, null, null, Set.of());
    }

    public WorkflowDefinition<I, R> withTaskQueue(String taskQueue) {
        return new WorkflowDefinition<>(workflowType, inputType, factory, taskQueue, defaultRunTimeout, activityTypes);
    }

    public WorkflowDefinition<I, R> withRunTimeout(Duration runTimeout) {
        return new WorkflowDefinition<>(workflowType, inputType, factory, defaultTaskQueue, runTimeout, activityTypes);
    }

    public WorkflowDefinition<I, R> withActivities(String... names) {
        return new WorkflowDefinition<>(workflowType, inputType, factory, defaultTaskQueue, defaultRunTimeout, Set.of(names));
    }

    public Workflow<I, R> newInstance() {
        return factory.get();
    }
}

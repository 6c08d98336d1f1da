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


package org.fireflyframework.durable.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fireflyframework.durable.core.model.RetryPolicy;
import org.fireflyframework.durable.core.model.RunKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One attempt of an activity, as leased to a worker through the task queue.
 *
 * <p>The activity id ({@code workflowId/runId/commandId}) is stable across
 * attempts; the task id adds the attempt number, so a completion report from
 * an attempt that already timed out never matches a newer attempt.
 */
public record ActivityTask(
        String workflowId,
        String runId,
        int commandId,
        String name,
        String taskQueue,
        Object input,
        RetryPolicy retryPolicy,
        int attempt,
        Instant scheduleTime,
        Duration startToCloseTimeout,
        Duration scheduleToStartTimeout,
        Instant leaseExpiry
) {
    public ActivityTask {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(taskQueue, "taskQueue");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(scheduleTime, "scheduleTime");
        Objects.requireNonNull(startToCloseTimeout, "startToCloseTimeout");
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
    }

    public static ActivityTask first(RunKey runKey, int commandId, String name, String taskQueue, Object input,
                                     RetryPolicy retryPolicy, Instant scheduleTime,
                                     Duration startToCloseTimeout, Duration scheduleToStartTimeout) {
        return new ActivityTask(runKey.workflowId(), runKey.runId(), commandId, name, taskQueue, input,
                retryPolicy, 1, scheduleTime, startToCloseTimeout, scheduleToStartTimeout, null);
    }

    public RunKey runKey() {
        return new RunKey(workflowId, runId);
    }

    @JsonProperty("activityId")
    public String activityId() {
        return workflowId + "/" + runId + "/" + commandId;
    }

    @JsonProperty("taskId")
    public String taskId() {
        return activityId() + "#" + attempt;
    }

    public ActivityTask nextAttempt(Instant scheduleTime) {
        return new ActivityTask(workflowId, runId, commandId, name, taskQueue, input, retryPolicy,
                attempt + 1, scheduleTime, startToCloseTimeout, scheduleToStartTimeout, null);
    }

    public ActivityTask withLease(Instant leaseExpiry) {
        return new ActivityTask(workflowId, runId, commandId, name, taskQueue, input, retryPolicy,
                attempt, scheduleTime, startToCloseTimeout, scheduleToStartTimeout, leaseExpiry);
    }
}

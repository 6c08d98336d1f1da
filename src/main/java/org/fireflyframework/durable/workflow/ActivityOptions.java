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

import org.fireflyframework.durable.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Per-call activity options. Unset values fall back to the activity's
 * registration and then to the engine defaults when the task is dispatched.
 */
public record ActivityOptions(
        String taskQueue,
        Duration startToCloseTimeout,
        Duration scheduleToStartTimeout,
        RetryPolicy retryPolicy
) {
    public static ActivityOptions defaults() {
        return new ActivityOptions(null, null, null, null);
    }

    public ActivityOptions withTaskQueue(String queue) {
        return new ActivityOptions(queue, startToCloseTimeout, scheduleToStartTimeout, retryPolicy);
    }

    public ActivityOptions withStartToCloseTimeout(Duration timeout) {
        return new ActivityOptions(taskQueue, timeout, scheduleToStartTimeout, retryPolicy);
    }

    public ActivityOptions withScheduleToStartTimeout(Duration timeout) {
        return new ActivityOptions(taskQueue, startToCloseTimeout, timeout, retryPolicy);
    }

    public ActivityOptions withRetryPolicy(RetryPolicy policy) {
        return new ActivityOptions(taskQueue, startToCloseTimeout, scheduleToStartTimeout, policy);
    }
}

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

import org.fireflyframework.durable.core.model.RunKey;

import java.time.Instant;

/**
 * What an activity implementation knows about the attempt it is running.
 */
public record ActivityContext(
        String taskId,
        String activityId,
        String activityName,
        RunKey runKey,
        int attempt,
        Instant deadline
) {
    public static ActivityContext of(ActivityTask task) {
        return new ActivityContext(task.taskId(), task.activityId(), task.name(), task.runKey(),
                task.attempt(), task.leaseExpiry());
    }

    public boolean isRetry() {
        return attempt > 1;
    }
}

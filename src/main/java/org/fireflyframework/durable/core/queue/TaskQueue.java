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


package org.fireflyframework.durable.core.queue;

import org.fireflyframework.durable.activity.ActivityTask;
import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * At-least-once distribution of activity tasks to workers, partitioned by
 * queue name. Polling leases a task instead of consuming it: a task that is
 * not completed before its lease expires is delivered again.
 */
public interface TaskQueue {

    /** Adds a task that becomes pollable at {@code visibleAt}. */
    Mono<Void> enqueue(ActivityTask task, Instant visibleAt);

    /**
     * Leases the oldest visible task of the queue until
     * {@code now + task.startToCloseTimeout()}.
     */
    Mono<Optional<ActivityTask>> poll(String queueName);

    /** Removes a delivered task; empty when it is unknown or was never delivered. */
    Mono<Optional<ActivityTask>> complete(String taskId);

    /** Removes the task when the predicate still holds for its current entry. */
    Mono<Optional<TaskQueueEntry>> removeIf(String taskId, Predicate<TaskQueueEntry> condition);

    /** Removes every task of a run and returns them. */
    Mono<List<ActivityTask>> removeRun(RunKey runKey);

    /** Whether any attempt of the activity is held by the queue. */
    Mono<Boolean> containsActivity(String activityId);

    Flux<TaskQueueEntry> snapshot();

    Mono<Long> size(String queueName);
}

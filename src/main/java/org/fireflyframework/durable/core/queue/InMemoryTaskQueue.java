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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Task queue held in memory. Polling is serialized on the queue so a visible
 * entry is leased by exactly one poller.
 */
public class InMemoryTaskQueue implements TaskQueue {

    private static final Comparator<TaskQueueEntry> DELIVERY_ORDER = Comparator
            .comparing(TaskQueueEntry::visibilityDeadline)
            .thenComparingLong(TaskQueueEntry::sequence);

    private final ConcurrentHashMap<String, TaskQueueEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTaskQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskQueue(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Mono<Void> enqueue(ActivityTask task, Instant visibleAt) {
        return Mono.fromRunnable(() -> entries.put(task.taskId(),
                new TaskQueueEntry(task, visibleAt, 0, sequence.incrementAndGet())));
    }

    @Override
    public Mono<Optional<ActivityTask>> poll(String queueName) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Instant now = clock.instant();
                Optional<TaskQueueEntry> next = entries.values().stream()
                        .filter(e -> e.task().taskQueue().equals(queueName))
                        .filter(e -> e.isVisible(now))
                        .min(DELIVERY_ORDER);
                if (next.isEmpty()) {
                    return Optional.<ActivityTask>empty();
                }
                TaskQueueEntry entry = next.get();
                Instant leaseExpiry = now.plus(entry.task().startToCloseTimeout());
                ActivityTask leased = entry.task().withLease(leaseExpiry);
                entries.put(leased.taskId(),
                        new TaskQueueEntry(leased, leaseExpiry, entry.deliveries() + 1, entry.sequence()));
                return Optional.of(leased);
            }
        });
    }

    @Override
    public Mono<Optional<ActivityTask>> complete(String taskId) {
        return removeIf(taskId, entry -> entry.deliveries() > 0)
                .map(entry -> entry.map(TaskQueueEntry::task));
    }

    @Override
    public Mono<Optional<TaskQueueEntry>> removeIf(String taskId, Predicate<TaskQueueEntry> condition) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                TaskQueueEntry entry = entries.get(taskId);
                if (entry == null || !condition.test(entry)) {
                    return Optional.<TaskQueueEntry>empty();
                }
                entries.remove(taskId);
                return Optional.of(entry);
            }
        });
    }

    @Override
    public Mono<List<ActivityTask>> removeRun(RunKey runKey) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                List<ActivityTask> removed = new ArrayList<>();
                var it = entries.values().iterator();
                while (it.hasNext()) {
                    ActivityTask task = it.next().task();
                    if (task.workflowId().equals(runKey.workflowId()) && task.runId().equals(runKey.runId())) {
                        it.remove();
                        removed.add(task);
                    }
                }
                return removed;
            }
        });
    }

    @Override
    public Mono<Boolean> containsActivity(String activityId) {
        return Mono.fromCallable(() -> entries.values().stream()
                .anyMatch(e -> e.task().activityId().equals(activityId)));
    }

    @Override
    public Flux<TaskQueueEntry> snapshot() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(entries.values())));
    }

    @Override
    public Mono<Long> size(String queueName) {
        return Mono.fromCallable(() -> entries.values().stream()
                .filter(e -> e.task().taskQueue().equals(queueName))
                .count());
    }

    // Test helpers
    public int size() { return entries.size(); }
    public void clear() { entries.clear(); }
}

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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.history.RunEventSink;
import org.fireflyframework.durable.core.model.RetryPolicy;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.queue.TaskQueue;
import org.fireflyframework.durable.core.queue.TaskQueueEntry;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns scheduled activities into leased tasks and owns them until their
 * outcome is final.
 *
 * <p>Completion reports become {@code ActivityCompleted}. Failure reports and
 * expired deadlines consult the task's {@link RetryPolicy}: while attempts
 * remain and the error is retryable, the next attempt is enqueued after
 * {@code min(initial * coefficient^(attempt - 1), max)}; otherwise
 * {@code ActivityFailed} or {@code ActivityTimedOut} is handed to the run.
 */
@Slf4j
public class ActivityScheduler {

    public static final String UNREGISTERED_ACTIVITY = "UnregisteredActivity";

    private final TaskQueue taskQueue;
    private final ActivityRegistry registry;
    private final RunEventSink sink;
    private final PayloadConverter converter;
    private final DurableEvents events;
    private final Clock clock;
    private final Duration defaultStartToCloseTimeout;
    private final RetryPolicy defaultRetryPolicy;

    public ActivityScheduler(TaskQueue taskQueue, ActivityRegistry registry, RunEventSink sink,
                             PayloadConverter converter, DurableEvents events, Clock clock,
                             Duration defaultStartToCloseTimeout, RetryPolicy defaultRetryPolicy) {
        this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.converter = converter;
        this.events = events;
        this.clock = clock;
        this.defaultStartToCloseTimeout = defaultStartToCloseTimeout;
        this.defaultRetryPolicy = defaultRetryPolicy;
    }

    /**
     * Builds the first attempt of an activity, filling options the workflow
     * left unset from the activity's registration and then the engine defaults.
     */
    public ActivityTask newTask(RunKey runKey, int commandId, String name, Object input, String taskQueueName,
                                Duration startToClose, Duration scheduleToStart, RetryPolicy retryPolicy) {
        Optional<ActivityDefinition<?, ?>> def = registry.get(name);
        Duration stc = firstNonNull(startToClose,
                def.map(ActivityDefinition::startToCloseTimeout).orElse(null), defaultStartToCloseTimeout);
        Duration sts = scheduleToStart != null ? scheduleToStart
                : def.map(ActivityDefinition::scheduleToStartTimeout).orElse(null);
        RetryPolicy policy = firstNonNull(retryPolicy,
                def.map(ActivityDefinition::retryPolicy).orElse(null), defaultRetryPolicy);
        return ActivityTask.first(runKey, commandId, name, taskQueueName, input, policy, clock.instant(), stc, sts);
    }

    public Mono<Void> schedule(ActivityTask task) {
        if (!registry.hasActivity(task.name())) {
            log.error("[activity] Activity '{}' scheduled by {} is not registered", task.name(), task.runKey());
            Failure failure = new Failure(UNREGISTERED_ACTIVITY,
                    "Activity type '" + task.name() + "' is not registered", true);
            events.onActivityFailed(task.name(), task.runKey(), task.attempt(), failure.type());
            return sink.deliver(task.runKey(), HistoryEvents.activityFailed(task.commandId(), failure, task.attempt()));
        }
        return taskQueue.enqueue(task, task.scheduleTime())
                .doOnSuccess(v -> events.onActivityScheduled(task.name(), task.runKey(), task.commandId()));
    }

    /**
     * Re-enqueues an outstanding activity when no attempt of it is held by the queue.
     */
    public Mono<Boolean> ensureScheduled(ActivityTask task) {
        return taskQueue.containsActivity(task.activityId())
                .flatMap(present -> {
                    if (present) return Mono.just(false);
                    log.info("[activity] Re-dispatching outstanding activity '{}' of {}", task.name(), task.runKey());
                    return schedule(task).thenReturn(true);
                });
    }

    /**
     * Accepts a completion report. Emits {@code false} when the task is no
     * longer owned by the queue (it timed out or was already reported).
     */
    public Mono<Boolean> complete(String taskId, Object result) {
        return taskQueue.complete(taskId).flatMap(leased -> {
            if (leased.isEmpty()) {
                log.warn("[activity] Ignoring completion of unknown or expired task {}", taskId);
                return Mono.just(false);
            }
            ActivityTask task = leased.get();
            events.onActivityCompleted(task.name(), task.runKey(), task.attempt(), latencyMs(task));
            return sink.deliver(task.runKey(),
                            HistoryEvents.activityCompleted(task.commandId(), converter.toPayload(result), task.attempt()))
                    .thenReturn(true);
        });
    }

    /**
     * Accepts a failure report and applies the retry decision.
     */
    public Mono<Boolean> fail(String taskId, Throwable error, boolean retryable) {
        return fail(taskId, Failure.from(error), retryable);
    }

    /** Failure report of a worker that only knows the error's type and message. */
    public Mono<Boolean> fail(String taskId, Failure reported, boolean retryable) {
        return taskQueue.complete(taskId).flatMap(leased -> {
            if (leased.isEmpty()) {
                log.warn("[activity] Ignoring failure of unknown or expired task {}", taskId);
                return Mono.just(false);
            }
            Failure failure = new Failure(reported.type(), reported.message(), reported.nonRetryable() || !retryable);
            return onAttemptFailed(leased.get(), failure, null).thenReturn(true);
        });
    }

    /**
     * Reclaims tasks whose schedule-to-start or start-to-close deadline has
     * passed and treats each as a failed attempt. Emits how many were reclaimed.
     */
    public Mono<Integer> enforceTimeouts() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return taskQueue.snapshot()
                    .filter(entry -> timeoutType(entry, now) != null)
                    .concatMap(entry -> taskQueue.removeIf(entry.task().taskId(),
                                    current -> current.deliveries() == entry.deliveries()
                                            && current.visibilityDeadline().equals(entry.visibilityDeadline()))
                            .flatMap(removed -> {
                                if (removed.isEmpty()) return Mono.just(0);
                                String timeoutType = timeoutType(entry, now);
                                ActivityTask task = entry.task();
                                Failure failure = Failure.of(timeoutType,
                                        "Activity '" + task.name() + "' exceeded its " + timeoutType + " timeout");
                                return onAttemptFailed(task, failure, timeoutType).thenReturn(1);
                            }))
                    .reduce(0, Integer::sum);
        });
    }

    /** Best-effort removal of every queued or leased task of a run. */
    public Mono<Integer> cancelRun(RunKey runKey) {
        return taskQueue.removeRun(runKey)
                .map(removed -> {
                    if (!removed.isEmpty()) {
                        log.info("[activity] Cancelled {} outstanding task(s) of {}", removed.size(), runKey);
                    }
                    return removed.size();
                });
    }

    private Mono<Void> onAttemptFailed(ActivityTask task, Failure failure, String timeoutType) {
        RetryPolicy policy = task.retryPolicy();
        RunKey runKey = task.runKey();
        if (timeoutType != null) {
            events.onActivityTimedOut(task.name(), runKey, task.attempt(), timeoutType);
        }
        boolean retry = !failure.nonRetryable()
                && !policy.isNonRetryable(failure.type())
                && policy.shouldRetry(task.attempt());
        if (retry) {
            Duration delay = policy.calculateDelay(task.attempt());
            Instant visibleAt = clock.instant().plus(delay);
            events.onActivityRetryScheduled(task.name(), runKey, task.attempt(), delay, failure.type());
            return taskQueue.enqueue(task.nextAttempt(visibleAt), visibleAt);
        }
        if (timeoutType != null) {
            return sink.deliver(runKey, HistoryEvents.activityTimedOut(task.commandId(), timeoutType, task.attempt()));
        }
        events.onActivityFailed(task.name(), runKey, task.attempt(), failure.type());
        return sink.deliver(runKey, HistoryEvents.activityFailed(task.commandId(), failure, task.attempt()));
    }

    private static String timeoutType(TaskQueueEntry entry, Instant now) {
        if (entry.isLeaseExpired(now)) {
            return HistoryEvents.START_TO_CLOSE;
        }
        Duration scheduleToStart = entry.task().scheduleToStartTimeout();
        if (entry.deliveries() == 0 && scheduleToStart != null
                && !entry.task().scheduleTime().plus(scheduleToStart).isAfter(now)) {
            return HistoryEvents.SCHEDULE_TO_START;
        }
        return null;
    }

    private long latencyMs(ActivityTask task) {
        if (task.leaseExpiry() == null) return 0;
        Instant started = task.leaseExpiry().minus(task.startToCloseTimeout());
        return Math.max(0, Duration.between(started, clock.instant()).toMillis());
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) return value;
        }
        return null;
    }
}

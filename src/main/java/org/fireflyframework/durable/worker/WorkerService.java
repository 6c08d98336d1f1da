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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.activity.ActivityRegistry;
import org.fireflyframework.durable.activity.ActivityScheduler;
import org.fireflyframework.durable.activity.ActivityTask;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.queue.TaskQueue;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Worker-facing protocol: register, poll, complete and fail. Registration is
 * validated eagerly so a worker that names an unknown workflow or activity
 * type is rejected before it polls anything.
 */
@Slf4j
public class WorkerService {

    private final WorkflowRegistry workflowRegistry;
    private final ActivityRegistry activityRegistry;
    private final TaskQueue taskQueue;
    private final ActivityScheduler activityScheduler;
    private final Clock clock;
    private final Duration pollInterval;
    private final Map<String, WorkerRegistration> workers = new ConcurrentHashMap<>();

    public WorkerService(WorkflowRegistry workflowRegistry, ActivityRegistry activityRegistry, TaskQueue taskQueue,
                         ActivityScheduler activityScheduler, Clock clock, Duration pollInterval) {
        this.workflowRegistry = workflowRegistry;
        this.activityRegistry = activityRegistry;
        this.taskQueue = taskQueue;
        this.activityScheduler = activityScheduler;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    /**
     * Registers a worker. Fails with {@link UnregisteredTypeException} when a
     * listed workflow type, a listed activity type, or an activity a listed
     * workflow declares is not registered.
     */
    public Mono<WorkerRegistration> register(String workerId, List<String> taskQueues,
                                             List<String> workflowTypes, List<String> activityTypes) {
        return Mono.fromCallable(() -> {
            WorkerRegistration registration = new WorkerRegistration(workerId, taskQueues, workflowTypes,
                    activityTypes, clock.instant());
            for (String workflowType : registration.workflowTypes()) {
                WorkflowDefinition<?, ?> definition = workflowRegistry.getWorkflow(workflowType);
                for (String activity : definition.activityTypes()) {
                    if (!activityRegistry.hasActivity(activity)) {
                        throw new UnregisteredTypeException("activity", activity);
                    }
                }
            }
            for (String activityType : registration.activityTypes()) {
                activityRegistry.getActivity(activityType);
            }
            workers.put(workerId, registration);
            log.info("[worker] Registered worker '{}' on queues {} ({} workflow type(s), {} activity type(s))",
                    workerId, registration.taskQueues(), registration.workflowTypes().size(),
                    registration.activityTypes().size());
            return registration;
        });
    }

    public Mono<Void> unregister(String workerId) {
        return Mono.fromRunnable(() -> {
            if (workers.remove(workerId) != null) {
                log.info("[worker] Unregistered worker '{}'", workerId);
            }
        });
    }

    public Collection<WorkerRegistration> getWorkers() {
        return List.copyOf(workers.values());
    }

    public Optional<WorkerRegistration> getWorker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    /** Leases the next visible task of a queue, or emits an empty Optional when there is none. */
    public Mono<Optional<ActivityTask>> poll(String queueName) {
        return taskQueue.poll(queueName)
                .doOnNext(task -> task.ifPresent(t -> log.debug("[worker] Leased {} from '{}'", t.taskId(), queueName)));
    }

    /**
     * Long poll: keeps polling until a task is leased or {@code maxWait}
     * elapses, then emits an empty Optional.
     */
    public Mono<Optional<ActivityTask>> poll(String queueName, Duration maxWait) {
        return Flux.interval(Duration.ZERO, pollInterval)
                .concatMap(tick -> poll(queueName))
                .filter(Optional::isPresent)
                .next()
                .timeout(maxWait, Mono.just(Optional.empty()));
    }

    /** Emits {@code false} when the task's lease was already reclaimed. */
    public Mono<Boolean> complete(String taskId, Object result) {
        return activityScheduler.complete(taskId, result);
    }

    public Mono<Boolean> fail(String taskId, Throwable error, boolean retryable) {
        return activityScheduler.fail(taskId, error, retryable);
    }

    public Mono<Boolean> fail(String taskId, String errorType, String message, boolean retryable) {
        return activityScheduler.fail(taskId, new Failure(errorType, message, !retryable), retryable);
    }
}

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
import org.fireflyframework.durable.activity.ActivityContext;
import org.fireflyframework.durable.activity.ActivityDefinition;
import org.fireflyframework.durable.activity.ActivityRegistry;
import org.fireflyframework.durable.activity.ActivityTask;
import org.fireflyframework.durable.core.exception.ActivityTimeoutException;
import org.fireflyframework.durable.core.exception.NonRetryableActivityException;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.observability.DurableTracer;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker that polls task queues and runs the registered activity
 * handlers, at most {@code maxConcurrency} attempts at a time.
 *
 * <p>Errors are classified for the retry decision:
 * {@link NonRetryableActivityException} is final, an attempt that exceeds its
 * start-to-close timeout and any other error are retryable. Error types listed
 * in the task's retry policy are made final by the scheduler.
 */
@Slf4j
public class ActivityWorker {

    private final String workerId;
    private final WorkerService workerService;
    private final ActivityRegistry registry;
    private final PayloadConverter converter;
    private final DurableTracer tracer;
    private final List<String> taskQueues;
    private final int maxConcurrency;
    private final Duration pollInterval;
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile Disposable.Composite loops;

    public ActivityWorker(String workerId, WorkerService workerService, ActivityRegistry registry,
                          PayloadConverter converter, DurableTracer tracer, List<String> taskQueues,
                          int maxConcurrency, Duration pollInterval) {
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
        this.workerId = workerId;
        this.workerService = workerService;
        this.registry = registry;
        this.converter = converter;
        this.tracer = tracer;
        this.taskQueues = List.copyOf(taskQueues);
        this.maxConcurrency = maxConcurrency;
        this.pollInterval = pollInterval;
    }

    /** Registers with the worker service and starts one polling loop per queue. */
    public synchronized Mono<WorkerRegistration> start() {
        if (loops != null) return Mono.error(new IllegalStateException("Worker '" + workerId + "' already started"));
        List<String> activities = registry.getAll().stream().map(ActivityDefinition::name).toList();
        return workerService.register(workerId, taskQueues, List.of(), activities)
                .doOnSuccess(registration -> {
                    Disposable.Composite started = Disposables.composite();
                    for (String queue : taskQueues) {
                        started.add(Flux.interval(Duration.ZERO, pollInterval)
                                .onBackpressureDrop()
                                .concatMap(tick -> pollAvailable(queue), 1)
                                .subscribe(null, error -> log.error("[worker] Polling loop of '{}' on '{}' stopped: {}",
                                        workerId, queue, error.getMessage(), error)));
                    }
                    loops = started;
                    log.info("[worker] Worker '{}' polling {} with concurrency {}", workerId, taskQueues, maxConcurrency);
                });
    }

    public synchronized Mono<Void> stop() {
        Disposable.Composite current = loops;
        loops = null;
        if (current != null) current.dispose();
        return workerService.unregister(workerId);
    }

    public boolean isRunning() {
        return loops != null && !loops.isDisposed();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /** Leases tasks while capacity remains and the queue yields them. */
    private Mono<Void> pollAvailable(String queue) {
        if (inFlight.get() >= maxConcurrency) return Mono.empty();
        return workerService.poll(queue)
                .flatMap(next -> {
                    if (next.isEmpty()) return Mono.<Void>empty();
                    inFlight.incrementAndGet();
                    run(next.get())
                            .doFinally(signal -> inFlight.decrementAndGet())
                            .subscribe(null, error -> log.error("[worker] Reporting outcome of {} failed: {}",
                                    next.get().taskId(), error.getMessage(), error));
                    return pollAvailable(queue);
                })
                .onErrorResume(error -> {
                    log.warn("[worker] Polling '{}' failed: {}", queue, error.getMessage());
                    return Mono.empty();
                });
    }

    @SuppressWarnings("unchecked")
    Mono<Boolean> run(ActivityTask task) {
        Optional<ActivityDefinition<?, ?>> found = registry.get(task.name());
        if (found.isEmpty()) {
            return workerService.fail(task.taskId(), new NonRetryableActivityException("UnregisteredActivity",
                    "Worker '" + workerId + "' has no handler for activity '" + task.name() + "'"), false);
        }
        ActivityDefinition<Object, Object> definition = (ActivityDefinition<Object, Object>) found.get();
        ActivityContext context = ActivityContext.of(task);
        Mono<Object> attempt = Mono.defer(() -> definition.handler()
                        .execute(converter.fromPayload(task.input(), definition.inputType()), context))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(task.startToCloseTimeout());
        if (tracer != null) {
            attempt = tracer.traceActivity(task.name(), task.runKey(), task.attempt(), attempt);
        }
        return attempt
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(result -> workerService.complete(task.taskId(), result.orElse(null)))
                .onErrorResume(error -> {
                    Throwable reported = error instanceof TimeoutException
                            ? new ActivityTimeoutException(task.name(), HistoryEvents.START_TO_CLOSE, task.startToCloseTimeout())
                            : error;
                    boolean retryable = !(reported instanceof NonRetryableActivityException);
                    log.warn("[worker] Activity '{}' attempt {} of {} failed ({}): {}", task.name(), task.attempt(),
                            task.runKey(), retryable ? "retryable" : "non-retryable", reported.getMessage());
                    return workerService.fail(task.taskId(), reported, retryable);
                });
    }
}

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


package org.fireflyframework.durable.worker.rest;

import org.fireflyframework.durable.activity.ActivityTask;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;
import org.fireflyframework.durable.worker.WorkerRegistration;
import org.fireflyframework.durable.worker.WorkerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Worker protocol over HTTP for out-of-process workers. Task ids contain
 * slashes, so reports carry them in the request body.
 */
@RestController
@RequestMapping("/api/durable/workers")
public class WorkerController {

    private final WorkerService workerService;

    public WorkerController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @PostMapping
    public Mono<WorkerRegistration> register(@RequestBody RegisterRequest request) {
        return workerService.register(request.workerId(), request.taskQueues(), request.workflowTypes(),
                        request.activityTypes())
                .onErrorMap(UnregisteredTypeException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e));
    }

    @GetMapping
    public Flux<WorkerRegistration> listWorkers() {
        return Flux.fromIterable(workerService.getWorkers());
    }

    @DeleteMapping("/{workerId}")
    public Mono<Void> unregister(@PathVariable String workerId) {
        return workerService.unregister(workerId);
    }

    /** Leases the next task; answers 204 when none became visible within {@code waitMs}. */
    @PostMapping("/queues/{taskQueue}/poll")
    public Mono<ResponseEntity<ActivityTask>> poll(@PathVariable String taskQueue,
                                                   @RequestParam(defaultValue = "0") long waitMs) {
        Mono<Optional<ActivityTask>> polled = waitMs > 0
                ? workerService.poll(taskQueue, Duration.ofMillis(waitMs))
                : workerService.poll(taskQueue);
        return polled.map(task -> task.map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @PostMapping("/tasks/complete")
    public Mono<ReportResponse> complete(@RequestBody CompleteRequest request) {
        return workerService.complete(request.taskId(), request.result())
                .map(accepted -> new ReportResponse(request.taskId(), accepted));
    }

    @PostMapping("/tasks/fail")
    public Mono<ReportResponse> fail(@RequestBody FailRequest request) {
        String errorType = request.errorType() != null ? request.errorType() : "ActivityError";
        return workerService.fail(request.taskId(), errorType, request.message(), request.retryable())
                .map(accepted -> new ReportResponse(request.taskId(), accepted));
    }

    // ── DTOs ──────────────────────────────────────────────────────

    public record RegisterRequest(String workerId, List<String> taskQueues,
                                  List<String> workflowTypes, List<String> activityTypes) {}

    public record CompleteRequest(String taskId, Object result) {}

    public record FailRequest(String taskId, String errorType, String message, boolean retryable) {}

    /** {@code accepted} is false when the task's lease had already been reclaimed. */
    public record ReportResponse(String taskId, boolean accepted) {}
}

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


package org.fireflyframework.durable.workflow.rest;

import org.fireflyframework.durable.client.StartWorkflowOptions;
import org.fireflyframework.durable.client.WorkflowClient;
import org.fireflyframework.durable.client.WorkflowHandle;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;
import org.fireflyframework.durable.core.exception.WorkflowAlreadyStartedException;
import org.fireflyframework.durable.core.exception.WorkflowCancelledException;
import org.fireflyframework.durable.core.exception.WorkflowFailedException;
import org.fireflyframework.durable.core.exception.WorkflowNotFoundException;
import org.fireflyframework.durable.core.exception.WorkflowTimedOutException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.model.RunStatus;
import org.fireflyframework.durable.workflow.query.WorkflowSnapshot;
import org.fireflyframework.durable.workflow.search.WorkflowFilter;
import org.fireflyframework.durable.workflow.search.WorkflowSummary;
import org.fireflyframework.durable.workflow.signal.SignalResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * REST API over {@link WorkflowClient}: start, list, describe, await result,
 * signal, query, cancel and read history. Every per-workflow endpoint takes
 * an optional {@code runId}; without it the workflowId's current run is used.
 */
@RestController
@RequestMapping("/api/durable/workflows")
public class WorkflowController {

    private final WorkflowClient client;

    public WorkflowController(WorkflowClient client) {
        this.client = client;
    }

    // ── Lifecycle Endpoints ───────────────────────────────────────

    @PostMapping("/{workflowType}/start")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<WorkflowHandle> startWorkflow(@PathVariable String workflowType,
                                              @RequestBody(required = false) StartRequest request) {
        StartRequest req = request != null ? request : new StartRequest(null, null, null, null);
        StartWorkflowOptions options = new StartWorkflowOptions(req.workflowId(), req.taskQueue(),
                req.runTimeoutMs() != null ? Duration.ofMillis(req.runTimeoutMs()) : null);
        return client.startWorkflow(workflowType, req.input(), options).onErrorMap(WorkflowController::toHttp);
    }

    @PostMapping("/{workflowId}/cancel")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<Void> cancelWorkflow(@PathVariable String workflowId,
                                     @RequestParam(required = false) String runId,
                                     @RequestParam(required = false) String reason) {
        WorkflowHandle handle = new WorkflowHandle(workflowId, runId);
        return (reason != null ? client.cancel(handle, reason) : client.cancel(handle))
                .onErrorMap(WorkflowController::toHttp);
    }

    @PostMapping("/{workflowId}/signals/{signalName}")
    public Mono<SignalResult> signal(@PathVariable String workflowId, @PathVariable String signalName,
                                     @RequestParam(required = false) String runId,
                                     @RequestBody(required = false) Object payload) {
        return client.signal(new WorkflowHandle(workflowId, runId), signalName, payload)
                .onErrorMap(WorkflowController::toHttp);
    }

    /**
     * Waits up to {@code timeoutMs} for the run to close. A run still open
     * when the wait ends is reported with status {@code RUNNING}.
     */
    @GetMapping("/{workflowId}/result")
    public Mono<ResultResponse> getResult(@PathVariable String workflowId,
                                          @RequestParam(required = false) String runId,
                                          @RequestParam(defaultValue = "30000") long timeoutMs) {
        return client.getResult(new WorkflowHandle(workflowId, runId), Object.class, Duration.ofMillis(timeoutMs))
                .map(result -> new ResultResponse(workflowId, RunStatus.COMPLETED, result, null, null))
                .defaultIfEmpty(new ResultResponse(workflowId, RunStatus.COMPLETED, null, null, null))
                .onErrorResume(WorkflowFailedException.class, e -> Mono.just(
                        new ResultResponse(workflowId, RunStatus.FAILED, null, e.getErrorType(), e.getMessage())))
                .onErrorResume(WorkflowCancelledException.class, e -> Mono.just(
                        new ResultResponse(workflowId, RunStatus.CANCELLED, null, null, e.getMessage())))
                .onErrorResume(WorkflowTimedOutException.class, e -> Mono.just(
                        new ResultResponse(workflowId, RunStatus.TIMED_OUT, null, null, e.getMessage())))
                .onErrorResume(TimeoutException.class, e -> Mono.just(
                        new ResultResponse(workflowId, RunStatus.RUNNING, null, null, null)))
                .onErrorMap(WorkflowController::toHttp);
    }

    // ── Instance Query Endpoints ──────────────────────────────────

    @GetMapping
    public Flux<WorkflowSummary> listWorkflows(@RequestParam(required = false) String workflowType,
                                               @RequestParam(required = false) RunStatus status,
                                               @RequestParam(required = false) Instant startedAfter,
                                               @RequestParam(required = false) Instant startedBefore,
                                               @RequestParam(defaultValue = "100") int limit) {
        WorkflowFilter filter = WorkflowFilter.all()
                .withWorkflowType(workflowType)
                .withStatus(status)
                .withStartWindow(startedAfter, startedBefore)
                .withLimit(limit);
        return client.listWorkflows(filter);
    }

    @GetMapping("/{workflowId}")
    public Mono<WorkflowSummary> describe(@PathVariable String workflowId,
                                          @RequestParam(required = false) String runId) {
        return client.describe(new WorkflowHandle(workflowId, runId)).onErrorMap(WorkflowController::toHttp);
    }

    @GetMapping("/{workflowId}/snapshot")
    public Mono<WorkflowSnapshot> snapshot(@PathVariable String workflowId,
                                           @RequestParam(required = false) String runId) {
        return client.query(new WorkflowHandle(workflowId, runId)).onErrorMap(WorkflowController::toHttp);
    }

    @GetMapping("/{workflowId}/queries/{queryName}")
    public Mono<Object> query(@PathVariable String workflowId, @PathVariable String queryName,
                              @RequestParam(required = false) String runId) {
        return client.query(new WorkflowHandle(workflowId, runId), queryName, Object.class)
                .onErrorMap(WorkflowController::toHttp);
    }

    @GetMapping("/{workflowId}/history")
    public Flux<HistoryEvent> history(@PathVariable String workflowId,
                                      @RequestParam(required = false) String runId) {
        return client.history(new WorkflowHandle(workflowId, runId)).onErrorMap(WorkflowController::toHttp);
    }

    // ── DTOs ──────────────────────────────────────────────────────

    public record StartRequest(String workflowId, Object input, String taskQueue, Long runTimeoutMs) {}

    public record ResultResponse(String workflowId, RunStatus status, Object result,
                                 String errorType, String errorMessage) {}

    static Throwable toHttp(Throwable error) {
        if (error instanceof WorkflowNotFoundException) {
            return new ResponseStatusException(HttpStatus.NOT_FOUND, error.getMessage(), error);
        }
        if (error instanceof WorkflowAlreadyStartedException) {
            return new ResponseStatusException(HttpStatus.CONFLICT, error.getMessage(), error);
        }
        if (error instanceof UnregisteredTypeException || error instanceof IllegalArgumentException) {
            return new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage(), error);
        }
        return error;
    }
}

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


package org.fireflyframework.durable.client;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.exception.WorkflowCancelledException;
import org.fireflyframework.durable.core.exception.WorkflowFailedException;
import org.fireflyframework.durable.core.exception.WorkflowNotFoundException;
import org.fireflyframework.durable.core.exception.WorkflowTimedOutException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.workflow.engine.HistoryIndex;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.fireflyframework.durable.workflow.query.WorkflowQueryService;
import org.fireflyframework.durable.workflow.query.WorkflowSnapshot;
import org.fireflyframework.durable.workflow.search.WorkflowFilter;
import org.fireflyframework.durable.workflow.search.WorkflowSearchService;
import org.fireflyframework.durable.workflow.search.WorkflowSummary;
import org.fireflyframework.durable.workflow.signal.SignalResult;
import org.fireflyframework.durable.workflow.signal.SignalService;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client-facing entry point: start, await, signal, query, list and cancel
 * workflow runs.
 */
@Slf4j
public class WorkflowClient {

    private final WorkflowEngine engine;
    private final SignalService signalService;
    private final WorkflowQueryService queryService;
    private final WorkflowSearchService searchService;
    private final PayloadConverter converter;
    private final DurableEvents events;

    public WorkflowClient(WorkflowEngine engine, SignalService signalService, WorkflowQueryService queryService,
                          WorkflowSearchService searchService, PayloadConverter converter, DurableEvents events) {
        this.engine = engine;
        this.signalService = signalService;
        this.queryService = queryService;
        this.searchService = searchService;
        this.converter = converter;
        this.events = events;
    }

    // ── Lifecycle ─────────────────────────────────────────────────

    public Mono<WorkflowHandle> startWorkflow(String workflowType, Object input, StartWorkflowOptions options) {
        StartWorkflowOptions opts = options != null ? options : StartWorkflowOptions.defaults();
        return engine.start(workflowType, opts.workflowId(), input, opts.taskQueue(), opts.runTimeout())
                .map(WorkflowHandle::of);
    }

    public Mono<WorkflowHandle> startWorkflow(String workflowType, Object input) {
        return startWorkflow(workflowType, input, StartWorkflowOptions.defaults());
    }

    /**
     * Waits for the run to close and returns its result. Follows
     * continue-as-new to the last run of the chain. Fails with
     * {@link WorkflowFailedException}, {@link WorkflowCancelledException} or
     * {@link WorkflowTimedOutException} for the other terminal states.
     */
    public <T> Mono<T> getResult(WorkflowHandle handle, Class<T> resultType) {
        return resolve(handle).flatMap(runKey -> awaitResult(runKey, resultType));
    }

    public <T> Mono<T> getResult(WorkflowHandle handle, Class<T> resultType, Duration timeout) {
        return getResult(handle, resultType).timeout(timeout);
    }

    private <T> Mono<T> awaitResult(RunKey runKey, Class<T> resultType) {
        return engine.awaitClose(runKey).flatMap(terminal -> {
            Mono<T> result = switch (terminal.type()) {
                case WORKFLOW_COMPLETED ->
                        Mono.justOrEmpty(converter.fromPayload(terminal.get(HistoryEvents.RESULT), resultType));
                case WORKFLOW_FAILED -> {
                    Failure failure = HistoryEvents.failure(terminal);
                    yield Mono.error(new WorkflowFailedException(runKey.workflowId(), failure.type(), failure.message()));
                }
                case WORKFLOW_CANCELLED -> Mono.error(new WorkflowCancelledException(runKey.workflowId()));
                case WORKFLOW_TIMED_OUT -> Mono.error(new WorkflowTimedOutException(runKey.workflowId()));
                case WORKFLOW_CONTINUED_AS_NEW -> {
                    RunKey successor = RunKey.of(runKey.workflowId(), terminal.getString(HistoryEvents.NEW_RUN_ID));
                    log.debug("[client] {} continued as {}, following", runKey, successor);
                    yield awaitResult(successor, resultType);
                }
                default -> Mono.error(new IllegalStateException("Unexpected terminal event " + terminal.type()));
            };
            return result;
        });
    }

    /**
     * Requests cancellation. The run observes it at its next decision cycle;
     * cancelling a closed run has no effect.
     */
    public Mono<Void> cancel(WorkflowHandle handle, String reason) {
        return resolve(handle).flatMap(runKey -> engine.history(runKey).flatMap(history -> {
            if (history.isEmpty()) return Mono.<Void>error(new WorkflowNotFoundException(runKey.toString()));
            HistoryIndex index = HistoryIndex.of(runKey, history);
            if (index.isClosed()) {
                log.info("[client] Ignoring cancellation of closed run {}", runKey);
                return Mono.<Void>empty();
            }
            events.onCancelRequested(index.workflowType(), runKey);
            return engine.deliver(runKey, HistoryEvents.cancelRequested(reason));
        }));
    }

    public Mono<Void> cancel(WorkflowHandle handle) {
        return cancel(handle, "Cancelled by client");
    }

    // ── Signals and queries ───────────────────────────────────────

    public Mono<SignalResult> signal(WorkflowHandle handle, String signalName, Object payload) {
        return resolve(handle).flatMap(runKey -> signalService.signal(runKey, signalName, payload));
    }

    public Mono<WorkflowSnapshot> query(WorkflowHandle handle) {
        return resolve(handle).flatMap(queryService::snapshot);
    }

    public <T> Mono<T> query(WorkflowHandle handle, String queryName, Class<T> resultType) {
        return resolve(handle)
                .flatMap(runKey -> queryService.query(runKey, queryName))
                .map(value -> converter.fromPayload(value, resultType));
    }

    // ── Inspection ────────────────────────────────────────────────

    public Flux<WorkflowSummary> listWorkflows(WorkflowFilter filter) {
        return searchService.list(filter);
    }

    public Mono<WorkflowSummary> describe(WorkflowHandle handle) {
        return resolve(handle).flatMap(searchService::summarize);
    }

    public Flux<HistoryEvent> history(WorkflowHandle handle) {
        return resolve(handle).flatMapMany(runKey -> engine.history(runKey).flatMapIterable(events -> events));
    }

    private Mono<RunKey> resolve(WorkflowHandle handle) {
        if (handle.hasRunId()) {
            return Mono.just(RunKey.of(handle.workflowId(), handle.runId()));
        }
        return engine.currentRun(handle.workflowId())
                .map(HistoryIndex::runKey)
                .switchIfEmpty(Mono.error(new WorkflowNotFoundException(handle.workflowId())));
    }
}

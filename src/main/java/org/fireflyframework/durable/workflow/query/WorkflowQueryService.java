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


package org.fireflyframework.durable.workflow.query;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.exception.DurableException;
import org.fireflyframework.durable.core.exception.WorkflowNotFoundException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;
import org.fireflyframework.durable.workflow.engine.HistoryIndex;
import org.fireflyframework.durable.workflow.engine.ReplayResult;
import org.fireflyframework.durable.workflow.engine.WorkflowExecutor;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Answers read-only questions about a run by replaying its history. Any
 * decisions the replay reaches are discarded.
 */
@Slf4j
public class WorkflowQueryService {

    private final EventLog eventLog;
    private final WorkflowRegistry registry;
    private final WorkflowExecutor executor;
    private final PayloadConverter converter;

    public WorkflowQueryService(EventLog eventLog, WorkflowRegistry registry, WorkflowExecutor executor,
                                PayloadConverter converter) {
        this.eventLog = eventLog;
        this.registry = registry;
        this.executor = executor;
        this.converter = converter;
    }

    public Mono<WorkflowSnapshot> snapshot(RunKey runKey) {
        return load(runKey).map(index -> {
            Optional<ReplayResult> replay = replay(runKey, index);
            HistoryEvent terminal = index.terminal();
            RunStatus status = index.status();
            return new WorkflowSnapshot(
                    runKey.workflowId(), runKey.runId(), index.workflowType(), status,
                    index.startTime(), index.closeTime(),
                    replay.map(ReplayResult::workflowTime).orElse(index.startTime()),
                    index.length(),
                    index.input(),
                    status == RunStatus.COMPLETED ? terminal.get(HistoryEvents.RESULT) : null,
                    status == RunStatus.FAILED ? HistoryEvents.failure(terminal) : null,
                    index.outstanding(EventType.ACTIVITY_SCHEDULED).stream()
                            .map(e -> e.getString(HistoryEvents.ACTIVITY_NAME)).toList(),
                    index.outstanding(EventType.TIMER_STARTED).size(),
                    index.outstanding(EventType.CHILD_WORKFLOW_STARTED).stream()
                            .map(e -> e.getString(HistoryEvents.CHILD_WORKFLOW_ID)).toList(),
                    index.signalCounts(),
                    replay.map(r -> Set.copyOf(r.queryHandlers().keySet())).orElse(Set.of()),
                    index.started().getString(HistoryEvents.PARENT_WORKFLOW_ID),
                    index.started().getString(HistoryEvents.PREVIOUS_RUN_ID),
                    status == RunStatus.CONTINUED_AS_NEW ? terminal.getString(HistoryEvents.NEW_RUN_ID) : null);
        });
    }

    /**
     * Invokes a handler the workflow registered with {@code registerQuery}.
     * The value is returned as a payload tree.
     */
    public Mono<Object> query(RunKey runKey, String queryName) {
        return load(runKey).flatMap(index -> {
            Optional<WorkflowDefinition<?, ?>> definition = registry.get(index.workflowType());
            if (definition.isEmpty()) {
                return Mono.error(new IllegalStateException(
                        "Workflow type '" + index.workflowType() + "' is not registered"));
            }
            ReplayResult replay = executor.replay(definition.get(), runKey, index.events());
            Supplier<?> handler = replay.queryHandlers().get(queryName);
            if (handler == null) {
                return Mono.error(new IllegalArgumentException(
                        "Workflow " + runKey + " has no query named '" + queryName + "'"));
            }
            return Mono.justOrEmpty(converter.toPayload(handler.get()));
        });
    }

    private Mono<HistoryIndex> load(RunKey runKey) {
        return eventLog.read(runKey).collectList()
                .publishOn(Schedulers.boundedElastic())
                .flatMap(history -> history.isEmpty()
                        ? Mono.error(new WorkflowNotFoundException(runKey.toString()))
                        : Mono.just(HistoryIndex.of(runKey, history)));
    }

    private Optional<ReplayResult> replay(RunKey runKey, HistoryIndex index) {
        Optional<WorkflowDefinition<?, ?>> definition = registry.get(index.workflowType());
        if (definition.isEmpty()) return Optional.empty();
        try {
            return Optional.of(executor.replay(definition.get(), runKey, index.events()));
        } catch (DurableException e) {
            log.warn("[query] Replay of {} for a snapshot failed: {}", runKey, e.getMessage());
            return Optional.empty();
        }
    }
}

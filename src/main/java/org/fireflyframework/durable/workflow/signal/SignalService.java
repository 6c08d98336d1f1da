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


package org.fireflyframework.durable.workflow.signal;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.exception.WorkflowNotFoundException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.history.RunEventSink;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import reactor.core.publisher.Mono;

/**
 * Delivers external signals to running workflows. The signal is recorded as
 * {@code SignalReceived} by the run's next decision cycle; workflow logic
 * consumes signals of one name in arrival order.
 */
@Slf4j
public class SignalService {

    private final EventLog eventLog;
    private final RunEventSink sink;
    private final PayloadConverter converter;
    private final DurableEvents events;

    public SignalService(EventLog eventLog, RunEventSink sink, PayloadConverter converter, DurableEvents events) {
        this.eventLog = eventLog;
        this.sink = sink;
        this.converter = converter;
        this.events = events;
    }

    /**
     * Sends a signal to a run. Fails with {@link WorkflowNotFoundException} when
     * the run does not exist; a closed run does not receive it.
     */
    public Mono<SignalResult> signal(RunKey runKey, String signalName, Object payload) {
        return eventLog.read(runKey).collectList()
                .flatMap(history -> {
                    if (history.isEmpty()) {
                        return Mono.error(new WorkflowNotFoundException(runKey.toString()));
                    }
                    if (history.stream().anyMatch(e -> e.type().isTerminal())) {
                        log.warn("[signal] Cannot signal closed run {}", runKey);
                        return Mono.just(SignalResult.notDelivered(runKey.workflowId(), runKey.runId(), signalName));
                    }
                    HistoryEvent started = history.get(0);
                    return sink.deliver(runKey, HistoryEvents.signalReceived(signalName, converter.toPayload(payload)))
                            .then(Mono.fromCallable(() -> {
                                log.info("[signal] Signal '{}' delivered to {}", signalName, runKey);
                                events.onSignalReceived(started.getString(HistoryEvents.WORKFLOW_TYPE), runKey, signalName);
                                return SignalResult.delivered(runKey.workflowId(), runKey.runId(), signalName);
                            }));
                });
    }
}

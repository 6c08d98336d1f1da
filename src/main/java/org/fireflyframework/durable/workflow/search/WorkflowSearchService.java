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


package org.fireflyframework.durable.workflow.search;

import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.workflow.engine.HistoryIndex;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lists runs straight from the event log. The returned sequence is cold: it
 * reads nothing until subscribed, stops reading once the limit is reached,
 * and every new subscription starts over from the current log contents.
 */
public class WorkflowSearchService {

    private final EventLog eventLog;

    public WorkflowSearchService(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    public Flux<WorkflowSummary> list(WorkflowFilter filter) {
        WorkflowFilter criteria = filter != null ? filter : WorkflowFilter.all();
        Flux<WorkflowSummary> matching = Flux.defer(() -> eventLog.runs()
                .filter(key -> criteria.workflowId() == null || criteria.workflowId().equals(key.workflowId()))
                .concatMap(this::summarize)
                .filter(criteria::matches));
        return criteria.limit() > 0 ? matching.take(criteria.limit()) : matching;
    }

    public Mono<WorkflowSummary> summarize(RunKey runKey) {
        return eventLog.read(runKey).collectList()
                .filter(history -> !history.isEmpty())
                .map(history -> {
                    HistoryIndex index = HistoryIndex.of(runKey, history);
                    return new WorkflowSummary(runKey.workflowId(), runKey.runId(), index.workflowType(),
                            index.status(), index.startTime(), index.closeTime());
                });
    }
}

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


package org.fireflyframework.durable.core.eventlog;

import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Durable, append-only history of workflow runs, partitioned by {@link RunKey}.
 *
 * <p>{@link #append} is atomic per batch: either every event of the batch is
 * recorded, contiguous with {@code expectedSeq}, or none is. Events are never
 * mutated or removed.
 */
public interface EventLog {

    /**
     * Appends a batch numbered {@code expectedSeq, expectedSeq + 1, ...}.
     * Errors with {@link EventLogConflictException} when {@code expectedSeq}
     * differs from the current log length.
     */
    Mono<Void> append(RunKey runKey, long expectedSeq, List<HistoryEvent> events);

    Flux<HistoryEvent> read(RunKey runKey, long fromSeq);

    default Flux<HistoryEvent> read(RunKey runKey) {
        return read(runKey, 0);
    }

    Mono<Long> length(RunKey runKey);

    /** Every run that has at least one event. */
    Flux<RunKey> runs();

    default Flux<RunKey> runs(String workflowId) {
        return runs().filter(key -> key.workflowId().equals(workflowId));
    }

    Mono<Boolean> isHealthy();

    /**
     * Verifies a batch is non-empty and numbered contiguously from {@code expectedSeq}.
     */
    static void checkBatch(RunKey runKey, long expectedSeq, List<HistoryEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Append to " + runKey + " requires at least one event");
        }
        for (int i = 0; i < events.size(); i++) {
            HistoryEvent event = events.get(i);
            if (event == null || event.seq() != expectedSeq + i) {
                throw new IllegalArgumentException("Event " + i + " of batch for " + runKey
                        + " is not numbered " + (expectedSeq + i));
            }
        }
    }
}

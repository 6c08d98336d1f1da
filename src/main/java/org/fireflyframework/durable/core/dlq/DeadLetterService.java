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


package org.fireflyframework.durable.core.dlq;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

@Slf4j
public class DeadLetterService {

    private final DeadLetterStore store;
    private final DurableEvents events;
    private final Clock clock;

    public DeadLetterService(DeadLetterStore store, DurableEvents events, Clock clock) {
        this.store = store;
        this.events = events;
        this.clock = clock;
    }

    /** Halts the run. A run that is already dead-lettered keeps its first entry. */
    public Mono<DeadLetterEntry> deadLetter(String workflowType, RunKey runKey, int commandId, Throwable error) {
        DeadLetterEntry candidate = DeadLetterEntry.of(workflowType, runKey, commandId, error, clock.instant());
        return store.putIfAbsent(candidate)
                .doOnNext(stored -> {
                    if (stored == candidate) {
                        events.onDeadLettered(workflowType, runKey, error);
                    } else {
                        log.debug("[dlq] {} already dead-lettered at command {}", runKey, stored.commandId());
                    }
                });
    }

    public Mono<Boolean> isDeadLettered(RunKey runKey) {
        return store.get(runKey).hasElement();
    }

    public Mono<DeadLetterEntry> getEntry(RunKey runKey) {
        return store.get(runKey);
    }

    public Flux<DeadLetterEntry> getAllEntries() {
        return store.entries();
    }

    public Flux<DeadLetterEntry> getByWorkflowType(String workflowType) {
        return store.entries().filter(e -> e.workflowType().equals(workflowType));
    }

    public Flux<DeadLetterEntry> getByWorkflowId(String workflowId) {
        return store.entries().filter(e -> e.workflowId().equals(workflowId));
    }

    public Mono<Long> count() {
        return store.size();
    }

    /**
     * Removes the run's entry so the run can be driven again.
     * Emits the entry stamped with the release time, or empty when there was none.
     */
    public Mono<DeadLetterEntry> release(RunKey runKey) {
        return store.remove(runKey)
                .map(entry -> entry.released(clock.instant()))
                .doOnNext(entry -> log.info("[dlq] Released {} (dead-lettered at {})", runKey, entry.createdAt()));
    }
}

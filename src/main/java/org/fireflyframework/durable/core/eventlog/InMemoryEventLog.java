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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event log held in memory. Each append swaps in a new immutable list, so
 * readers never observe a partially applied batch.
 */
public class InMemoryEventLog implements EventLog {

    private final ConcurrentHashMap<RunKey, List<HistoryEvent>> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> append(RunKey runKey, long expectedSeq, List<HistoryEvent> events) {
        return Mono.fromRunnable(() -> {
            EventLog.checkBatch(runKey, expectedSeq, events);
            store.compute(runKey, (key, existing) -> {
                List<HistoryEvent> current = existing != null ? existing : List.of();
                if (current.size() != expectedSeq) {
                    throw new EventLogConflictException(runKey, expectedSeq, current.size());
                }
                List<HistoryEvent> next = new ArrayList<>(current.size() + events.size());
                next.addAll(current);
                next.addAll(events);
                return List.copyOf(next);
            });
        });
    }

    @Override
    public Flux<HistoryEvent> read(RunKey runKey, long fromSeq) {
        return Flux.defer(() -> {
            List<HistoryEvent> events = store.getOrDefault(runKey, List.of());
            int from = (int) Math.min(Math.max(fromSeq, 0), events.size());
            return Flux.fromIterable(events.subList(from, events.size()));
        });
    }

    @Override
    public Mono<Long> length(RunKey runKey) {
        return Mono.fromCallable(() -> (long) store.getOrDefault(runKey, List.of()).size());
    }

    @Override
    public Flux<RunKey> runs() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.keySet())));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); }
}

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

import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final ConcurrentMap<RunKey, DeadLetterEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<DeadLetterEntry> putIfAbsent(DeadLetterEntry entry) {
        return Mono.fromCallable(() -> {
            DeadLetterEntry existing = entries.putIfAbsent(entry.runKey(), entry);
            return existing != null ? existing : entry;
        });
    }

    @Override
    public Mono<DeadLetterEntry> get(RunKey runKey) {
        return Mono.fromCallable(() -> entries.get(runKey));
    }

    @Override
    public Flux<DeadLetterEntry> entries() {
        return Flux.defer(() -> {
            List<DeadLetterEntry> snapshot = entries.values().stream()
                    .sorted(Comparator.comparing(DeadLetterEntry::createdAt))
                    .toList();
            return Flux.fromIterable(snapshot);
        });
    }

    @Override
    public Mono<DeadLetterEntry> remove(RunKey runKey) {
        return Mono.fromCallable(() -> entries.remove(runKey));
    }

    @Override
    public Mono<Long> size() {
        return Mono.fromCallable(() -> (long) entries.size());
    }
}

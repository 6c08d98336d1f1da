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


package org.fireflyframework.durable.core.inbox;

import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Inbox held in memory, shared by the engines of one JVM. Every change swaps
 * in a new immutable map, so readers iterate a stable snapshot.
 */
public class InMemoryRunInbox implements RunInbox {

    private final ConcurrentHashMap<RunKey, Map<String, InboxEntry>> inboxes = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> offer(RunKey runKey, InboxEntry entry) {
        return Mono.fromRunnable(() -> inboxes.compute(runKey, (key, current) -> {
            Map<String, InboxEntry> next = current != null ? new LinkedHashMap<>(current) : new LinkedHashMap<>();
            next.put(entry.id(), entry);
            return Collections.unmodifiableMap(next);
        }));
    }

    @Override
    public Flux<InboxEntry> pending(RunKey runKey) {
        return Flux.defer(() -> Flux.fromIterable(inboxes.getOrDefault(runKey, Map.of()).values()));
    }

    @Override
    public Mono<Boolean> hasPending(RunKey runKey) {
        return Mono.fromCallable(() -> inboxes.containsKey(runKey));
    }

    @Override
    public Mono<Void> acknowledge(RunKey runKey, Collection<String> entryIds) {
        if (entryIds.isEmpty()) return Mono.empty();
        return Mono.fromRunnable(() -> inboxes.computeIfPresent(runKey, (key, current) -> {
            Map<String, InboxEntry> next = new LinkedHashMap<>(current);
            next.keySet().removeAll(entryIds);
            return next.isEmpty() ? null : Collections.unmodifiableMap(next);
        }));
    }

    @Override
    public Mono<Integer> purge(RunKey runKey) {
        return Mono.fromCallable(() -> {
            Map<String, InboxEntry> removed = inboxes.remove(runKey);
            return removed != null ? removed.size() : 0;
        });
    }
}

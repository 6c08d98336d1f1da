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

/**
 * Holds the runs the engine refused to drive. A run has at most one entry;
 * while it exists neither the engine nor recovery touches the run.
 */
public interface DeadLetterStore {

    /** Records the entry unless the run is already dead-lettered. Emits the entry that is stored. */
    Mono<DeadLetterEntry> putIfAbsent(DeadLetterEntry entry);

    Mono<DeadLetterEntry> get(RunKey runKey);

    /** Entries, oldest first. */
    Flux<DeadLetterEntry> entries();

    /** Removes and emits the run's entry, or completes empty when there is none. */
    Mono<DeadLetterEntry> remove(RunKey runKey);

    Mono<Long> size();
}

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

/**
 * Events addressed to a run that its lock holder has not appended yet,
 * shared by every engine that can drive the run.
 *
 * <p>Any engine may {@link #offer} an entry. Only the lock holder reads the
 * pending entries, and it {@link #acknowledge acknowledges} them after the
 * batch containing them was appended, so an entry outlives a holder that
 * crashes in between.
 */
public interface RunInbox {

    Mono<Void> offer(RunKey runKey, InboxEntry entry);

    /** Unacknowledged entries of the run, in offer order. */
    Flux<InboxEntry> pending(RunKey runKey);

    Mono<Boolean> hasPending(RunKey runKey);

    Mono<Void> acknowledge(RunKey runKey, Collection<String> entryIds);

    /** Drops every entry of the run. Emits how many were dropped. */
    Mono<Integer> purge(RunKey runKey);
}

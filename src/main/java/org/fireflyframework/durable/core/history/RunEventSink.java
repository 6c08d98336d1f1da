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


package org.fireflyframework.durable.core.history;

import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Mono;

/**
 * Accepts events produced outside a run's decision cycle (activity outcomes,
 * timer fires, signals, child outcomes). Only the run's lock holder appends
 * them to history, as part of its next decision cycle.
 */
@FunctionalInterface
public interface RunEventSink {

    Mono<Void> deliver(RunKey runKey, PendingEvent event);
}

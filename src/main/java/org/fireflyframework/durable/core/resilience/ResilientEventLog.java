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


package org.fireflyframework.durable.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Guards an {@link EventLog} with a circuit breaker so an unavailable store
 * fails fast while the engine backs off. Append conflicts are expected
 * outcomes and are not recorded as breaker failures.
 */
public class ResilientEventLog implements EventLog {

    public static final String CIRCUIT_BREAKER_NAME = "durable.event-log";

    private final EventLog delegate;
    private final CircuitBreaker circuitBreaker;

    public ResilientEventLog(EventLog delegate, CircuitBreakerRegistry registry) {
        this.delegate = delegate;
        this.circuitBreaker = registry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    }

    @Override
    public Mono<Void> append(RunKey runKey, long expectedSeq, List<HistoryEvent> events) {
        return delegate.append(runKey, expectedSeq, events)
                .then(Mono.just(Optional.<EventLogConflictException>empty()))
                .onErrorResume(EventLogConflictException.class, e -> Mono.just(Optional.of(e)))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .flatMap(conflict -> conflict.isPresent() ? Mono.<Void>error(conflict.get()) : Mono.<Void>empty());
    }

    @Override
    public Flux<HistoryEvent> read(RunKey runKey, long fromSeq) {
        return delegate.read(runKey, fromSeq).transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    @Override
    public Mono<Long> length(RunKey runKey) {
        return delegate.length(runKey).transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    @Override
    public Flux<RunKey> runs() {
        return delegate.runs().transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return delegate.isHealthy()
                .map(healthy -> healthy && circuitBreaker.getState() != CircuitBreaker.State.OPEN);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void reset() {
        circuitBreaker.reset();
    }
}

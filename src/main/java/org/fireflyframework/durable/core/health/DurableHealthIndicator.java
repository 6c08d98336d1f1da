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


package org.fireflyframework.durable.core.health;

import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

public class DurableHealthIndicator implements ReactiveHealthIndicator {

    private final EventLog eventLog;
    private final WorkflowEngine engine;

    public DurableHealthIndicator(EventLog eventLog, WorkflowEngine engine) {
        this.eventLog = eventLog;
        this.engine = engine;
    }

    @Override
    public Mono<Health> health() {
        if (engine.isStopped()) {
            return Mono.just(Health.down().withDetail("reason", "Engine stopped").build());
        }
        return eventLog.isHealthy()
                .map(healthy -> (healthy ? Health.up() : Health.down().withDetail("reason", "Event log unhealthy"))
                        .withDetail("holderId", engine.holderId())
                        .withDetail("activeRuns", engine.activeRunCount())
                        .build())
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}

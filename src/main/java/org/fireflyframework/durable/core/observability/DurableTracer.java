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


package org.fireflyframework.durable.core.observability;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.fireflyframework.durable.core.model.RunKey;
import reactor.core.publisher.Mono;

public class DurableTracer {
    private final ObservationRegistry observationRegistry;

    public DurableTracer(ObservationRegistry observationRegistry) {
        this.observationRegistry = observationRegistry;
    }

    public <T> Mono<T> traceDecision(String workflowType, RunKey runKey, Mono<T> mono) {
        return Mono.defer(() -> {
            Observation observation = Observation.createNotStarted("durable.decision", observationRegistry)
                    .lowCardinalityKeyValue("durable.workflow.type", workflowType)
                    .highCardinalityKeyValue("durable.workflow.id", runKey.workflowId())
                    .highCardinalityKeyValue("durable.run.id", runKey.runId());
            return mono.doOnSubscribe(s -> observation.start())
                       .doOnTerminate(observation::stop)
                       .doOnError(observation::error);
        });
    }

    public <T> Mono<T> traceActivity(String activityName, RunKey runKey, int attempt, Mono<T> mono) {
        return Mono.defer(() -> {
            Observation observation = Observation.createNotStarted("durable.activity", observationRegistry)
                    .lowCardinalityKeyValue("durable.activity.name", activityName)
                    .highCardinalityKeyValue("durable.run", runKey.toString())
                    .highCardinalityKeyValue("durable.activity.attempt", String.valueOf(attempt));
            return mono.doOnSubscribe(s -> observation.start())
                       .doOnTerminate(observation::stop)
                       .doOnError(observation::error);
        });
    }
}

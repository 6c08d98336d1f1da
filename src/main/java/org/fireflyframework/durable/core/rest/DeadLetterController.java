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


package org.fireflyframework.durable.core.rest;

import org.fireflyframework.durable.core.dlq.DeadLetterEntry;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/durable/dlq")
public class DeadLetterController {

    private final DeadLetterService deadLetterService;
    private final WorkflowEngine engine;

    public DeadLetterController(DeadLetterService deadLetterService, WorkflowEngine engine) {
        this.deadLetterService = deadLetterService;
        this.engine = engine;
    }

    @GetMapping
    public Flux<DeadLetterEntry> listEntries(@RequestParam(required = false) String workflowType) {
        return workflowType != null
                ? deadLetterService.getByWorkflowType(workflowType)
                : deadLetterService.getAllEntries();
    }

    @GetMapping("/count")
    public Mono<Long> count() {
        return deadLetterService.count();
    }

    @GetMapping("/{workflowId}/{runId}")
    public Mono<DeadLetterEntry> getEntry(@PathVariable String workflowId, @PathVariable String runId) {
        RunKey runKey = RunKey.of(workflowId, runId);
        return deadLetterService.getEntry(runKey)
                .switchIfEmpty(Mono.error(notFound(runKey)));
    }

    /** Removes the entry and lets the halted run replay again, e.g. after a fixed workflow was deployed. */
    @PostMapping("/{workflowId}/{runId}/release")
    public Mono<DeadLetterEntry> release(@PathVariable String workflowId, @PathVariable String runId) {
        RunKey runKey = RunKey.of(workflowId, runId);
        return deadLetterService.release(runKey)
                .switchIfEmpty(Mono.error(notFound(runKey)))
                .flatMap(entry -> engine.resume(runKey).thenReturn(entry));
    }

    private static ResponseStatusException notFound(RunKey runKey) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "No dead-lettered run " + runKey);
    }
}

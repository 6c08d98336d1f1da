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


package org.fireflyframework.durable.core.recovery;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.lock.RunLockManager;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.scheduling.DurableScheduler;
import org.fireflyframework.durable.workflow.engine.HistoryIndex;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Finds running workflows that no process drives (their lock is free or
 * expired) and hands them to the local engine, which replays them from the
 * log and re-establishes outstanding timers, activities and children. Runs
 * that were dead-lettered stay halted until released.
 */
@Slf4j
public class RecoveryService {

    static final String RECOVERY_TASK = "durable-recovery-scan";

    private final EventLog eventLog;
    private final RunLockManager lockManager;
    private final WorkflowEngine engine;
    private final DeadLetterService deadLetters;

    public RecoveryService(EventLog eventLog, RunLockManager lockManager, WorkflowEngine engine,
                           DeadLetterService deadLetters) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.deadLetters = deadLetters;
    }

    /** Emits how many runs were handed to the engine. */
    public Mono<Long> recoverOrphanedRuns() {
        return eventLog.runs()
                .filter(key -> !WorkflowEngine.START_GUARD_RUN_ID.equals(key.runId()))
                .filter(key -> !engine.isDriving(key))
                .concatMap(this::recoverIfOrphaned)
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> {
                    if (count > 0) log.info("[recovery] Recovered {} orphaned run(s)", count);
                })
                .doOnError(err -> log.error("[recovery] Recovery scan failed", err));
    }

    /** Registers the periodic scan on the scheduler. */
    public void schedule(DurableScheduler scheduler, Duration interval) {
        scheduler.scheduleWithFixedDelay(RECOVERY_TASK,
                () -> recoverOrphanedRuns().onErrorResume(e -> Mono.empty()).block(),
                interval.toMillis(), interval.toMillis());
    }

    private Mono<Boolean> recoverIfOrphaned(RunKey key) {
        return eventLog.read(key).collectList()
                .filter(history -> !history.isEmpty())
                .map(history -> HistoryIndex.of(key, history))
                .filter(index -> !index.isClosed())
                .flatMap(index -> lockManager.current(key)
                        .filter(held -> held.isEmpty())
                        .flatMap(free -> deadLetters != null ? deadLetters.isDeadLettered(key) : Mono.just(false))
                        .filter(deadLettered -> !deadLettered)
                        .flatMap(orphaned -> engine.recover(key, index.workflowType())))
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("[recovery] Skipping {}: {}", key, e.getMessage());
                    return Mono.just(false);
                });
    }
}

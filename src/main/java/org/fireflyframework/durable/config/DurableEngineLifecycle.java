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


package org.fireflyframework.durable.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.recovery.RecoveryService;
import org.fireflyframework.durable.core.scheduling.DurableScheduler;
import org.fireflyframework.durable.worker.ActivityWorker;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.springframework.context.SmartLifecycle;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Starts the background parts of the engine once the context is refreshed:
 * the activity timeout sweep, the startup and periodic recovery scans and
 * the in-process worker. Stopping the context stops the worker and releases
 * every run lock the engine holds.
 */
@Slf4j
public class DurableEngineLifecycle implements SmartLifecycle {

    static final String TIMEOUT_SWEEP_TASK = "durable-activity-timeouts";
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final WorkflowEngine engine;
    private final DurableScheduler scheduler;
    private final RecoveryService recovery;
    private final ActivityWorker worker;
    private final Duration recoveryInterval;
    private final Duration timeoutSweepInterval;
    private volatile boolean running;

    public DurableEngineLifecycle(WorkflowEngine engine, DurableScheduler scheduler, RecoveryService recovery,
                                  ActivityWorker worker, Duration recoveryInterval, Duration timeoutSweepInterval) {
        this.engine = engine;
        this.scheduler = scheduler;
        this.recovery = recovery;
        this.worker = worker;
        this.recoveryInterval = recoveryInterval;
        this.timeoutSweepInterval = timeoutSweepInterval;
    }

    @Override
    public void start() {
        long sweepMs = timeoutSweepInterval.toMillis();
        scheduler.scheduleWithFixedDelay(TIMEOUT_SWEEP_TASK,
                () -> engine.activityScheduler().enforceTimeouts()
                        .onErrorResume(e -> {
                            log.warn("[durable] Activity timeout sweep failed: {}", e.getMessage());
                            return Mono.empty();
                        })
                        .block(),
                sweepMs, sweepMs);
        if (recovery != null) {
            recovery.recoverOrphanedRuns()
                    .subscribe(null, e -> log.error("[durable] Startup recovery failed: {}", e.getMessage(), e));
            recovery.schedule(scheduler, recoveryInterval);
        }
        if (worker != null) {
            worker.start().subscribe(null, e -> log.error("[durable] Activity worker failed to start: {}",
                    e.getMessage(), e));
        }
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        if (worker != null) {
            worker.stop().block(SHUTDOWN_TIMEOUT);
        }
        engine.shutdown().block(SHUTDOWN_TIMEOUT);
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}

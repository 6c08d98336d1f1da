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


package org.fireflyframework.durable.workflow.timer;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.RunEventSink;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.scheduling.DurableScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arms durable timers. The fire time is recorded in {@code TimerStarted};
 * this service only turns it into a {@code TimerFired} delivery, so timers
 * lost with a process are re-armed from history on recovery.
 */
@Slf4j
public class TimerService {

    private final DurableScheduler scheduler;
    private final RunEventSink sink;
    private final DurableEvents events;
    private final Clock clock;
    private final Map<RunKey, Map<Integer, Instant>> pending = new ConcurrentHashMap<>();

    public TimerService(DurableScheduler scheduler, RunEventSink sink, DurableEvents events, Clock clock) {
        this.scheduler = scheduler;
        this.sink = sink;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Arms (or re-arms) the timer of a command. A fire time in the past fires
     * immediately.
     */
    public void arm(RunKey runKey, int commandId, Instant fireAt) {
        pending.computeIfAbsent(runKey, k -> new ConcurrentHashMap<>()).put(commandId, fireAt);
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        scheduler.scheduleOnce(taskId(runKey, commandId), () -> fire(runKey, commandId), delayMs);
        log.debug("[timer] Armed timer {} of {} to fire at {}", commandId, runKey, fireAt);
    }

    public boolean isArmed(RunKey runKey, int commandId) {
        return scheduler.isScheduled(taskId(runKey, commandId));
    }

    public Map<Integer, Instant> pendingTimers(RunKey runKey) {
        Map<Integer, Instant> timers = pending.get(runKey);
        return timers != null ? Map.copyOf(timers) : Map.of();
    }

    /** Disarms every timer of a closed run. */
    public void cancelRun(RunKey runKey) {
        int cancelled = scheduler.cancelByPrefix(runKey + "#timer-");
        pending.remove(runKey);
        if (cancelled > 0) {
            log.info("[timer] Cancelled {} timer(s) of {}", cancelled, runKey);
        }
    }

    private void fire(RunKey runKey, int commandId) {
        Map<Integer, Instant> timers = pending.get(runKey);
        if (timers != null) timers.remove(commandId);
        events.onTimerFired(runKey, commandId);
        sink.deliver(runKey, HistoryEvents.timerFired(commandId))
                .subscribe(null, error -> log.error("[timer] Failed to deliver timer {} of {}: {}",
                        commandId, runKey, error.getMessage(), error));
    }

    private static String taskId(RunKey runKey, int commandId) {
        return runKey + "#timer-" + commandId;
    }
}

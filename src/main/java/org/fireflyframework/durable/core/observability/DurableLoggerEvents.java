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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;

import java.time.Duration;

@Slf4j
public class DurableLoggerEvents implements DurableEvents {
    @Override
    public void onWorkflowStarted(String workflowType, RunKey runKey) {
        log.info("[durable] workflow.started type={} run={}", workflowType, runKey);
    }
    @Override
    public void onDecisionCycle(String workflowType, RunKey runKey, int appendedEvents, long latencyMs) {
        log.debug("[durable] decision.cycle type={} run={} appended={} latencyMs={}", workflowType, runKey, appendedEvents, latencyMs);
    }
    @Override
    public void onWorkflowClosed(String workflowType, RunKey runKey, RunStatus status, long durationMs) {
        log.info("[durable] workflow.closed type={} run={} status={} durationMs={}", workflowType, runKey, status, durationMs);
    }
    @Override
    public void onCancelRequested(String workflowType, RunKey runKey) {
        log.info("[durable] workflow.cancel.requested type={} run={}", workflowType, runKey);
    }
    @Override
    public void onContinueAsNew(String workflowType, RunKey previous, RunKey successor) {
        log.info("[durable] workflow.continued.as.new type={} run={} successor={}", workflowType, previous, successor.runId());
    }
    @Override
    public void onActivityScheduled(String activityName, RunKey runKey, int commandId) {
        log.debug("[durable] activity.scheduled name={} run={} commandId={}", activityName, runKey, commandId);
    }
    @Override
    public void onActivityCompleted(String activityName, RunKey runKey, int attempt, long latencyMs) {
        log.info("[durable] activity.completed name={} run={} attempt={} latencyMs={}", activityName, runKey, attempt, latencyMs);
    }
    @Override
    public void onActivityRetryScheduled(String activityName, RunKey runKey, int failedAttempt, Duration delay, String errorType) {
        log.warn("[durable] activity.retry name={} run={} failedAttempt={} delayMs={} error={}", activityName, runKey, failedAttempt, delay.toMillis(), errorType);
    }
    @Override
    public void onActivityFailed(String activityName, RunKey runKey, int attempts, String errorType) {
        log.warn("[durable] activity.failed name={} run={} attempts={} error={}", activityName, runKey, attempts, errorType);
    }
    @Override
    public void onActivityTimedOut(String activityName, RunKey runKey, int attempt, String timeoutType) {
        log.warn("[durable] activity.timed.out name={} run={} attempt={} timeout={}", activityName, runKey, attempt, timeoutType);
    }
    @Override
    public void onSignalReceived(String workflowType, RunKey runKey, String signalName) {
        log.info("[durable] signal.received type={} run={} signal={}", workflowType, runKey, signalName);
    }
    @Override
    public void onTimerFired(RunKey runKey, int commandId) {
        log.debug("[durable] timer.fired run={} commandId={}", runKey, commandId);
    }
    @Override
    public void onChildWorkflowStarted(RunKey parent, RunKey child, String childType) {
        log.info("[durable] child.started parent={} child={} type={}", parent, child, childType);
    }
    @Override
    public void onChildWorkflowClosed(RunKey parent, RunKey child, boolean success) {
        log.info("[durable] child.closed parent={} child={} success={}", parent, child, success);
    }
    @Override
    public void onLeaseLost(RunKey runKey, String holderId) {
        log.warn("[durable] lease.lost run={} holder={}", runKey, holderId);
    }
    @Override
    public void onRunRecovered(String workflowType, RunKey runKey) {
        log.info("[durable] run.recovered type={} run={}", workflowType, runKey);
    }
    @Override
    public void onNonDeterminism(String workflowType, RunKey runKey, Throwable error) {
        log.error("[durable] non.determinism type={} run={} error={}", workflowType, runKey, error.getMessage());
    }
    @Override
    public void onDeadLettered(String workflowType, RunKey runKey, Throwable error) {
        log.error("[durable] dead.lettered type={} run={} error={}", workflowType, runKey, error.getMessage());
    }
}

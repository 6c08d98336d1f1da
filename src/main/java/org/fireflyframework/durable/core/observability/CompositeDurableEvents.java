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
import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeDurableEvents implements DurableEvents {
    private final List<DurableEvents> delegates;

    public CompositeDurableEvents(List<DurableEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<DurableEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onWorkflowStarted(String workflowType, RunKey runKey) { safeForEach(d -> d.onWorkflowStarted(workflowType, runKey)); }
    @Override public void onDecisionCycle(String workflowType, RunKey runKey, int appendedEvents, long latencyMs) { safeForEach(d -> d.onDecisionCycle(workflowType, runKey, appendedEvents, latencyMs)); }
    @Override public void onWorkflowClosed(String workflowType, RunKey runKey, RunStatus status, long durationMs) { safeForEach(d -> d.onWorkflowClosed(workflowType, runKey, status, durationMs)); }
    @Override public void onCancelRequested(String workflowType, RunKey runKey) { safeForEach(d -> d.onCancelRequested(workflowType, runKey)); }
    @Override public void onContinueAsNew(String workflowType, RunKey previous, RunKey successor) { safeForEach(d -> d.onContinueAsNew(workflowType, previous, successor)); }
    @Override public void onActivityScheduled(String activityName, RunKey runKey, int commandId) { safeForEach(d -> d.onActivityScheduled(activityName, runKey, commandId)); }
    @Override public void onActivityCompleted(String activityName, RunKey runKey, int attempt, long latencyMs) { safeForEach(d -> d.onActivityCompleted(activityName, runKey, attempt, latencyMs)); }
    @Override public void onActivityRetryScheduled(String activityName, RunKey runKey, int failedAttempt, Duration delay, String errorType) { safeForEach(d -> d.onActivityRetryScheduled(activityName, runKey, failedAttempt, delay, errorType)); }
    @Override public void onActivityFailed(String activityName, RunKey runKey, int attempts, String errorType) { safeForEach(d -> d.onActivityFailed(activityName, runKey, attempts, errorType)); }
    @Override public void onActivityTimedOut(String activityName, RunKey runKey, int attempt, String timeoutType) { safeForEach(d -> d.onActivityTimedOut(activityName, runKey, attempt, timeoutType)); }
    @Override public void onSignalReceived(String workflowType, RunKey runKey, String signalName) { safeForEach(d -> d.onSignalReceived(workflowType, runKey, signalName)); }
    @Override public void onTimerFired(RunKey runKey, int commandId) { safeForEach(d -> d.onTimerFired(runKey, commandId)); }
    @Override public void onChildWorkflowStarted(RunKey parent, RunKey child, String childType) { safeForEach(d -> d.onChildWorkflowStarted(parent, child, childType)); }
    @Override public void onChildWorkflowClosed(RunKey parent, RunKey child, boolean success) { safeForEach(d -> d.onChildWorkflowClosed(parent, child, success)); }
    @Override public void onLeaseLost(RunKey runKey, String holderId) { safeForEach(d -> d.onLeaseLost(runKey, holderId)); }
    @Override public void onRunRecovered(String workflowType, RunKey runKey) { safeForEach(d -> d.onRunRecovered(workflowType, runKey)); }
    @Override public void onNonDeterminism(String workflowType, RunKey runKey, Throwable error) { safeForEach(d -> d.onNonDeterminism(workflowType, runKey, error)); }
    @Override public void onDeadLettered(String workflowType, RunKey runKey, Throwable error) { safeForEach(d -> d.onDeadLettered(workflowType, runKey, error)); }
}

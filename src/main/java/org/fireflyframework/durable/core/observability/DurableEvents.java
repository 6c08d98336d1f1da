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

import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;

import java.time.Duration;

public interface DurableEvents {
    // Run lifecycle
    default void onWorkflowStarted(String workflowType, RunKey runKey) {}
    default void onDecisionCycle(String workflowType, RunKey runKey, int appendedEvents, long latencyMs) {}
    default void onWorkflowClosed(String workflowType, RunKey runKey, RunStatus status, long durationMs) {}
    default void onCancelRequested(String workflowType, RunKey runKey) {}
    default void onContinueAsNew(String workflowType, RunKey previous, RunKey successor) {}

    // Activities
    default void onActivityScheduled(String activityName, RunKey runKey, int commandId) {}
    default void onActivityCompleted(String activityName, RunKey runKey, int attempt, long latencyMs) {}
    default void onActivityRetryScheduled(String activityName, RunKey runKey, int failedAttempt, Duration delay, String errorType) {}
    default void onActivityFailed(String activityName, RunKey runKey, int attempts, String errorType) {}
    default void onActivityTimedOut(String activityName, RunKey runKey, int attempt, String timeoutType) {}

    // Signals, timers, children
    default void onSignalReceived(String workflowType, RunKey runKey, String signalName) {}
    default void onTimerFired(RunKey runKey, int commandId) {}
    default void onChildWorkflowStarted(RunKey parent, RunKey child, String childType) {}
    default void onChildWorkflowClosed(RunKey parent, RunKey child, boolean success) {}

    // Leases and recovery
    default void onLeaseLost(RunKey runKey, String holderId) {}
    default void onRunRecovered(String workflowType, RunKey runKey) {}

    // Fatal
    default void onNonDeterminism(String workflowType, RunKey runKey, Throwable error) {}
    default void onDeadLettered(String workflowType, RunKey runKey, Throwable error) {}
}

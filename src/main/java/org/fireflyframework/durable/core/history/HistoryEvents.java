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


package org.fireflyframework.durable.core.history;

import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RetryPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload keys and factories for every event kind, so the engine, the
 * replay context and the persistent logs agree on one layout.
 */
public final class HistoryEvents {

    public static final String COMMAND_ID = "commandId";
    public static final String WORKFLOW_TYPE = "workflowType";
    public static final String INPUT = "input";
    public static final String RESULT = "result";
    public static final String FAILURE = "failure";
    public static final String ATTEMPT = "attempt";
    public static final String TASK_QUEUE = "taskQueue";
    public static final String RUN_TIMEOUT_AT = "runTimeoutAt";
    public static final String PARENT_WORKFLOW_ID = "parentWorkflowId";
    public static final String PARENT_RUN_ID = "parentRunId";
    public static final String PARENT_COMMAND_ID = "parentCommandId";
    public static final String PREVIOUS_RUN_ID = "previousRunId";
    public static final String ACTIVITY_NAME = "activityName";
    public static final String START_TO_CLOSE_MS = "startToCloseTimeoutMs";
    public static final String SCHEDULE_TO_START_MS = "scheduleToStartTimeoutMs";
    public static final String RETRY_POLICY = "retryPolicy";
    public static final String TIMEOUT_TYPE = "timeoutType";
    public static final String FIRE_AT = "fireAt";
    public static final String CHILD_WORKFLOW_ID = "childWorkflowId";
    public static final String CHILD_RUN_ID = "childRunId";
    public static final String RUN_TIMEOUT_MS = "runTimeoutMs";
    public static final String TARGET_COMMAND_ID = "targetCommandId";
    public static final String SIGNAL_NAME = "signalName";
    public static final String SIGNAL_PAYLOAD = "payload";
    public static final String REASON = "reason";
    public static final String NEW_RUN_ID = "newRunId";
    /** Id of the inbox entry an event arrived through; lets a redelivered entry be recognised. */
    public static final String DELIVERY_ID = "deliveryId";

    public static final String START_TO_CLOSE = "START_TO_CLOSE";
    public static final String SCHEDULE_TO_START = "SCHEDULE_TO_START";

    private HistoryEvents() {}

    public static PendingEvent workflowStarted(String workflowType, Object input, String taskQueue,
                                               Instant runTimeoutAt, ParentRef parent, String previousRunId) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(WORKFLOW_TYPE, workflowType);
        p.put(INPUT, input);
        p.put(TASK_QUEUE, taskQueue);
        p.put(RUN_TIMEOUT_AT, runTimeoutAt != null ? runTimeoutAt.toString() : null);
        if (parent != null) {
            p.put(PARENT_WORKFLOW_ID, parent.workflowId());
            p.put(PARENT_RUN_ID, parent.runId());
            p.put(PARENT_COMMAND_ID, parent.commandId());
        }
        if (previousRunId != null) p.put(PREVIOUS_RUN_ID, previousRunId);
        return new PendingEvent(EventType.WORKFLOW_STARTED, p);
    }

    public static PendingEvent activityScheduled(int commandId, String activityName, Object input, String taskQueue,
                                                 Duration startToClose, Duration scheduleToStart, RetryPolicy retryPolicy) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(ACTIVITY_NAME, activityName);
        p.put(INPUT, input);
        p.put(TASK_QUEUE, taskQueue);
        p.put(START_TO_CLOSE_MS, startToClose != null ? startToClose.toMillis() : null);
        p.put(SCHEDULE_TO_START_MS, scheduleToStart != null ? scheduleToStart.toMillis() : null);
        p.put(RETRY_POLICY, retryPolicy != null ? retryPolicyPayload(retryPolicy) : null);
        return new PendingEvent(EventType.ACTIVITY_SCHEDULED, p);
    }

    public static PendingEvent activityCompleted(int commandId, Object result, int attempt) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(RESULT, result);
        p.put(ATTEMPT, attempt);
        return new PendingEvent(EventType.ACTIVITY_COMPLETED, p);
    }

    public static PendingEvent activityFailed(int commandId, Failure failure, int attempt) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(FAILURE, failure.toPayload());
        p.put(ATTEMPT, attempt);
        return new PendingEvent(EventType.ACTIVITY_FAILED, p);
    }

    public static PendingEvent activityTimedOut(int commandId, String timeoutType, int attempt) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(TIMEOUT_TYPE, timeoutType);
        p.put(ATTEMPT, attempt);
        return new PendingEvent(EventType.ACTIVITY_TIMED_OUT, p);
    }

    public static PendingEvent timerStarted(int commandId, Instant fireAt, Duration delay) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(FIRE_AT, fireAt.toString());
        p.put("delayMs", delay.toMillis());
        return new PendingEvent(EventType.TIMER_STARTED, p);
    }

    public static PendingEvent timerFired(int commandId) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        return new PendingEvent(EventType.TIMER_FIRED, p);
    }

    public static PendingEvent childWorkflowStarted(int commandId, String childWorkflowId, String childRunId,
                                                    String workflowType, Object input, String taskQueue,
                                                    Duration runTimeout) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(CHILD_WORKFLOW_ID, childWorkflowId);
        p.put(CHILD_RUN_ID, childRunId);
        p.put(WORKFLOW_TYPE, workflowType);
        p.put(INPUT, input);
        p.put(TASK_QUEUE, taskQueue);
        p.put(RUN_TIMEOUT_MS, runTimeout != null ? runTimeout.toMillis() : null);
        return new PendingEvent(EventType.CHILD_WORKFLOW_STARTED, p);
    }

    public static PendingEvent childWorkflowCompleted(int commandId, String childWorkflowId, Object result) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(CHILD_WORKFLOW_ID, childWorkflowId);
        p.put(RESULT, result);
        return new PendingEvent(EventType.CHILD_WORKFLOW_COMPLETED, p);
    }

    public static PendingEvent childWorkflowFailed(int commandId, String childWorkflowId, Failure failure) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(CHILD_WORKFLOW_ID, childWorkflowId);
        p.put(FAILURE, failure.toPayload());
        return new PendingEvent(EventType.CHILD_WORKFLOW_FAILED, p);
    }

    public static PendingEvent childWorkflowCancelRequested(int commandId, int targetCommandId,
                                                            String childWorkflowId, String childRunId) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(COMMAND_ID, commandId);
        p.put(TARGET_COMMAND_ID, targetCommandId);
        p.put(CHILD_WORKFLOW_ID, childWorkflowId);
        p.put(CHILD_RUN_ID, childRunId);
        return new PendingEvent(EventType.CHILD_WORKFLOW_CANCEL_REQUESTED, p);
    }

    public static PendingEvent signalReceived(String signalName, Object payload) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(SIGNAL_NAME, signalName);
        p.put(SIGNAL_PAYLOAD, payload);
        return new PendingEvent(EventType.SIGNAL_RECEIVED, p);
    }

    public static PendingEvent cancelRequested(String reason) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(REASON, reason);
        return new PendingEvent(EventType.CANCEL_REQUESTED, p);
    }

    public static PendingEvent workflowCompleted(Object result) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(RESULT, result);
        return new PendingEvent(EventType.WORKFLOW_COMPLETED, p);
    }

    public static PendingEvent workflowFailed(Failure failure) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(FAILURE, failure.toPayload());
        return new PendingEvent(EventType.WORKFLOW_FAILED, p);
    }

    public static PendingEvent workflowCancelled(String reason) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(REASON, reason);
        return new PendingEvent(EventType.WORKFLOW_CANCELLED, p);
    }

    public static PendingEvent workflowTimedOut() {
        return new PendingEvent(EventType.WORKFLOW_TIMED_OUT, Map.of());
    }

    public static PendingEvent workflowContinuedAsNew(String newRunId, Object input) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(NEW_RUN_ID, newRunId);
        p.put(INPUT, input);
        return new PendingEvent(EventType.WORKFLOW_CONTINUED_AS_NEW, p);
    }

    // ── Payload readers ───────────────────────────────────────────

    public static Instant instant(HistoryEvent event, String key) {
        String value = event.getString(key);
        return value != null ? Instant.parse(value) : null;
    }

    public static Duration millis(HistoryEvent event, String key) {
        Object value = event.get(key);
        return value instanceof Number n ? Duration.ofMillis(n.longValue()) : null;
    }

    public static Failure failure(HistoryEvent event) {
        return Failure.fromPayload(event.get(FAILURE));
    }

    public static ParentRef parent(HistoryEvent started) {
        String parentWorkflowId = started.getString(PARENT_WORKFLOW_ID);
        if (parentWorkflowId == null) return null;
        return new ParentRef(parentWorkflowId, started.getString(PARENT_RUN_ID), started.getInt(PARENT_COMMAND_ID));
    }

    public static Map<String, Object> retryPolicyPayload(RetryPolicy policy) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("initialIntervalMs", policy.initialInterval().toMillis());
        p.put("backoffCoefficient", policy.backoffCoefficient());
        p.put("maxIntervalMs", policy.maxInterval().toMillis());
        p.put("maxAttempts", policy.maxAttempts());
        p.put("nonRetryableErrorTypes", policy.nonRetryableErrorTypes());
        return p;
    }

    @SuppressWarnings("unchecked")
    public static RetryPolicy retryPolicy(HistoryEvent scheduled) {
        Object raw = scheduled.get(RETRY_POLICY);
        if (!(raw instanceof Map<?, ?> map)) return null;
        Map<String, Object> p = (Map<String, Object>) map;
        Object types = p.get("nonRetryableErrorTypes");
        return new RetryPolicy(
                Duration.ofMillis(((Number) p.get("initialIntervalMs")).longValue()),
                ((Number) p.get("backoffCoefficient")).doubleValue(),
                Duration.ofMillis(((Number) p.get("maxIntervalMs")).longValue()),
                ((Number) p.get("maxAttempts")).intValue(),
                types instanceof List<?> list ? list.stream().map(String::valueOf).toList() : List.of());
    }

    /**
     * Reference from a child run back to the parent command that started it.
     */
    public record ParentRef(String workflowId, String runId, int commandId) {}
}

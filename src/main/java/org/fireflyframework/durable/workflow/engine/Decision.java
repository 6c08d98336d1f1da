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


package org.fireflyframework.durable.workflow.engine;

import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PendingEvent;
import org.fireflyframework.durable.core.model.RetryPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * Next action computed by a decision cycle. Each decision is recorded as one
 * event; its side effect is dispatched only after that event is appended.
 * Input and result values are already payload trees.
 */
public sealed interface Decision {

    PendingEvent toEvent();

    default boolean isTerminal() {
        return false;
    }

    record ScheduleActivity(int commandId, String activityName, Object input, String taskQueue,
                            Duration startToCloseTimeout, Duration scheduleToStartTimeout,
                            RetryPolicy retryPolicy) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.activityScheduled(commandId, activityName, input, taskQueue,
                    startToCloseTimeout, scheduleToStartTimeout, retryPolicy);
        }
    }

    record StartTimer(int commandId, Instant fireAt, Duration delay) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.timerStarted(commandId, fireAt, delay);
        }
    }

    record StartChildWorkflow(int commandId, String childWorkflowId, String childRunId, String workflowType,
                              Object input, String taskQueue, Duration runTimeout) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.childWorkflowStarted(commandId, childWorkflowId, childRunId, workflowType,
                    input, taskQueue, runTimeout);
        }
    }

    record RequestCancelChild(int commandId, int targetCommandId, String childWorkflowId,
                              String childRunId) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.childWorkflowCancelRequested(commandId, targetCommandId, childWorkflowId, childRunId);
        }
    }

    record CompleteWorkflow(Object result) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.workflowCompleted(result);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record FailWorkflow(Failure failure) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.workflowFailed(failure);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record CancelWorkflow(String reason) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.workflowCancelled(reason);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record ContinueAsNew(String newRunId, Object input) implements Decision {
        @Override
        public PendingEvent toEvent() {
            return HistoryEvents.workflowContinuedAsNew(newRunId, input);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}

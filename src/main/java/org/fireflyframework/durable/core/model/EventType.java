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


package org.fireflyframework.durable.core.model;

/**
 * Kinds of events recorded in a run's history.
 */
public enum EventType {
    WORKFLOW_STARTED,
    ACTIVITY_SCHEDULED,
    ACTIVITY_COMPLETED,
    ACTIVITY_FAILED,
    ACTIVITY_TIMED_OUT,
    TIMER_STARTED,
    TIMER_FIRED,
    CHILD_WORKFLOW_STARTED,
    CHILD_WORKFLOW_COMPLETED,
    CHILD_WORKFLOW_FAILED,
    CHILD_WORKFLOW_CANCEL_REQUESTED,
    SIGNAL_RECEIVED,
    CANCEL_REQUESTED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_CANCELLED,
    WORKFLOW_TIMED_OUT,
    WORKFLOW_CONTINUED_AS_NEW;

    /** Events recording a command issued by the workflow logic. */
    public boolean isCommand() {
        return this == ACTIVITY_SCHEDULED || this == TIMER_STARTED
                || this == CHILD_WORKFLOW_STARTED || this == CHILD_WORKFLOW_CANCEL_REQUESTED;
    }

    /** Events resolving a previously issued command. */
    public boolean isOutcome() {
        return this == ACTIVITY_COMPLETED || this == ACTIVITY_FAILED || this == ACTIVITY_TIMED_OUT
                || this == TIMER_FIRED || this == CHILD_WORKFLOW_COMPLETED || this == CHILD_WORKFLOW_FAILED;
    }

    public boolean isTerminal() {
        return terminalStatus() != null;
    }

    /** Status a run ends in when this event is appended, or {@code null} for non-terminal events. */
    public RunStatus terminalStatus() {
        return switch (this) {
            case WORKFLOW_COMPLETED -> RunStatus.COMPLETED;
            case WORKFLOW_FAILED -> RunStatus.FAILED;
            case WORKFLOW_CANCELLED -> RunStatus.CANCELLED;
            case WORKFLOW_TIMED_OUT -> RunStatus.TIMED_OUT;
            case WORKFLOW_CONTINUED_AS_NEW -> RunStatus.CONTINUED_AS_NEW;
            default -> null;
        };
    }
}

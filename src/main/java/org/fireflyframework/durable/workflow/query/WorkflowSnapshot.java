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


package org.fireflyframework.durable.workflow.query;

import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.model.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a run derived from its history. Building it never
 * appends events or dispatches side effects.
 */
public record WorkflowSnapshot(
        String workflowId,
        String runId,
        String workflowType,
        RunStatus status,
        Instant startTime,
        Instant closeTime,
        Instant workflowTime,
        long historyLength,
        Object input,
        Object result,
        Failure failure,
        List<String> pendingActivities,
        int pendingTimers,
        List<String> pendingChildren,
        Map<String, Integer> signalsReceived,
        Set<String> queries,
        String parentWorkflowId,
        String previousRunId,
        String continuedAsRunId
) {}

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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Output of one replay: the decisions that are not in history yet, plus the
 * query handlers and workflow time the logic reached.
 */
public record ReplayResult(List<Decision> decisions, Map<String, Supplier<?>> queryHandlers, Instant workflowTime) {

    public ReplayResult {
        decisions = List.copyOf(decisions);
        queryHandlers = Map.copyOf(queryHandlers);
    }

    public static ReplayResult none(Instant workflowTime) {
        return new ReplayResult(List.of(), Map.of(), workflowTime);
    }

    public boolean isTerminal() {
        return !decisions.isEmpty() && decisions.get(decisions.size() - 1).isTerminal();
    }

    public Decision terminalDecision() {
        return isTerminal() ? decisions.get(decisions.size() - 1) : null;
    }
}

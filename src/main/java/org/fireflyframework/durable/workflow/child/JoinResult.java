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


package org.fireflyframework.durable.workflow.child;

import java.util.List;

/**
 * Outcomes of a join, ordered by member input position.
 */
public record JoinResult<T>(List<JoinOutcome<T>> outcomes) {

    public JoinResult {
        outcomes = List.copyOf(outcomes);
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(JoinOutcome::isSuccess);
    }

    /**
     * Values in input order; throws the first error by position when any member failed.
     */
    public List<T> values() {
        for (JoinOutcome<T> outcome : outcomes) {
            if (!outcome.isSuccess()) throw outcome.error();
        }
        return outcomes.stream().map(JoinOutcome::value).toList();
    }

    public List<JoinOutcome<T>> failures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }

    public int size() {
        return outcomes.size();
    }
}

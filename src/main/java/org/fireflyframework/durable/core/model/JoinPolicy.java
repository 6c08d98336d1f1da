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
 * Failure aggregation policy of a join over several child executions.
 * There is deliberately no default; every join names one.
 */
public enum JoinPolicy {
    /** The first failure cancels every still-pending sibling and fails the join. */
    FAIL_FAST,
    /** The join waits for every member and reports a result or error per index. */
    COLLECT_ALL
}

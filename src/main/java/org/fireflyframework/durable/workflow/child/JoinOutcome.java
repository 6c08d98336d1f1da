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

import org.fireflyframework.durable.core.exception.DurableException;

/**
 * Result or error of one join member, at the member's input position.
 */
public record JoinOutcome<T>(int index, T value, DurableException error) {

    public static <T> JoinOutcome<T> success(int index, T value) {
        return new JoinOutcome<>(index, value, null);
    }

    public static <T> JoinOutcome<T> failure(int index, DurableException error) {
        return new JoinOutcome<>(index, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

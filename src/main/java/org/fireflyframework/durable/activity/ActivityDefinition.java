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


package org.fireflyframework.durable.activity;

import org.fireflyframework.durable.core.model.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Registration of one activity type under a stable name.
 *
 * @param name                     stable identifier used by workflows to schedule it
 * @param inputType                type the recorded input is converted to
 * @param handler                  implementation
 * @param startToCloseTimeout      default per-attempt deadline, {@code null} for the engine default
 * @param scheduleToStartTimeout   default queueing deadline, {@code null} for none
 * @param retryPolicy              default retry policy, {@code null} for the engine default
 */
public record ActivityDefinition<I, R>(
        String name,
        Class<I> inputType,
        ActivityHandler<I, R> handler,
        Duration startToCloseTimeout,
        Duration scheduleToStartTimeout,
        RetryPolicy retryPolicy
) {
    public ActivityDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(inputType, "inputType");
        Objects.requireNonNull(handler, "handler");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    }

    public static <I, R> ActivityDefinition<I, R> of(String name, Class<I> inputType, ActivityHandler<I, R> handler) {
        return new ActivityDefinition<>(name, inputType, handler, null, null, null);
    }

    public ActivityDefinition<I, R> withStartToCloseTimeout(Duration timeout) {
        return new ActivityDefinition<>(name, inputType, handler, timeout, scheduleToStartTimeout, retryPolicy);
    }

    public ActivityDefinition<I, R> withScheduleToStartTimeout(Duration timeout) {
        return new ActivityDefinition<>(name, inputType, handler, startToCloseTimeout, timeout, retryPolicy);
    }

    public ActivityDefinition<I, R> withRetryPolicy(RetryPolicy policy) {
        return new ActivityDefinition<>(name, inputType, handler, startToCloseTimeout, scheduleToStartTimeout, policy);
    }
}

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


package org.fireflyframework.durable.workflow;

/**
 * Durable, replayable orchestration logic.
 *
 * <p>{@link #run} is re-executed from the beginning on every decision cycle
 * against the run's recorded history, so it must be a pure function of its
 * input and of what the {@link WorkflowContext} returns: no wall-clock reads,
 * no randomness, no direct I/O. Everything external goes through the context.
 *
 * <p>Waiting on a {@link Promise} whose result is not in history yet unwinds
 * the call with an internal {@link Error}; do not catch {@code Throwable} or
 * {@code Error} in workflow code.
 */
@FunctionalInterface
public interface Workflow<I, R> {

    R run(WorkflowContext ctx, I input) throws Exception;
}

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

import org.fireflyframework.durable.core.model.JoinPolicy;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.workflow.child.JoinResult;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The only handle workflow logic has on the outside world. Every operation
 * is either recorded in history or derived from it, which keeps replay
 * deterministic.
 */
public interface WorkflowContext {

    String workflowType();

    RunKey runKey();

    default String workflowId() {
        return runKey().workflowId();
    }

    default String runId() {
        return runKey().runId();
    }

    /**
     * Deterministic workflow time: the timestamp of the latest history event
     * the logic has observed. Use instead of the system clock.
     */
    Instant currentTime();

    /** {@code true} while the logic is re-issuing commands already in history. */
    boolean isReplaying();

    /** Logger that stays silent while replaying. */
    Logger logger();

    /** Deterministic UUID, identical on every replay. */
    UUID randomUuid();

    // ── Activities ────────────────────────────────────────────────

    <T> Promise<T> scheduleActivity(String name, Object input, Class<T> resultType, ActivityOptions options);

    default <T> Promise<T> scheduleActivity(String name, Object input, Class<T> resultType) {
        return scheduleActivity(name, input, resultType, ActivityOptions.defaults());
    }

    default <T> T executeActivity(String name, Object input, Class<T> resultType, ActivityOptions options) {
        return scheduleActivity(name, input, resultType, options).get();
    }

    default <T> T executeActivity(String name, Object input, Class<T> resultType) {
        return scheduleActivity(name, input, resultType).get();
    }

    // ── Timers and signals ────────────────────────────────────────

    Promise<Void> startTimer(Duration delay);

    default void sleep(Duration delay) {
        startTimer(delay).get();
    }

    /**
     * The n-th call for a given name yields the n-th {@code SignalReceived}
     * with that name.
     */
    <T> Promise<T> awaitSignal(String signalName, Class<T> payloadType);

    /**
     * Index of the promise whose outcome was recorded first. Suspends while
     * none is done.
     */
    int awaitAny(List<? extends Promise<?>> promises);

    // ── Child workflows ───────────────────────────────────────────

    <T> ChildHandle<T> startChildWorkflow(ChildWorkflowSpec spec, Class<T> resultType);

    /** Starts one child per spec, in spec order, without waiting. */
    default <T> List<ChildHandle<T>> fanOut(List<ChildWorkflowSpec> specs, Class<T> resultType) {
        List<ChildHandle<T>> handles = new ArrayList<>(specs.size());
        for (ChildWorkflowSpec spec : specs) {
            handles.add(startChildWorkflow(spec, resultType));
        }
        return handles;
    }

    /**
     * Waits for the members under the given policy. Results are indexed by
     * member position, never by completion order.
     */
    <T> JoinResult<T> join(List<? extends Promise<T>> members, JoinPolicy policy);

    // ── Run control ───────────────────────────────────────────────

    /** Ends this run and starts a successor run of the same workflow with {@code input}. Never returns. */
    void continueAsNew(Object input);

    /** Exposes read-only state to {@code query(handle, name)}. */
    void registerQuery(String queryName, Supplier<?> handler);
}

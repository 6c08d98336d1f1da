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

import org.fireflyframework.durable.core.exception.ActivityFailureException;
import org.fireflyframework.durable.core.exception.ChildWorkflowFailureException;
import org.fireflyframework.durable.core.exception.DurableException;
import org.fireflyframework.durable.core.exception.JoinFailedException;
import org.fireflyframework.durable.core.exception.NonDeterminismException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.JoinPolicy;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.workflow.ActivityOptions;
import org.fireflyframework.durable.workflow.ChildHandle;
import org.fireflyframework.durable.workflow.ChildWorkflowSpec;
import org.fireflyframework.durable.workflow.Promise;
import org.fireflyframework.durable.workflow.WorkflowContext;
import org.fireflyframework.durable.workflow.child.JoinOutcome;
import org.fireflyframework.durable.workflow.child.JoinResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * {@link WorkflowContext} backed by a run's history. Commands are numbered in
 * issue order; a command already in history must match the recorded one by
 * kind and name, otherwise the run is non-deterministic. Waiting on a result
 * that is not recorded unwinds the logic with {@link WorkflowBlockedError}.
 */
final class ReplayContext implements WorkflowContext {

    private final RunKey runKey;
    private final HistoryIndex history;
    private final PayloadConverter converter;
    private final Logger workflowLogger;
    private final List<Decision> decisions = new ArrayList<>();
    private final Map<String, Supplier<?>> queryHandlers = new LinkedHashMap<>();
    private final Map<String, Integer> signalCursors = new HashMap<>();
    private final Set<Integer> cancelIssued = new HashSet<>();
    private int nextCommandId;
    private int uuidCounter;
    private Instant currentTime;

    ReplayContext(RunKey runKey, HistoryIndex history, PayloadConverter converter) {
        this.runKey = runKey;
        this.history = history;
        this.converter = converter;
        this.currentTime = history.startTime();
        this.workflowLogger = LoggerFactory.getLogger("org.fireflyframework.durable.workflow." + history.workflowType());
    }

    @Override
    public String workflowType() {
        return history.workflowType();
    }

    @Override
    public RunKey runKey() {
        return runKey;
    }

    @Override
    public Instant currentTime() {
        return currentTime;
    }

    @Override
    public boolean isReplaying() {
        return nextCommandId < history.commandCount();
    }

    @Override
    public Logger logger() {
        return isReplaying() ? NOPLogger.NOP_LOGGER : workflowLogger;
    }

    @Override
    public UUID randomUuid() {
        return deterministicUuid(runKey.runId() + ":" + (uuidCounter++));
    }

    // ── Activities ────────────────────────────────────────────────

    @Override
    public <T> Promise<T> scheduleActivity(String name, Object input, Class<T> resultType, ActivityOptions options) {
        Objects.requireNonNull(name, "name");
        ActivityOptions opts = options != null ? options : ActivityOptions.defaults();
        String queue = opts.taskQueue() != null ? opts.taskQueue() : history.taskQueue();
        int commandId = issue(EventType.ACTIVITY_SCHEDULED, name, id -> new Decision.ScheduleActivity(
                id, name, converter.toPayload(input), queue, opts.startToCloseTimeout(),
                opts.scheduleToStartTimeout(), opts.retryPolicy()));
        return new ActivityPromise<>(commandId, name, resultType);
    }

    // ── Timers and signals ────────────────────────────────────────

    @Override
    public Promise<Void> startTimer(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Timer delay must be zero or positive");
        }
        int commandId = issue(EventType.TIMER_STARTED, null,
                id -> new Decision.StartTimer(id, currentTime.plus(delay), delay));
        return new TimerPromise(commandId);
    }

    @Override
    public <T> Promise<T> awaitSignal(String signalName, Class<T> payloadType) {
        Objects.requireNonNull(signalName, "signalName");
        int ordinal = signalCursors.merge(signalName, 1, Integer::sum) - 1;
        return new SignalPromise<>(signalName, ordinal, payloadType);
    }

    @Override
    public int awaitAny(List<? extends Promise<?>> promises) {
        if (promises.isEmpty()) throw new IllegalArgumentException("awaitAny needs at least one promise");
        int first = -1;
        long firstSeq = Long.MAX_VALUE;
        for (int i = 0; i < promises.size(); i++) {
            HistoryEvent outcome = own(promises.get(i)).outcome();
            if (outcome != null && outcome.seq() < firstSeq) {
                first = i;
                firstSeq = outcome.seq();
            }
        }
        if (first < 0) throw WorkflowBlockedError.INSTANCE;
        observe(own(promises.get(first)).outcome());
        return first;
    }

    // ── Child workflows ───────────────────────────────────────────

    @Override
    public <T> ChildHandle<T> startChildWorkflow(ChildWorkflowSpec spec, Class<T> resultType) {
        Objects.requireNonNull(spec, "spec");
        int commandId = nextCommandId;
        String childWorkflowId = spec.workflowId() != null
                ? spec.workflowId() : runKey.workflowId() + "-child-" + commandId;
        String childRunId = deterministicUuid(runKey.runId() + ":child:" + commandId).toString();
        String queue = spec.taskQueue() != null ? spec.taskQueue() : history.taskQueue();
        issue(EventType.CHILD_WORKFLOW_STARTED, spec.workflowType(), id -> new Decision.StartChildWorkflow(
                id, childWorkflowId, childRunId, spec.workflowType(), converter.toPayload(spec.input()),
                queue, spec.runTimeout()));
        if (commandId < history.commandCount()) {
            HistoryEvent recorded = history.command(commandId);
            return new ChildPromise<>(commandId, recorded.getString(HistoryEvents.CHILD_WORKFLOW_ID),
                    recorded.getString(HistoryEvents.CHILD_RUN_ID), resultType);
        }
        return new ChildPromise<>(commandId, childWorkflowId, childRunId, resultType);
    }

    @Override
    public <T> JoinResult<T> join(List<? extends Promise<T>> members, JoinPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(members, "members");
        List<ReplayPromise<T>> own = new ArrayList<>(members.size());
        for (Promise<T> member : members) {
            own.add(own(member));
        }

        if (policy == JoinPolicy.FAIL_FAST) {
            int failedIndex = -1;
            long failedSeq = Long.MAX_VALUE;
            for (int i = 0; i < own.size(); i++) {
                HistoryEvent outcome = own.get(i).outcome();
                if (outcome != null && own.get(i).isFailure(outcome) && outcome.seq() < failedSeq) {
                    failedIndex = i;
                    failedSeq = outcome.seq();
                }
            }
            if (failedIndex >= 0) {
                observe(own.get(failedIndex).outcome());
                for (ReplayPromise<T> member : own) {
                    HistoryEvent outcome = member.outcome();
                    boolean pendingAtFailure = outcome == null || outcome.seq() > failedSeq;
                    if (pendingAtFailure && member instanceof ChildPromise<T> child) {
                        requestCancel(child);
                    }
                }
                throw new JoinFailedException(failedIndex, own.get(failedIndex).failure(own.get(failedIndex).outcome()));
            }
        }

        for (ReplayPromise<T> member : own) {
            if (member.outcome() == null) throw WorkflowBlockedError.INSTANCE;
        }
        List<JoinOutcome<T>> outcomes = new ArrayList<>(own.size());
        for (int i = 0; i < own.size(); i++) {
            ReplayPromise<T> member = own.get(i);
            HistoryEvent outcome = observe(member.outcome());
            outcomes.add(member.isFailure(outcome)
                    ? JoinOutcome.failure(i, member.failure(outcome))
                    : JoinOutcome.success(i, member.value(outcome)));
        }
        return new JoinResult<>(outcomes);
    }

    private void requestCancel(ChildPromise<?> child) {
        if (!cancelIssued.add(child.commandId)) return;
        issue(EventType.CHILD_WORKFLOW_CANCEL_REQUESTED, String.valueOf(child.commandId),
                id -> new Decision.RequestCancelChild(id, child.commandId, child.childWorkflowId, child.childRunId));
    }

    // ── Run control ───────────────────────────────────────────────

    @Override
    public void continueAsNew(Object input) {
        throw new ContinueAsNewRequest(converter.toPayload(input));
    }

    @Override
    public void registerQuery(String queryName, Supplier<?> handler) {
        queryHandlers.put(Objects.requireNonNull(queryName, "queryName"), Objects.requireNonNull(handler, "handler"));
    }

    // ── Replay bookkeeping ────────────────────────────────────────

    private int issue(EventType type, String name, IntFunction<Decision> decision) {
        int commandId = nextCommandId++;
        if (commandId < history.commandCount()) {
            HistoryEvent recorded = history.command(commandId);
            String recordedName = HistoryIndex.commandName(recorded);
            if (recorded.type() != type || !Objects.equals(name, recordedName)) {
                throw new NonDeterminismException(runKey, commandId,
                        "workflow issued " + describe(type, name) + " but history recorded "
                                + describe(recorded.type(), recordedName));
            }
            return commandId;
        }
        decisions.add(decision.apply(commandId));
        return commandId;
    }

    /**
     * Every command recorded in history must have been issued again by the
     * time the logic stops.
     */
    void verifyReplayed(String stopReason) {
        if (nextCommandId < history.commandCount()) {
            HistoryEvent missing = history.command(nextCommandId);
            throw new NonDeterminismException(runKey, nextCommandId,
                    "workflow " + stopReason + " without issuing recorded "
                            + describe(missing.type(), HistoryIndex.commandName(missing)));
        }
    }

    void addDecision(Decision decision) {
        decisions.add(decision);
    }

    int nextCommandId() {
        return nextCommandId;
    }

    List<Decision> decisions() {
        return decisions;
    }

    Map<String, Supplier<?>> queryHandlers() {
        return queryHandlers;
    }

    private HistoryEvent observe(HistoryEvent event) {
        if (event.timestamp().isAfter(currentTime)) {
            currentTime = event.timestamp();
        }
        return event;
    }

    @SuppressWarnings("unchecked")
    private <T> ReplayPromise<T> own(Promise<T> promise) {
        if (promise instanceof ReplayPromise<?> replay && replay.owner() == this) {
            return (ReplayPromise<T>) replay;
        }
        throw new IllegalArgumentException("Promise was not created by this workflow context");
    }

    private static String describe(EventType type, String name) {
        return name != null ? type + "(" + name + ")" : type.toString();
    }

    static UUID deterministicUuid(String seed) {
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    // ── Promises ──────────────────────────────────────────────────

    private abstract class ReplayPromise<T> implements Promise<T> {

        abstract HistoryEvent outcome();

        abstract T value(HistoryEvent outcome);

        abstract DurableException failure(HistoryEvent outcome);

        boolean isFailure(HistoryEvent outcome) {
            return outcome.type() != EventType.ACTIVITY_COMPLETED
                    && outcome.type() != EventType.CHILD_WORKFLOW_COMPLETED
                    && outcome.type() != EventType.TIMER_FIRED
                    && outcome.type() != EventType.SIGNAL_RECEIVED;
        }

        ReplayContext owner() {
            return ReplayContext.this;
        }

        @Override
        public T get() {
            HistoryEvent outcome = outcome();
            if (outcome == null) throw WorkflowBlockedError.INSTANCE;
            observe(outcome);
            if (isFailure(outcome)) throw failure(outcome);
            return value(outcome);
        }

        @Override
        public boolean isDone() {
            return outcome() != null;
        }
    }

    private abstract class CommandPromise<T> extends ReplayPromise<T> {
        final int commandId;

        CommandPromise(int commandId) {
            this.commandId = commandId;
        }

        @Override
        HistoryEvent outcome() {
            return history.outcome(commandId);
        }
    }

    private final class ActivityPromise<T> extends CommandPromise<T> {
        private final String activityName;
        private final Class<T> resultType;

        ActivityPromise(int commandId, String activityName, Class<T> resultType) {
            super(commandId);
            this.activityName = activityName;
            this.resultType = resultType;
        }

        @Override
        T value(HistoryEvent outcome) {
            return converter.fromPayload(outcome.get(HistoryEvents.RESULT), resultType);
        }

        @Override
        DurableException failure(HistoryEvent outcome) {
            int attempts = outcome.get(HistoryEvents.ATTEMPT) != null ? outcome.getInt(HistoryEvents.ATTEMPT) : 1;
            if (outcome.type() == EventType.ACTIVITY_TIMED_OUT) {
                String timeoutType = outcome.getString(HistoryEvents.TIMEOUT_TYPE);
                return new ActivityFailureException(activityName, "ActivityTimeout",
                        timeoutType + " timeout exceeded", attempts, true);
            }
            Failure failure = HistoryEvents.failure(outcome);
            return new ActivityFailureException(activityName, failure.type(), failure.message(), attempts, false);
        }
    }

    private final class TimerPromise extends CommandPromise<Void> {

        TimerPromise(int commandId) {
            super(commandId);
        }

        @Override
        Void value(HistoryEvent outcome) {
            return null;
        }

        @Override
        DurableException failure(HistoryEvent outcome) {
            throw new IllegalStateException("Timers cannot fail");
        }
    }

    private final class ChildPromise<T> extends CommandPromise<T> implements ChildHandle<T> {
        private final String childWorkflowId;
        private final String childRunId;
        private final Class<T> resultType;

        ChildPromise(int commandId, String childWorkflowId, String childRunId, Class<T> resultType) {
            super(commandId);
            this.childWorkflowId = childWorkflowId;
            this.childRunId = childRunId;
            this.resultType = resultType;
        }

        @Override
        public String childWorkflowId() {
            return childWorkflowId;
        }

        @Override
        public String childRunId() {
            return childRunId;
        }

        @Override
        T value(HistoryEvent outcome) {
            return converter.fromPayload(outcome.get(HistoryEvents.RESULT), resultType);
        }

        @Override
        DurableException failure(HistoryEvent outcome) {
            Failure failure = HistoryEvents.failure(outcome);
            return new ChildWorkflowFailureException(childWorkflowId, failure.type(), failure.message());
        }
    }

    private final class SignalPromise<T> extends ReplayPromise<T> {
        private final String signalName;
        private final int ordinal;
        private final Class<T> payloadType;

        SignalPromise(String signalName, int ordinal, Class<T> payloadType) {
            this.signalName = signalName;
            this.ordinal = ordinal;
            this.payloadType = payloadType;
        }

        @Override
        HistoryEvent outcome() {
            return history.signal(signalName, ordinal);
        }

        @Override
        T value(HistoryEvent outcome) {
            return converter.fromPayload(outcome.get(HistoryEvents.SIGNAL_PAYLOAD), payloadType);
        }

        @Override
        DurableException failure(HistoryEvent outcome) {
            throw new IllegalStateException("Signals cannot fail");
        }
    }
}

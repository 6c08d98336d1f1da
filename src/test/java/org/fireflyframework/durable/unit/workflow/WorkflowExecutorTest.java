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


package org.fireflyframework.durable.unit.workflow;

import org.fireflyframework.durable.core.exception.ActivityFailureException;
import org.fireflyframework.durable.core.exception.NonDeterminismException;
import org.fireflyframework.durable.core.exception.WorkflowExecutionException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.history.PendingEvent;
import org.fireflyframework.durable.core.model.JoinPolicy;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.workflow.ChildHandle;
import org.fireflyframework.durable.workflow.ChildWorkflowSpec;
import org.fireflyframework.durable.workflow.Promise;
import org.fireflyframework.durable.workflow.child.JoinResult;
import org.fireflyframework.durable.workflow.engine.Decision;
import org.fireflyframework.durable.workflow.engine.ReplayResult;
import org.fireflyframework.durable.workflow.engine.WorkflowExecutor;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class WorkflowExecutorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final RunKey RUN = RunKey.of("research-1", "run-1");

    private static final WorkflowDefinition<String, String> RESEARCH = WorkflowDefinition.<String, String>of(
            "research", String.class, () -> (ctx, topic) -> {
                String results = ctx.executeActivity("search", topic, String.class);
                ctx.sleep(Duration.ofMinutes(1));
                return ctx.executeActivity("summarize", results, String.class);
            });

    private WorkflowExecutor executor;
    private List<HistoryEvent> history;

    @BeforeEach
    void setUp() {
        executor = new WorkflowExecutor(new PayloadConverter());
        history = new ArrayList<>();
        record(HistoryEvents.workflowStarted("research", "quantum", "default", null, null, null));
    }

    // ── Replay of a linear workflow ───────────────────────────────

    @Test
    void firstCycle_schedulesFirstActivity() {
        ReplayResult result = executor.decide(RESEARCH, RUN, history);

        assertThat(result.decisions()).containsExactly(
                new Decision.ScheduleActivity(0, "search", "quantum", "default", null, null, null));
        assertThat(result.isTerminal()).isFalse();
    }

    @Test
    void pendingActivity_producesNoNewDecisions() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));

        assertThat(executor.decide(RESEARCH, RUN, history).decisions()).isEmpty();
    }

    @Test
    void completedActivity_leadsToTimerRelativeToWorkflowTime() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        HistoryEvent completed = record(HistoryEvents.activityCompleted(0, "3 papers", 1));

        ReplayResult result = executor.decide(RESEARCH, RUN, history);

        assertThat(result.decisions()).containsExactly(
                new Decision.StartTimer(1, completed.timestamp().plus(Duration.ofMinutes(1)), Duration.ofMinutes(1)));
        assertThat(result.workflowTime()).isEqualTo(completed.timestamp());
    }

    @Test
    void fullyRecordedCommands_completeWithResult() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.activityCompleted(0, "3 papers", 1));
        record(HistoryEvents.timerStarted(1, T0.plusSeconds(62), Duration.ofMinutes(1)));
        record(HistoryEvents.timerFired(1));
        record(HistoryEvents.activityScheduled(2, "summarize", "3 papers", "default", null, null, null));
        record(HistoryEvents.activityCompleted(2, "summary", 1));

        ReplayResult result = executor.decide(RESEARCH, RUN, history);

        assertThat(result.decisions()).containsExactly(new Decision.CompleteWorkflow("summary"));
        assertThat(result.isTerminal()).isTrue();
    }

    @Test
    void decide_isPureForSameHistory() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.activityCompleted(0, "3 papers", 1));

        assertThat(executor.decide(RESEARCH, RUN, history).decisions())
                .isEqualTo(executor.decide(RESEARCH, RUN, history).decisions());
    }

    @Test
    void closedRun_hasNothingToDecide() {
        record(HistoryEvents.workflowCompleted("done"));

        assertThat(executor.decide(RESEARCH, RUN, history).decisions()).isEmpty();
    }

    // ── Non-determinism ───────────────────────────────────────────

    @Test
    void divergingCommand_isRejected() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        var changed = WorkflowDefinition.<String, String>of("research", String.class,
                () -> (ctx, topic) -> ctx.executeActivity("lookup", topic, String.class));

        assertThatThrownBy(() -> executor.decide(changed, RUN, history))
                .isInstanceOf(NonDeterminismException.class)
                .satisfies(e -> assertThat(((NonDeterminismException) e).getCommandId()).isZero())
                .hasMessageContaining("lookup")
                .hasMessageContaining("search");
    }

    @Test
    void commandKindMismatch_isRejected() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        var changed = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            ctx.sleep(Duration.ofSeconds(5));
            return topic;
        });

        assertThatThrownBy(() -> executor.decide(changed, RUN, history))
                .isInstanceOf(NonDeterminismException.class);
    }

    @Test
    void finishingWithoutReissuingRecordedCommands_isRejected() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        var changed = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> topic);

        assertThatThrownBy(() -> executor.decide(changed, RUN, history))
                .isInstanceOf(NonDeterminismException.class)
                .hasMessageContaining("completed without issuing");
    }

    // ── Failures ──────────────────────────────────────────────────

    @Test
    void activityFailure_isCatchableByWorkflowCode() {
        var tolerant = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            try {
                return ctx.executeActivity("search", topic, String.class);
            } catch (ActivityFailureException e) {
                return "fallback:" + e.getErrorType() + ":" + e.getAttempts();
            }
        });
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.activityFailed(0, Failure.of("SearchUnavailable", "503"), 3));

        assertThat(executor.decide(tolerant, RUN, history).decisions())
                .containsExactly(new Decision.CompleteWorkflow("fallback:SearchUnavailable:3"));
    }

    @Test
    void uncaughtActivityTimeout_failsTheWorkflow() {
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.activityTimedOut(0, HistoryEvents.START_TO_CLOSE, 1));

        Decision terminal = executor.decide(RESEARCH, RUN, history).terminalDecision();

        assertThat(terminal).isInstanceOf(Decision.FailWorkflow.class);
        Failure failure = ((Decision.FailWorkflow) terminal).failure();
        assertThat(failure.type()).isEqualTo("DURABLE_ACTIVITY_TIMED_OUT");
        assertThat(failure.message()).contains("START_TO_CLOSE");
    }

    @Test
    void workflowExecutionException_failsWithItsErrorType() {
        var strict = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            throw new WorkflowExecutionException("EmptyTopic", "topic must not be blank");
        });

        Decision terminal = executor.decide(strict, RUN, history).terminalDecision();

        assertThat(terminal).isEqualTo(new Decision.FailWorkflow(
                new Failure("EmptyTopic", "topic must not be blank", true)));
    }

    @Test
    void inputOfWrongShape_failsTheWorkflow() {
        history.clear();
        record(HistoryEvents.workflowStarted("inc", "not-a-number", "default", null, null, null));
        var inc = WorkflowDefinition.<Integer, Integer>of("inc", Integer.class, () -> (ctx, n) -> n + 1);

        Decision terminal = executor.decide(inc, RUN, history).terminalDecision();

        assertThat(terminal).isInstanceOf(Decision.FailWorkflow.class);
        assertThat(((Decision.FailWorkflow) terminal).failure().message()).contains(Integer.class.getName());
    }

    @Test
    void failingWorkflowFactory_failsTheWorkflow() {
        var broken = WorkflowDefinition.<String, String>of("research", String.class, () -> {
            throw new IllegalStateException("no collaborator wired");
        });

        Decision terminal = executor.decide(broken, RUN, history).terminalDecision();

        assertThat(terminal).isEqualTo(new Decision.FailWorkflow(
                new Failure("IllegalStateException", "no collaborator wired", false)));
    }

    @Test
    void errorThrownByWorkflowCode_failsTheWorkflow() {
        var asserting = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            throw new AssertionError("topic checked too late");
        });

        Decision terminal = executor.decide(asserting, RUN, history).terminalDecision();

        assertThat(terminal).isEqualTo(new Decision.FailWorkflow(
                new Failure("AssertionError", "topic checked too late", false)));
    }

    // ── Cancellation ──────────────────────────────────────────────

    @Test
    void cancelRequest_cancelsOutstandingChildrenThenTheRun() {
        record(HistoryEvents.childWorkflowStarted(0, "research-1-child-0", "child-run", "section", "intro", "default", null));
        record(HistoryEvents.cancelRequested("user abort"));

        ReplayResult result = executor.decide(RESEARCH, RUN, history);

        assertThat(result.decisions()).containsExactly(
                new Decision.RequestCancelChild(1, 0, "research-1-child-0", "child-run"),
                new Decision.CancelWorkflow("user abort"));
    }

    @Test
    void cancelRequest_skipsClosedAndAlreadyCancelledChildren() {
        record(HistoryEvents.childWorkflowStarted(0, "c0", "r0", "section", null, "default", null));
        record(HistoryEvents.childWorkflowStarted(1, "c1", "r1", "section", null, "default", null));
        record(HistoryEvents.childWorkflowCancelRequested(2, 1, "c1", "r1"));
        record(HistoryEvents.childWorkflowCompleted(0, "c0", "done"));
        record(HistoryEvents.cancelRequested("stop"));

        assertThat(executor.decide(RESEARCH, RUN, history).decisions())
                .containsExactly(new Decision.CancelWorkflow("stop"));
    }

    // ── Fan-out and joins ─────────────────────────────────────────

    @Test
    void fanOut_startsChildrenWithDeterministicIds() {
        ReplayResult result = executor.decide(fanOut(JoinPolicy.COLLECT_ALL), RUN, history);

        assertThat(result.decisions()).hasSize(3).allSatisfy(d -> assertThat(d).isInstanceOf(Decision.StartChildWorkflow.class));
        var first = (Decision.StartChildWorkflow) result.decisions().get(0);
        assertThat(first.childWorkflowId()).isEqualTo("research-1-child-0");
        assertThat(first.childRunId()).isEqualTo(uuid("run-1:child:0"));
        assertThat(first.workflowType()).isEqualTo("section");
        assertThat(first.input()).isEqualTo("s0");
        assertThat(((Decision.StartChildWorkflow) result.decisions().get(2)).childWorkflowId())
                .isEqualTo("research-1-child-2");
    }

    @Test
    void collectAll_waitsForEveryMemberAndReportsByIndex() {
        recordChildren(3);
        record(HistoryEvents.childWorkflowCompleted(2, "research-1-child-2", "r2"));
        record(HistoryEvents.childWorkflowFailed(1, "research-1-child-1", Failure.of("Boom", "broken")));

        assertThat(executor.decide(fanOut(JoinPolicy.COLLECT_ALL), RUN, history).decisions()).isEmpty();

        record(HistoryEvents.childWorkflowCompleted(0, "research-1-child-0", "r0"));

        assertThat(executor.decide(fanOut(JoinPolicy.COLLECT_ALL), RUN, history).decisions())
                .containsExactly(new Decision.CompleteWorkflow("r0,failed:1,r2"));
    }

    @Test
    void failFast_cancelsMembersStillPendingAndFailsJoin() {
        recordChildren(3);
        record(HistoryEvents.childWorkflowCompleted(0, "research-1-child-0", "r0"));
        record(HistoryEvents.childWorkflowFailed(1, "research-1-child-1", Failure.of("Boom", "broken")));

        ReplayResult result = executor.decide(fanOut(JoinPolicy.FAIL_FAST), RUN, history);

        assertThat(result.decisions()).hasSize(2);
        assertThat(result.decisions().get(0))
                .isEqualTo(new Decision.RequestCancelChild(3, 2, "research-1-child-2", uuid("run-1:child:2")));
        Failure failure = ((Decision.FailWorkflow) result.decisions().get(1)).failure();
        assertThat(failure.type()).isEqualTo("DURABLE_JOIN_FAILED");
        assertThat(failure.message()).contains("index 1");
    }

    @Test
    void failFast_replayWithRecordedCancel_doesNotRequestItAgain() {
        recordChildren(3);
        record(HistoryEvents.childWorkflowFailed(1, "research-1-child-1", Failure.of("Boom", "broken")));
        record(HistoryEvents.childWorkflowCancelRequested(3, 0, "research-1-child-0", uuid("run-1:child:0")));
        record(HistoryEvents.childWorkflowCancelRequested(4, 2, "research-1-child-2", uuid("run-1:child:2")));
        // a late outcome of a cancelled member does not change the decision
        record(HistoryEvents.childWorkflowCompleted(0, "research-1-child-0", "r0"));

        List<Decision> decisions = executor.decide(fanOut(JoinPolicy.FAIL_FAST), RUN, history).decisions();

        assertThat(decisions).singleElement().isInstanceOf(Decision.FailWorkflow.class);
    }

    @Test
    void awaitAny_returnsMemberResolvedFirstInHistory() {
        var race = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            Promise<String> primary = ctx.scheduleActivity("search", topic, String.class);
            Promise<Void> deadline = ctx.startTimer(Duration.ofSeconds(30));
            int winner = ctx.awaitAny(List.of(primary, deadline));
            return winner == 0 ? primary.get() : "timed out";
        });

        assertThat(executor.decide(race, RUN, history).decisions()).hasSize(2);

        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.timerStarted(1, T0.plusSeconds(30), Duration.ofSeconds(30)));
        assertThat(executor.decide(race, RUN, history).decisions()).isEmpty();

        record(HistoryEvents.timerFired(1));
        record(HistoryEvents.activityCompleted(0, "late results", 1));

        assertThat(executor.decide(race, RUN, history).decisions())
                .containsExactly(new Decision.CompleteWorkflow("timed out"));
    }

    // ── Signals, queries and run control ──────────────────────────

    @Test
    void signals_areConsumedInArrivalOrderPerName() {
        var approvals = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            String first = ctx.awaitSignal("approve", String.class).get();
            String second = ctx.awaitSignal("approve", String.class).get();
            return first + "+" + second;
        });
        record(HistoryEvents.signalReceived("reject", "nope"));
        record(HistoryEvents.signalReceived("approve", "alice"));

        assertThat(executor.decide(approvals, RUN, history).decisions()).isEmpty();

        record(HistoryEvents.signalReceived("approve", "bob"));

        assertThat(executor.decide(approvals, RUN, history).decisions())
                .containsExactly(new Decision.CompleteWorkflow("alice+bob"));
    }

    @Test
    void queryHandlers_areCollectedFromReplay() {
        var queryable = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            String[] stage = {"searching"};
            ctx.registerQuery("stage", () -> stage[0]);
            String results = ctx.executeActivity("search", topic, String.class);
            stage[0] = "summarizing";
            return ctx.executeActivity("summarize", results, String.class);
        });
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.activityCompleted(0, "papers", 1));

        ReplayResult result = executor.replay(queryable, RUN, history);

        assertThat(result.queryHandlers()).containsKey("stage");
        assertThat(result.queryHandlers().get("stage").get()).isEqualTo("summarizing");
    }

    @Test
    void continueAsNew_carriesNewInputToDeterministicSuccessor() {
        var counter = WorkflowDefinition.<Integer, Integer>of("counter", Integer.class, () -> (ctx, n) -> {
            if (n < 3) {
                ctx.continueAsNew(n + 1);
            }
            return n;
        });
        List<HistoryEvent> counterHistory = List.of(HistoryEvents.workflowStarted("counter", 1, "default", null, null, null)
                .toHistoryEvent(0, T0));

        ReplayResult result = executor.decide(counter, RUN, counterHistory);

        assertThat(result.decisions()).containsExactly(new Decision.ContinueAsNew(uuid("run-1:continue"), 2));
    }

    @Test
    void randomUuid_isStablePerRunAndDistinctPerCall() {
        var ids = WorkflowDefinition.<String, String>of("research", String.class,
                () -> (ctx, topic) -> ctx.randomUuid() + "," + ctx.randomUuid());

        var first = (Decision.CompleteWorkflow) executor.decide(ids, RUN, history).terminalDecision();
        var again = (Decision.CompleteWorkflow) executor.decide(ids, RUN, history).terminalDecision();
        var otherRun = (Decision.CompleteWorkflow) executor.decide(ids, RunKey.of("research-1", "run-2"), history)
                .terminalDecision();

        String[] parts = ((String) first.result()).split(",");
        assertThat(parts[0]).isNotEqualTo(parts[1]);
        assertThat(first).isEqualTo(again);
        assertThat(otherRun).isNotEqualTo(first);
    }

    @Test
    void isReplaying_isTrueOnlyWhileReissuingRecordedCommands() {
        List<Boolean> observed = new CopyOnWriteArrayList<>();
        var probe = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            observed.add(ctx.isReplaying());
            String results = ctx.executeActivity("search", topic, String.class);
            observed.add(ctx.isReplaying());
            return results;
        });
        record(HistoryEvents.activityScheduled(0, "search", "quantum", "default", null, null, null));
        record(HistoryEvents.activityCompleted(0, "papers", 1));

        executor.decide(probe, RUN, history);

        assertThat(observed).containsExactly(true, false);
    }

    @Test
    void negativeTimer_failsTheWorkflow() {
        var broken = WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            ctx.sleep(Duration.ofSeconds(-1));
            return topic;
        });

        Decision terminal = executor.decide(broken, RUN, history).terminalDecision();

        assertThat(((Decision.FailWorkflow) terminal).failure().type()).isEqualTo("IllegalArgumentException");
    }

    private WorkflowDefinition<String, String> fanOut(JoinPolicy policy) {
        return WorkflowDefinition.<String, String>of("research", String.class, () -> (ctx, topic) -> {
            List<ChildWorkflowSpec> specs = List.of(
                    ChildWorkflowSpec.of("section", "s0"),
                    ChildWorkflowSpec.of("section", "s1"),
                    ChildWorkflowSpec.of("section", "s2"));
            List<ChildHandle<String>> handles = ctx.fanOut(specs, String.class);
            JoinResult<String> joined = ctx.join(handles, policy);
            return joined.outcomes().stream()
                    .map(o -> o.isSuccess() ? o.value() : "failed:" + o.index())
                    .collect(Collectors.joining(","));
        });
    }

    private void recordChildren(int count) {
        for (int i = 0; i < count; i++) {
            record(HistoryEvents.childWorkflowStarted(i, "research-1-child-" + i, uuid("run-1:child:" + i),
                    "section", "s" + i, "default", null));
        }
    }

    private HistoryEvent record(PendingEvent event) {
        int seq = history.size();
        HistoryEvent recorded = event.toHistoryEvent(seq, T0.plusSeconds(seq));
        history.add(recorded);
        return recorded;
    }

    private static String uuid(String seed) {
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}

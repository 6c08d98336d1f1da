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


package org.fireflyframework.durable.integration;

import org.fireflyframework.durable.activity.ActivityDefinition;
import org.fireflyframework.durable.client.WorkflowHandle;
import org.fireflyframework.durable.core.exception.WorkflowFailedException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.inbox.InMemoryRunInbox;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;
import org.fireflyframework.durable.support.DurableTestCluster;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Two live nodes whose workers poll the same queue. Whichever node completes
 * an activity, or receives a signal, the outcome reaches the node that holds
 * the run's lock.
 */
class MultiNodeIntegrationTest {

    private static final Duration RESULT_TIMEOUT = Duration.ofSeconds(15);

    private final AtomicBoolean failNextAcknowledge = new AtomicBoolean();
    private DurableTestCluster cluster;
    private DurableTestCluster.Node nodeA;
    private DurableTestCluster.Node nodeB;

    @BeforeEach
    void setUp() {
        cluster = new DurableTestCluster()
                .withInbox(new InMemoryRunInbox() {
                    @Override
                    public Mono<Void> acknowledge(RunKey runKey, Collection<String> entryIds) {
                        if (!entryIds.isEmpty() && failNextAcknowledge.compareAndSet(true, false)) {
                            return Mono.error(new IllegalStateException("inbox unavailable"));
                        }
                        return super.acknowledge(runKey, entryIds);
                    }
                })
                .activity(ActivityDefinition.<String, String>of("echo", String.class, (input, ctx) -> {
                    return Mono.delay(Duration.ofMillis(15)).thenReturn("echo " + input);
                }))
                .workflow(WorkflowDefinition.<String, String>of("one", String.class, () -> (ctx, input) ->
                        ctx.executeActivity("echo", input, String.class)))
                .workflow(WorkflowDefinition.<String, String>of("two-steps", String.class, () -> (ctx, input) -> {
                    String first = ctx.executeActivity("echo", input, String.class);
                    return ctx.executeActivity("echo", first, String.class);
                }))
                .workflow(WorkflowDefinition.<String, String>of("approval", String.class, () -> (ctx, input) ->
                        input + " approved by " + ctx.awaitSignal("approve", String.class).get()))
                .workflow(WorkflowDefinition.<String, String>of("two-approvals", String.class, () -> (ctx, input) -> {
                    String first = ctx.awaitSignal("approve", String.class).get();
                    String second = ctx.awaitSignal("approve", String.class).get();
                    return input + " approved by " + first + " and " + second;
                }))
                .workflow(WorkflowDefinition.<Integer, Integer>of("inc", Integer.class, () -> (ctx, n) -> n + 1));
        nodeA = cluster.startNode("node-a");
        nodeB = cluster.startNode("node-b");
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void runsStartedOnOneNode_completeWhenTheOtherNodeRunsTheirActivities() {
        List<WorkflowHandle> handles = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            handles.add(nodeA.client.startWorkflow("one", "item-" + i).block());
        }
        handles.add(nodeA.client.startWorkflow("two-steps", "pair").block());

        for (int i = 0; i < 8; i++) {
            assertThat(nodeA.client.getResult(handles.get(i), String.class, RESULT_TIMEOUT).block())
                    .isEqualTo("echo item-" + i);
        }
        assertThat(nodeA.client.getResult(handles.get(8), String.class, RESULT_TIMEOUT).block())
                .isEqualTo("echo echo pair");
        await().atMost(Duration.ofSeconds(5))
                .until(() -> cluster.inbox.hasPending(RunKey.of(handles.get(0).workflowId(), handles.get(0).runId()))
                        .map(pending -> !pending).block());
    }

    @Test
    void signalSentThroughOtherNode_reachesTheOwningNode() {
        WorkflowHandle handle = nodeA.client.startWorkflow("approval", "expense-7").block();
        RunKey runKey = RunKey.of(handle.workflowId(), handle.runId());
        await().atMost(Duration.ofSeconds(5)).until(() -> nodeA.engine.isDriving(runKey));

        assertThat(nodeB.client.signal(handle, "approve", "ada").block().delivered()).isTrue();

        assertThat(nodeA.client.getResult(handle, String.class, RESULT_TIMEOUT).block())
                .isEqualTo("expense-7 approved by ada");
    }

    @Test
    void cancelThroughOtherNode_closesRunOwnedElsewhere() {
        WorkflowHandle handle = nodeA.client.startWorkflow("approval", "expense-8").block();
        RunKey runKey = RunKey.of(handle.workflowId(), handle.runId());
        await().atMost(Duration.ofSeconds(5)).until(() -> nodeA.engine.isDriving(runKey));

        nodeB.client.cancel(handle, "withdrawn").block();

        await().atMost(RESULT_TIMEOUT)
                .until(() -> nodeA.client.describe(handle).block().status() == RunStatus.CANCELLED);
    }

    @Test
    void entryRecordedBeforeAcknowledgeFailed_isNotRecordedTwice() {
        WorkflowHandle handle = nodeA.client.startWorkflow("two-approvals", "expense-9").block();
        RunKey runKey = RunKey.of(handle.workflowId(), handle.runId());
        await().atMost(Duration.ofSeconds(5)).until(() -> nodeA.engine.isDriving(runKey));

        failNextAcknowledge.set(true);
        nodeA.client.signal(handle, "approve", "joan").block();
        await().atMost(Duration.ofSeconds(5)).until(() -> !failNextAcknowledge.get()
                && !cluster.inbox.hasPending(runKey).block());
        nodeA.client.signal(handle, "approve", "grace").block();

        assertThat(nodeA.client.getResult(handle, String.class, RESULT_TIMEOUT).block())
                .isEqualTo("expense-9 approved by joan and grace");
        assertThat(nodeA.client.history(handle).map(HistoryEvent::type)
                .filter(type -> type == EventType.SIGNAL_RECEIVED).count().block()).isEqualTo(2);
    }

    @Test
    void inputThatCannotBeConverted_failsTheRun() {
        WorkflowHandle handle = nodeA.client.startWorkflow("inc", "not-a-number").block();

        assertThatThrownBy(() -> nodeA.client.getResult(handle, Integer.class, RESULT_TIMEOUT).block())
                .isInstanceOf(WorkflowFailedException.class);
        assertThat(nodeA.client.describe(handle).block().status()).isEqualTo(RunStatus.FAILED);
    }
}

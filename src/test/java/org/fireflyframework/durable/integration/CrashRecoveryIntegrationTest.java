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
import org.fireflyframework.durable.client.StartWorkflowOptions;
import org.fireflyframework.durable.client.WorkflowHandle;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.support.DurableTestCluster;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Two engine nodes sharing one set of stores; node A dies mid-run and node B
 * takes the run over once A's lock lapses.
 */
class CrashRecoveryIntegrationTest {

    private static final Duration RESULT_TIMEOUT = Duration.ofSeconds(15);

    private final AtomicInteger charges = new AtomicInteger();
    private final AtomicInteger shipments = new AtomicInteger();
    private DurableTestCluster cluster;

    @BeforeEach
    void setUp() {
        cluster = new DurableTestCluster()
                .withLockTtl(Duration.ofMillis(600))
                .activity(ActivityDefinition.<String, String>of("charge", String.class, (order, ctx) -> {
                    charges.incrementAndGet();
                    return Mono.just("charged " + order);
                }))
                .activity(ActivityDefinition.<String, String>of("ship", String.class, (order, ctx) ->
                                shipments.incrementAndGet() == 1 ? Mono.<String>never() : Mono.just("shipped " + order))
                        .withStartToCloseTimeout(Duration.ofMillis(500)))
                .workflow(WorkflowDefinition.<String, String>of("fulfil", String.class, () -> (ctx, order) -> {
                    String charged = ctx.executeActivity("charge", order, String.class);
                    String shipped = ctx.executeActivity("ship", order, String.class);
                    return charged + ", " + shipped;
                }))
                .workflow(WorkflowDefinition.<Long, String>of("nap", Long.class, () -> (ctx, millis) -> {
                    ctx.sleep(Duration.ofMillis(millis));
                    return "rested";
                }));
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void crashedRun_resumesOnAnotherNode_withoutRepeatingCompletedActivity() {
        var nodeA = cluster.startNode("node-a");
        WorkflowHandle handle = nodeA.client.startWorkflow("fulfil", "order-1").block();
        await().atMost(Duration.ofSeconds(5)).until(() -> shipments.get() == 1);

        nodeA.crash();
        var nodeB = cluster.startNode("node-b");
        nodeB.recovery.schedule(nodeB.scheduler, Duration.ofMillis(100));

        String result = nodeB.client.getResult(handle, String.class, RESULT_TIMEOUT).block();

        assertThat(result).isEqualTo("charged order-1, shipped order-1");
        assertThat(charges).hasValue(1);
        assertThat(shipments).hasValue(2);
        List<EventType> types = nodeB.client.history(handle).map(HistoryEvent::type).collectList().block();
        assertThat(types).filteredOn(t -> t == EventType.ACTIVITY_COMPLETED).hasSize(2);
        assertThat(types).filteredOn(t -> t == EventType.ACTIVITY_SCHEDULED).hasSize(2);
    }

    @Test
    void pendingTimer_isRearmedByRecoveringNode() {
        var nodeA = cluster.startNode("node-a");
        WorkflowHandle handle = nodeA.client.startWorkflow("nap", 800L).block();
        await().atMost(Duration.ofSeconds(5)).until(() -> nodeA.client.history(handle)
                .any(e -> e.type() == EventType.TIMER_STARTED).block());

        nodeA.crash();
        var nodeB = cluster.startNode("node-b");
        nodeB.recovery.schedule(nodeB.scheduler, Duration.ofMillis(100));

        assertThat(nodeB.client.getResult(handle, String.class, RESULT_TIMEOUT).block()).isEqualTo("rested");
        assertThat(nodeB.client.history(handle).filter(e -> e.type() == EventType.TIMER_FIRED).count().block())
                .isEqualTo(1);
    }

    @Test
    void liveLock_keepsOtherNodeFromWritingTheRun() {
        var nodeA = cluster.startNode("node-a");
        var nodeB = cluster.startNodeWithoutWorker("node-b");
        WorkflowHandle handle = nodeA.client.startWorkflow("nap", 600L, StartWorkflowOptions.withId("nap-1")).block();
        RunKey runKey = RunKey.of(handle.workflowId(), handle.runId());
        await().atMost(Duration.ofSeconds(5)).until(() -> nodeA.engine.isDriving(runKey));

        assertThat(nodeB.recovery.recoverOrphanedRuns().block()).isZero();
        AtomicBoolean takenOver = new AtomicBoolean();
        await().atMost(Duration.ofSeconds(5)).pollInterval(Duration.ofMillis(25)).until(() -> {
            boolean driving = nodeB.engine.isDriving(runKey);
            if (nodeA.client.describe(handle).block().status().isTerminal()) return true;
            if (driving) takenOver.set(true);
            nodeB.engine.wake(runKey);
            return false;
        });

        assertThat(takenOver).isFalse();
        List<HistoryEvent> history = nodeA.client.history(handle).collectList().block();
        assertThat(history).extracting(HistoryEvent::seq)
                .containsExactlyElementsOf(LongStream.range(0, history.size()).boxed().toList());
        assertThat(history).filteredOn(e -> e.type() == EventType.TIMER_STARTED).hasSize(1);
        assertThat(nodeA.client.getResult(handle, String.class, RESULT_TIMEOUT).block()).isEqualTo("rested");
    }

    @Test
    void gracefulShutdown_releasesLocksForImmediateTakeover() {
        var nodeA = cluster.startNode("node-a");
        WorkflowHandle handle = nodeA.client.startWorkflow("nap", 300L).block();
        RunKey runKey = RunKey.of(handle.workflowId(), handle.runId());
        await().atMost(Duration.ofSeconds(5)).until(() -> nodeA.engine.isDriving(runKey));

        nodeA.close();

        assertThat(cluster.locks.current(runKey).block()).isEmpty();
        var nodeB = cluster.startNode("node-b");
        assertThat(nodeB.recovery.recoverOrphanedRuns().block()).isEqualTo(1L);
        assertThat(nodeB.client.getResult(handle, String.class, RESULT_TIMEOUT).block()).isEqualTo("rested");
    }
}

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
import org.fireflyframework.durable.core.dlq.DeadLetterEntry;
import org.fireflyframework.durable.core.exception.NonDeterminismException;
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

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class NonDeterminismIntegrationTest {

    private static final WorkflowDefinition<String, String> ORIGINAL = WorkflowDefinition.<String, String>of(
            "invoice", String.class, () -> (ctx, customer) -> {
                String draft = ctx.executeActivity("draft", customer, String.class);
                String approver = ctx.awaitSignal("approve", String.class).get();
                return draft + " approved by " + approver;
            });

    private static final WorkflowDefinition<String, String> REORDERED = WorkflowDefinition.<String, String>of(
            "invoice", String.class, () -> (ctx, customer) -> {
                String approver = ctx.awaitSignal("approve", String.class).get();
                ctx.sleep(Duration.ofMillis(10));
                return ctx.executeActivity("draft", customer, String.class) + " approved by " + approver;
            });

    private DurableTestCluster cluster;
    private DurableTestCluster.Node node;

    @BeforeEach
    void setUp() {
        cluster = new DurableTestCluster()
                .activity(ActivityDefinition.<String, String>of("draft", String.class,
                        (customer, ctx) -> Mono.just("invoice for " + customer)))
                .workflow(ORIGINAL);
        node = cluster.startNode("node-a");
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void changedWorkflowCode_haltsRunIntoDeadLetters_untilReleased() {
        WorkflowHandle handle = node.client.startWorkflow("invoice", "acme", StartWorkflowOptions.withId("invoice-1")).block();
        RunKey runKey = RunKey.of(handle.workflowId(), handle.runId());
        await().atMost(Duration.ofSeconds(5)).until(() -> node.client.history(handle)
                .any(e -> e.type() == EventType.ACTIVITY_COMPLETED).block());

        cluster.workflows.unregister("invoice");
        cluster.workflows.register(REORDERED);
        node.client.signal(handle, "approve", "finance").block();

        await().atMost(Duration.ofSeconds(5)).until(() -> node.deadLetters.isDeadLettered(runKey).block());
        DeadLetterEntry entry = node.deadLetters.getEntry(runKey).block();
        assertThat(entry).isNotNull();
        assertThat(entry.workflowType()).isEqualTo("invoice");
        assertThat(entry.commandId()).isZero();
        assertThat(entry.errorType()).isEqualTo(NonDeterminismException.class.getName());
        assertThat(entry.errorMessage()).contains("history recorded");
        await().atMost(Duration.ofSeconds(5)).until(() -> node.client.history(handle)
                .any(e -> e.type() == EventType.SIGNAL_RECEIVED).block());
        assertThat(node.client.describe(handle).block().status()).isEqualTo(RunStatus.RUNNING);
        assertThat(node.client.history(handle).filter(e -> e.type() == EventType.TIMER_STARTED).count().block()).isZero();
        assertThat(node.recovery.recoverOrphanedRuns().block()).isZero();

        cluster.workflows.unregister("invoice");
        cluster.workflows.register(ORIGINAL);
        DeadLetterEntry released = node.deadLetters.release(runKey).block();
        node.engine.resume(released.runKey()).block();

        assertThat(node.client.getResult(handle, String.class, Duration.ofSeconds(10)).block())
                .isEqualTo("invoice for acme approved by finance");
        assertThat(released.isReleased()).isTrue();
        assertThat(node.deadLetters.count().block()).isZero();
    }
}

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


package org.fireflyframework.durable.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.durable.activity.ActivityDefinition;
import org.fireflyframework.durable.activity.ActivityRegistry;
import org.fireflyframework.durable.client.WorkflowClient;
import org.fireflyframework.durable.client.WorkflowHandle;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.eventlog.FileEventLog;
import org.fireflyframework.durable.core.eventlog.InMemoryEventLog;
import org.fireflyframework.durable.core.health.DurableHealthIndicator;
import org.fireflyframework.durable.core.inbox.InMemoryRunInbox;
import org.fireflyframework.durable.core.inbox.RunInbox;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.CompositeDurableEvents;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.observability.DurableLoggerEvents;
import org.fireflyframework.durable.core.observability.DurableMetrics;
import org.fireflyframework.durable.core.recovery.RecoveryService;
import org.fireflyframework.durable.core.resilience.ResilientEventLog;
import org.fireflyframework.durable.core.scheduling.DurableScheduler;
import org.fireflyframework.durable.worker.ActivityWorker;
import org.fireflyframework.durable.worker.rest.WorkerController;
import org.fireflyframework.durable.workflow.engine.EngineSettings;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import org.fireflyframework.durable.workflow.rest.WorkflowController;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DurableAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DurablePersistenceAutoConfiguration.class,
                    DurableMetricsAutoConfiguration.class,
                    DurableAutoConfiguration.class));

    @Test
    void defaults_wireInMemoryEngineWithWorkerRecoveryAndDeadLetters() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(WorkflowEngine.class);
            assertThat(context).hasSingleBean(WorkflowClient.class);
            assertThat(context).hasSingleBean(ActivityWorker.class);
            assertThat(context).hasSingleBean(RecoveryService.class);
            assertThat(context).hasSingleBean(DeadLetterService.class);
            assertThat(context).doesNotHaveBean(DurableMetrics.class);
            assertThat(context.getBean(EventLog.class)).isInstanceOf(InMemoryEventLog.class);
            assertThat(context.getBean(RunInbox.class)).isInstanceOf(InMemoryRunInbox.class);
            assertThat(context.getBean(DurableEvents.class)).isInstanceOf(DurableLoggerEvents.class);
            assertThat(context.getBean(DurableScheduler.class).isScheduled(DurableEngineLifecycle.TIMEOUT_SWEEP_TASK)).isTrue();
        });
    }

    @Test
    void engineProperties_bindIntoEngineSettings() {
        contextRunner
                .withPropertyValues(
                        "firefly.durable.engine.holder-id=node-7",
                        "firefly.durable.engine.lock-ttl=10s",
                        "firefly.durable.activity.default-start-to-close-timeout=45s",
                        "firefly.durable.activity.retry.max-attempts=4",
                        "firefly.durable.activity.retry.non-retryable-error-types=InvalidInput,Forbidden")
                .run(context -> {
                    EngineSettings settings = context.getBean(EngineSettings.class);
                    assertThat(settings.holderId()).isEqualTo("node-7");
                    assertThat(settings.lockTtl()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(settings.defaultStartToCloseTimeout()).isEqualTo(Duration.ofSeconds(45));
                    assertThat(settings.defaultRetryPolicy().maxAttempts()).isEqualTo(4);
                    assertThat(settings.defaultRetryPolicy().nonRetryableErrorTypes())
                            .containsExactlyInAnyOrder("InvalidInput", "Forbidden");
                });
    }

    @Test
    void toggles_disableWorkerRecoveryAndDeadLetters() {
        contextRunner
                .withPropertyValues(
                        "firefly.durable.worker.enabled=false",
                        "firefly.durable.recovery.enabled=false",
                        "firefly.durable.dlq.enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(ActivityWorker.class);
                    assertThat(context).doesNotHaveBean(RecoveryService.class);
                    assertThat(context).doesNotHaveBean(DeadLetterService.class);
                    assertThat(context).hasSingleBean(WorkflowEngine.class);
                });
    }

    @Test
    void meterRegistry_addsMetricsBehindCompositeEvents() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(DurableMetrics.class);
                    assertThat(context.getBean(DurableEvents.class)).isInstanceOf(CompositeDurableEvents.class);
                });
    }

    @Test
    void userListeners_receiveEngineEventsThroughComposite() {
        contextRunner
                .withUserConfiguration(TrackingEventsConfig.class)
                .run(context -> {
                    DurableEvents events = context.getBean(DurableEvents.class);
                    assertThat(events).isInstanceOf(CompositeDurableEvents.class);

                    events.onWorkflowStarted("research", RunKey.of("research-1", "run-1"));

                    assertThat(context.getBean(TrackingEvents.class).started).containsExactly("research:research-1/run-1");
                });
    }

    @Test
    void filePersistence_usesJournalDirectory(@TempDir Path directory) {
        contextRunner
                .withPropertyValues(
                        "firefly.durable.persistence.provider=file",
                        "firefly.durable.persistence.directory=" + directory)
                .run(context -> assertThat(context.getBean(EventLog.class)).isInstanceOf(FileEventLog.class));
    }

    @Test
    void circuitBreakerRegistry_wrapsEventLog() {
        contextRunner
                .withBean(CircuitBreakerRegistry.class, CircuitBreakerRegistry::ofDefaults)
                .run(context -> assertThat(context.getBean(EventLog.class)).isInstanceOf(ResilientEventLog.class));
    }

    @Test
    void restConfiguration_outsideReactiveWebApp_onlyAddsHealthIndicator() {
        contextRunner
                .withConfiguration(AutoConfigurations.of(DurableRestAutoConfiguration.class))
                .withPropertyValues("firefly.durable.engine.holder-id=node-3")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(WorkflowController.class);
                    assertThat(context).doesNotHaveBean(WorkerController.class);
                    Health health = context.getBean(DurableHealthIndicator.class).health().block();
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("holderId", "node-3");
                });
    }

    @Test
    void definitionBeans_areRegisteredAndExecutable() {
        contextRunner
                .withUserConfiguration(GreetingConfig.class)
                .withPropertyValues("firefly.durable.worker.poll-interval=20ms")
                .run(context -> {
                    assertThat(context.getBean(WorkflowRegistry.class).hasWorkflow("greeting")).isTrue();
                    assertThat(context.getBean(ActivityRegistry.class).hasActivity("greet")).isTrue();

                    WorkflowClient client = context.getBean(WorkflowClient.class);
                    WorkflowHandle handle = client.startWorkflow("greeting", "Ada").block();

                    assertThat(client.getResult(handle, String.class, Duration.ofSeconds(10)).block())
                            .isEqualTo("Hello, Ada");
                });
    }

    // ── Test configurations ──────────────────────────────────────────

    static class TrackingEvents implements DurableEvents {
        final List<String> started = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onWorkflowStarted(String workflowType, RunKey runKey) {
            started.add(workflowType + ":" + runKey);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TrackingEventsConfig {
        @Bean
        TrackingEvents trackingEvents() {
            return new TrackingEvents();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class GreetingConfig {
        @Bean
        ActivityDefinition<String, String> greetActivity() {
            return ActivityDefinition.of("greet", String.class, (name, ctx) -> Mono.just("Hello, " + name));
        }

        @Bean
        WorkflowDefinition<String, String> greetingWorkflow() {
            return WorkflowDefinition.<String, String>of("greeting", String.class,
                    () -> (ctx, name) -> ctx.executeActivity("greet", name, String.class));
        }
    }
}

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


package org.fireflyframework.durable.unit.worker;

import org.fireflyframework.durable.activity.ActivityDefinition;
import org.fireflyframework.durable.activity.ActivityRegistry;
import org.fireflyframework.durable.activity.ActivityScheduler;
import org.fireflyframework.durable.activity.ActivityTask;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.history.PendingEvent;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RetryPolicy;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.queue.InMemoryTaskQueue;
import org.fireflyframework.durable.worker.WorkerRegistration;
import org.fireflyframework.durable.worker.WorkerService;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class WorkerServiceTest {

    private static final RunKey RUN = RunKey.of("research-1", "run-1");

    private InMemoryTaskQueue queue;
    private ActivityScheduler scheduler;
    private List<PendingEvent> delivered;
    private WorkerService workers;

    @BeforeEach
    void setUp() {
        var workflows = new WorkflowRegistry();
        workflows.register(WorkflowDefinition.<String, String>of("research", String.class,
                () -> (ctx, topic) -> ctx.executeActivity("search", topic, String.class)).withActivities("search"));
        workflows.register(WorkflowDefinition.<String, String>of("report", String.class,
                () -> (ctx, topic) -> ctx.executeActivity("render", topic, String.class)).withActivities("render"));
        var activities = new ActivityRegistry();
        activities.register(ActivityDefinition.of("search", String.class, (input, ctx) -> Mono.just("found")));

        queue = new InMemoryTaskQueue();
        delivered = new CopyOnWriteArrayList<>();
        scheduler = new ActivityScheduler(queue, activities, (runKey, event) -> Mono.fromRunnable(() -> delivered.add(event)),
                new PayloadConverter(), new DurableEvents() {}, Clock.systemUTC(), Duration.ofMinutes(1), RetryPolicy.DEFAULT);
        workers = new WorkerService(workflows, activities, queue, scheduler, Clock.systemUTC(), Duration.ofMillis(20));
    }

    @Test
    void register_acceptsKnownTypes() {
        StepVerifier.create(workers.register("worker-1", List.of("default"), List.of("research"), List.of("search")))
                .assertNext(registration -> {
                    assertThat(registration.workerId()).isEqualTo("worker-1");
                    assertThat(registration.taskQueues()).containsExactly("default");
                    assertThat(registration.registeredAt()).isNotNull();
                })
                .verifyComplete();

        assertThat(workers.getWorkers()).extracting(WorkerRegistration::workerId).containsExactly("worker-1");
    }

    @Test
    void register_rejectsUnknownWorkflowType() {
        StepVerifier.create(workers.register("worker-1", List.of("default"), List.of("translate"), List.of()))
                .expectError(UnregisteredTypeException.class)
                .verify();

        assertThat(workers.getWorker("worker-1")).isEmpty();
    }

    @Test
    void register_rejectsWorkflowWhoseActivitiesAreMissing() {
        StepVerifier.create(workers.register("worker-1", List.of("default"), List.of("report"), List.of()))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UnregisteredTypeException.class)
                        .hasMessageContaining("render"))
                .verify();
    }

    @Test
    void register_rejectsUnknownActivityType() {
        StepVerifier.create(workers.register("worker-1", List.of("default"), List.of(), List.of("render")))
                .expectError(UnregisteredTypeException.class)
                .verify();
    }

    @Test
    void unregister_removesWorker() {
        workers.register("worker-1", List.of("default"), List.of(), List.of("search")).block();

        workers.unregister("worker-1").block();

        assertThat(workers.getWorkers()).isEmpty();
    }

    @Test
    void poll_emptyQueue_emitsEmptyOptional() {
        StepVerifier.create(workers.poll("default"))
                .expectNext(Optional.empty())
                .verifyComplete();
    }

    @Test
    void longPoll_returnsTaskEnqueuedWhileWaiting() {
        Mono<Optional<ActivityTask>> waiting = workers.poll("default", Duration.ofSeconds(5));

        StepVerifier.create(waiting)
                .then(() -> scheduler.schedule(scheduler.newTask(RUN, 0, "search", "quantum", "default",
                        null, null, null)).block())
                .assertNext(task -> assertThat(task).map(ActivityTask::name).contains("search"))
                .verifyComplete();
    }

    @Test
    void longPoll_timesOutWithEmptyOptional() {
        StepVerifier.create(workers.poll("default", Duration.ofMillis(100)))
                .expectNext(Optional.empty())
                .verifyComplete();
    }

    @Test
    void reports_reachTheScheduler() {
        scheduler.schedule(scheduler.newTask(RUN, 0, "search", "a", "default", null, null, RetryPolicy.NO_RETRY)).block();
        scheduler.schedule(scheduler.newTask(RUN, 1, "search", "b", "default", null, null, RetryPolicy.NO_RETRY)).block();
        ActivityTask first = workers.poll("default").block().orElseThrow();
        ActivityTask second = workers.poll("default").block().orElseThrow();

        assertThat(workers.complete(first.taskId(), "found").block()).isTrue();
        assertThat(workers.fail(second.taskId(), "Forbidden", "no access", false).block()).isTrue();
        assertThat(workers.complete(first.taskId(), "duplicate").block()).isFalse();

        assertThat(delivered).extracting(PendingEvent::type)
                .containsExactly(EventType.ACTIVITY_COMPLETED, EventType.ACTIVITY_FAILED);
        Failure failure = Failure.fromPayload(delivered.get(1).payload().get(HistoryEvents.FAILURE));
        assertThat(failure.type()).isEqualTo("Forbidden");
        assertThat(failure.nonRetryable()).isTrue();
    }
}

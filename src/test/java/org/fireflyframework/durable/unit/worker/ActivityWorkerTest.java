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
import org.fireflyframework.durable.core.exception.NonRetryableActivityException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.history.PendingEvent;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RetryPolicy;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.queue.InMemoryTaskQueue;
import org.fireflyframework.durable.worker.ActivityWorker;
import org.fireflyframework.durable.worker.WorkerService;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ActivityWorkerTest {

    private static final RunKey RUN = RunKey.of("research-1", "run-1");

    private ActivityRegistry activities;
    private ActivityScheduler scheduler;
    private WorkerService workers;
    private List<PendingEvent> delivered;
    private CountDownLatch outcomes;
    private ActivityWorker worker;

    @BeforeEach
    void setUp() {
        activities = new ActivityRegistry();
        delivered = new CopyOnWriteArrayList<>();
        var queue = new InMemoryTaskQueue();
        scheduler = new ActivityScheduler(queue, activities, (runKey, event) -> Mono.fromRunnable(() -> {
            delivered.add(event);
            if (outcomes != null) outcomes.countDown();
        }), new PayloadConverter(), new DurableEvents() {}, Clock.systemUTC(), Duration.ofMinutes(1), RetryPolicy.NO_RETRY);
        workers = new WorkerService(new WorkflowRegistry(), activities, queue, scheduler, Clock.systemUTC(), Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        if (worker != null) worker.stop().block();
    }

    @Test
    void start_registersAllActivitiesWithWorkerService() {
        activities.register(ActivityDefinition.of("search", String.class, (input, ctx) -> Mono.just("found")));
        worker = newWorker(2);

        worker.start().block();

        assertThat(worker.isRunning()).isTrue();
        assertThat(workers.getWorker("worker-1")).hasValueSatisfying(registration ->
                assertThat(registration.activityTypes()).containsExactly("search"));
        assertThatThrownBy(() -> worker.start().block()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void handlerResult_isReportedAsCompletion() throws Exception {
        activities.register(ActivityDefinition.of("search", String.class,
                (input, ctx) -> Mono.just(input.toUpperCase() + "@" + ctx.attempt())));
        outcomes = new CountDownLatch(1);
        worker = newWorker(2);
        worker.start().block();

        schedule(0, "search", "quantum", Duration.ofSeconds(5));

        assertThat(outcomes.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(delivered.get(0).type()).isEqualTo(EventType.ACTIVITY_COMPLETED);
        assertThat(delivered.get(0).payload()).containsEntry(HistoryEvents.RESULT, "QUANTUM@1");
    }

    @Test
    void nonRetryableError_isReportedAsFinalFailure() throws Exception {
        activities.register(ActivityDefinition.<String, String>of("search", String.class,
                (input, ctx) -> Mono.error(new NonRetryableActivityException("InvalidQuery", "empty query"))));
        outcomes = new CountDownLatch(1);
        worker = newWorker(1);
        worker.start().block();

        schedule(0, "search", "", Duration.ofSeconds(5));

        assertThat(outcomes.await(5, TimeUnit.SECONDS)).isTrue();
        Failure failure = Failure.fromPayload(delivered.get(0).payload().get(HistoryEvents.FAILURE));
        assertThat(failure.type()).isEqualTo("InvalidQuery");
        assertThat(failure.nonRetryable()).isTrue();
    }

    @Test
    void slowHandler_failsWithStartToCloseTimeout() throws Exception {
        activities.register(ActivityDefinition.<String, String>of("search", String.class,
                (input, ctx) -> Mono.delay(Duration.ofSeconds(10)).thenReturn("too late")));
        outcomes = new CountDownLatch(1);
        worker = newWorker(1);
        worker.start().block();

        schedule(0, "search", "quantum", Duration.ofMillis(200));

        assertThat(outcomes.await(5, TimeUnit.SECONDS)).isTrue();
        Failure failure = Failure.fromPayload(delivered.get(0).payload().get(HistoryEvents.FAILURE));
        assertThat(failure.type()).isEqualTo("DURABLE_ACTIVITY_TIMEOUT");
    }

    @Test
    void concurrency_isBoundedByMaxConcurrency() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        activities.register(ActivityDefinition.<String, String>of("search", String.class, (input, ctx) -> Mono.fromCallable(() -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            Thread.sleep(100);
            running.decrementAndGet();
            return input;
        })));
        outcomes = new CountDownLatch(6);
        worker = newWorker(2);
        worker.start().block();

        for (int i = 0; i < 6; i++) {
            schedule(i, "search", "q" + i, Duration.ofSeconds(5));
        }

        assertThat(outcomes.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(delivered).hasSize(6).allSatisfy(e -> assertThat(e.type()).isEqualTo(EventType.ACTIVITY_COMPLETED));
    }

    @Test
    void stop_unregistersWorker() {
        activities.register(ActivityDefinition.of("search", String.class, (input, ctx) -> Mono.just("found")));
        worker = newWorker(1);
        worker.start().block();

        worker.stop().block();

        assertThat(worker.isRunning()).isFalse();
        assertThat(workers.getWorkers()).isEmpty();
    }

    private ActivityWorker newWorker(int maxConcurrency) {
        return new ActivityWorker("worker-1", workers, activities, new PayloadConverter(), null,
                List.of("default"), maxConcurrency, Duration.ofMillis(10));
    }

    private void schedule(int commandId, String name, String input, Duration startToClose) {
        scheduler.schedule(scheduler.newTask(RUN, commandId, name, input, "default", startToClose, null, null)).block();
    }
}

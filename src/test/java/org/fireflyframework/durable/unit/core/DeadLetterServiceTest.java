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


package org.fireflyframework.durable.unit.core;

import org.fireflyframework.durable.core.dlq.DeadLetterEntry;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.durable.core.exception.NonDeterminismException;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DeadLetterServiceTest {

    private static final RunKey RUN = RunKey.of("research-1", "run-1");

    private MutableClock clock;
    private List<RunKey> deadLettered;
    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        deadLettered = new ArrayList<>();
        DurableEvents events = new DurableEvents() {
            @Override
            public void onDeadLettered(String workflowType, RunKey runKey, Throwable error) {
                deadLettered.add(runKey);
            }
        };
        service = new DeadLetterService(new InMemoryDeadLetterStore(), events, clock);
    }

    @Test
    void deadLetter_recordsRunWithCommandAndError() {
        var error = new NonDeterminismException(RUN, 2, "workflow issued TIMER_STARTED but history recorded ACTIVITY_SCHEDULED(search)");

        StepVerifier.create(service.deadLetter("research", RUN, 2, error)
                        .then(service.getEntry(RUN)))
                .assertNext(e -> {
                    assertThat(e.workflowType()).isEqualTo("research");
                    assertThat(e.runKey()).isEqualTo(RUN);
                    assertThat(e.commandId()).isEqualTo(2);
                    assertThat(e.errorType()).isEqualTo(NonDeterminismException.class.getName());
                    assertThat(e.createdAt()).isEqualTo(clock.instant());
                })
                .verifyComplete();

        assertThat(deadLettered).containsExactly(RUN);
        assertThat(service.isDeadLettered(RUN).block()).isTrue();
    }

    @Test
    void deadLetteringTwice_keepsFirstEntryAndNotifiesOnce() {
        DeadLetterEntry first = service.deadLetter("research", RUN, 0, new NonDeterminismException(RUN, 0, "mismatch")).block();
        clock.advance(Duration.ofSeconds(30));

        DeadLetterEntry second = service.deadLetter("research", RUN, 3, new NonDeterminismException(RUN, 3, "later")).block();

        assertThat(second).isEqualTo(first);
        assertThat(second.commandId()).isZero();
        assertThat(service.count().block()).isEqualTo(1L);
        assertThat(deadLettered).containsExactly(RUN);
    }

    @Test
    void release_removesEntryAndStampsRelease() {
        service.deadLetter("research", RUN, 1, new NonDeterminismException(RUN, 1, "mismatch")).block();
        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(service.release(RUN))
                .assertNext(released -> {
                    assertThat(released.isReleased()).isTrue();
                    assertThat(released.releasedAt()).isEqualTo(clock.instant());
                    assertThat(released.commandId()).isEqualTo(1);
                })
                .verifyComplete();

        assertThat(service.isDeadLettered(RUN).block()).isFalse();
    }

    @Test
    void release_unknownEntry_isEmpty() {
        StepVerifier.create(service.release(RunKey.of("missing", "run")))
                .verifyComplete();
    }

    @Test
    void lookups_filterByTypeAndWorkflowId() {
        service.deadLetter("research", RUN, 0, new NonDeterminismException(RUN, 0, "a")).block();
        clock.advance(Duration.ofSeconds(1));
        RunKey other = RunKey.of("report-9", "run-2");
        service.deadLetter("report", other, 0, new NonDeterminismException(other, 0, "b")).block();

        assertThat(service.getByWorkflowType("report").collectList().block())
                .extracting(DeadLetterEntry::workflowId).containsExactly("report-9");
        assertThat(service.getByWorkflowId("research-1").collectList().block()).hasSize(1);
        assertThat(service.getAllEntries().collectList().block())
                .extracting(DeadLetterEntry::workflowType).containsExactly("research", "report");
    }
}

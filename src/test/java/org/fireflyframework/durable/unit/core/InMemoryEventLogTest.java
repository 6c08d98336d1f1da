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

import org.fireflyframework.durable.core.eventlog.InMemoryEventLog;
import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventLogTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final RunKey RUN = RunKey.of("research-1", "run-a");

    private InMemoryEventLog eventLog;

    @BeforeEach
    void setUp() {
        eventLog = new InMemoryEventLog();
    }

    @Test
    void append_thenRead_returnsEventsInSeqOrder() {
        StepVerifier.create(eventLog.append(RUN, 0, List.of(started(0)))
                        .then(eventLog.append(RUN, 1, List.of(signal(1, "a"), signal(2, "b"))))
                        .thenMany(eventLog.read(RUN)))
                .assertNext(e -> assertThat(e.type()).isEqualTo(EventType.WORKFLOW_STARTED))
                .assertNext(e -> assertThat(e.seq()).isEqualTo(1))
                .assertNext(e -> assertThat(e.seq()).isEqualTo(2))
                .verifyComplete();
    }

    @Test
    void append_withStaleExpectedSeq_failsWithoutWriting() {
        eventLog.append(RUN, 0, List.of(started(0))).block();

        StepVerifier.create(eventLog.append(RUN, 0, List.of(started(0))))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(EventLogConflictException.class);
                    assertThat(((EventLogConflictException) e).getExpectedSeq()).isZero();
                    assertThat(((EventLogConflictException) e).getActualLength()).isEqualTo(1);
                })
                .verify();

        assertThat(eventLog.length(RUN).block()).isEqualTo(1L);
    }

    @Test
    void concurrentAppendsAtSameSeq_exactlyOneWins() {
        eventLog.append(RUN, 0, List.of(started(0))).block();

        var first = eventLog.append(RUN, 1, List.of(signal(1, "from-a")))
                .thenReturn(true).onErrorReturn(EventLogConflictException.class, false);
        var second = eventLog.append(RUN, 1, List.of(signal(1, "from-b")))
                .thenReturn(true).onErrorReturn(EventLogConflictException.class, false);

        List<Boolean> results = Flux.merge(first, second).collectList().block();

        assertThat(results).containsExactlyInAnyOrder(true, false);
        assertThat(eventLog.length(RUN).block()).isEqualTo(2L);
    }

    @Test
    void append_rejectsBatchesNotNumberedFromExpectedSeq() {
        assertThatThrownBy(() -> eventLog.append(RUN, 0, List.of(signal(1, "x"))).block())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> eventLog.append(RUN, 0, List.of()).block())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void read_fromSeq_skipsEarlierEvents() {
        eventLog.append(RUN, 0, List.of(started(0), signal(1, "a"), signal(2, "b"))).block();

        StepVerifier.create(eventLog.read(RUN, 2).map(HistoryEvent::seq))
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    void read_unknownRun_isEmpty() {
        StepVerifier.create(eventLog.read(RunKey.of("missing", "run")))
                .verifyComplete();
        assertThat(eventLog.length(RunKey.of("missing", "run")).block()).isZero();
    }

    @Test
    void runs_byWorkflowId_listsEveryRunOfThatWorkflow() {
        eventLog.append(RUN, 0, List.of(started(0))).block();
        eventLog.append(RunKey.of("research-1", "run-b"), 0, List.of(started(0))).block();
        eventLog.append(RunKey.of("other", "run-c"), 0, List.of(started(0))).block();

        StepVerifier.create(eventLog.runs("research-1").map(RunKey::runId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("run-a", "run-b"))
                .verifyComplete();
    }

    private static HistoryEvent started(long seq) {
        return HistoryEvents.workflowStarted("research", "quantum", "default", null, null, null)
                .toHistoryEvent(seq, T0);
    }

    private static HistoryEvent signal(long seq, String payload) {
        return HistoryEvents.signalReceived("approve", payload).toHistoryEvent(seq, T0);
    }
}

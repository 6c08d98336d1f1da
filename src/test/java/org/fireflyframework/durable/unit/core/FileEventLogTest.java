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

import org.fireflyframework.durable.core.eventlog.FileEventLog;
import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class FileEventLogTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final RunKey RUN = RunKey.of("reports/weekly", "run-1");

    @TempDir
    Path directory;

    private PayloadConverter converter;
    private FileEventLog eventLog;

    @BeforeEach
    void setUp() {
        converter = new PayloadConverter();
        eventLog = new FileEventLog(directory, converter);
    }

    @Test
    void appendedEvents_surviveANewInstance() {
        eventLog.append(RUN, 0, List.of(started(0))).block();
        eventLog.append(RUN, 1, List.of(
                HistoryEvents.signalReceived("approve", Map.of("by", "alice")).toHistoryEvent(1, T0.plusSeconds(1)))).block();

        FileEventLog reopened = new FileEventLog(directory, converter);

        StepVerifier.create(reopened.read(RUN).collectList())
                .assertNext(events -> {
                    assertThat(events).extracting(HistoryEvent::seq).containsExactly(0L, 1L);
                    assertThat(events.get(0).type()).isEqualTo(EventType.WORKFLOW_STARTED);
                    assertThat(events.get(0).getString(HistoryEvents.WORKFLOW_TYPE)).isEqualTo("research");
                    assertThat(events.get(1).getString(HistoryEvents.SIGNAL_NAME)).isEqualTo("approve");
                    assertThat(events.get(1).timestamp()).isEqualTo(T0.plusSeconds(1));
                })
                .verifyComplete();
    }

    @Test
    void runs_decodesWorkflowIdsWithSlashes() {
        eventLog.append(RUN, 0, List.of(started(0))).block();

        StepVerifier.create(new FileEventLog(directory, converter).runs())
                .expectNext(RUN)
                .verifyComplete();
    }

    @Test
    void append_withStaleExpectedSeq_failsWithConflict() {
        eventLog.append(RUN, 0, List.of(started(0))).block();

        StepVerifier.create(eventLog.append(RUN, 0, List.of(started(0))))
                .expectError(EventLogConflictException.class)
                .verify();
    }

    @Test
    void appendFromSecondInstance_isSeenByFirst() {
        eventLog.append(RUN, 0, List.of(started(0))).block();
        FileEventLog other = new FileEventLog(directory, converter);

        other.append(RUN, 1, List.of(HistoryEvents.cancelRequested("stop").toHistoryEvent(1, T0))).block();

        assertThat(eventLog.length(RUN).block()).isEqualTo(2L);
        StepVerifier.create(eventLog.append(RUN, 1, List.of(HistoryEvents.cancelRequested("again").toHistoryEvent(1, T0))))
                .expectError(EventLogConflictException.class)
                .verify();
    }

    @Test
    void concurrentAppendsFromSeparateInstances_exactlyOneWinsEachSeq() throws Exception {
        eventLog.append(RUN, 0, List.of(started(0))).block();
        int writers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                FileEventLog writer = new FileEventLog(directory, converter);
                String reason = "writer-" + i;
                attempts.add(pool.submit(() -> {
                    go.await();
                    return writer.append(RUN, 1, List.of(HistoryEvents.cancelRequested(reason).toHistoryEvent(1, T0)))
                            .thenReturn(true)
                            .onErrorReturn(EventLogConflictException.class, false)
                            .block();
                }));
            }
            go.countDown();

            int wins = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) wins++;
            }

            assertThat(wins).isEqualTo(1);
            assertThat(new FileEventLog(directory, converter).read(RUN).map(HistoryEvent::seq).collectList().block())
                    .containsExactly(0L, 1L);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void tornTrailingLine_isDiscardedOnLoad() throws Exception {
        eventLog.append(RUN, 0, List.of(started(0))).block();
        Path journal = directory.resolve("reports%2Fweekly").resolve("run-1.jsonl");
        assertThat(journal).exists();
        Files.write(journal, "[{\"seq\":1,\"type\":\"SIGNAL_REC".getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.APPEND);

        FileEventLog reopened = new FileEventLog(directory, converter);

        assertThat(reopened.length(RUN).block()).isEqualTo(1L);
        reopened.append(RUN, 1, List.of(HistoryEvents.cancelRequested("stop").toHistoryEvent(1, T0))).block();
        assertThat(new FileEventLog(directory, converter).read(RUN).map(HistoryEvent::type).collectList().block())
                .containsExactly(EventType.WORKFLOW_STARTED, EventType.CANCEL_REQUESTED);
    }

    @Test
    void isHealthy_whenDirectoryIsWritable() {
        StepVerifier.create(eventLog.isHealthy())
                .expectNext(true)
                .verifyComplete();
    }

    private static HistoryEvent started(long seq) {
        return HistoryEvents.workflowStarted("research", "quantum", "default", null, null, null)
                .toHistoryEvent(seq, T0);
    }
}

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

import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.inbox.InMemoryRunInbox;
import org.fireflyframework.durable.core.inbox.InboxEntry;
import org.fireflyframework.durable.core.model.RunKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryRunInboxTest {

    private static final RunKey RUN = RunKey.of("wf", "run");
    private static final RunKey OTHER = RunKey.of("wf", "other");

    private InMemoryRunInbox inbox;

    @BeforeEach
    void setUp() {
        inbox = new InMemoryRunInbox();
    }

    @Test
    void entry_carriesItsIdInThePayload() {
        InboxEntry entry = InboxEntry.of(HistoryEvents.timerFired(3));

        assertThat(entry.event().payload())
                .containsEntry(HistoryEvents.DELIVERY_ID, entry.id())
                .containsEntry(HistoryEvents.COMMAND_ID, 3);
    }

    @Test
    void pending_keepsOfferOrderPerRun() {
        InboxEntry first = InboxEntry.of(HistoryEvents.timerFired(0));
        InboxEntry second = InboxEntry.of(HistoryEvents.signalReceived("go", "now"));
        inbox.offer(RUN, first).then(inbox.offer(OTHER, InboxEntry.of(HistoryEvents.timerFired(9))))
                .then(inbox.offer(RUN, second)).block();

        StepVerifier.create(inbox.pending(RUN).map(InboxEntry::id))
                .expectNext(first.id(), second.id())
                .verifyComplete();
    }

    @Test
    void acknowledge_removesOnlyConsumedEntries() {
        InboxEntry first = InboxEntry.of(HistoryEvents.timerFired(0));
        InboxEntry second = InboxEntry.of(HistoryEvents.timerFired(1));
        inbox.offer(RUN, first).then(inbox.offer(RUN, second)).block();

        inbox.acknowledge(RUN, List.of(first.id())).block();

        assertThat(inbox.pending(RUN).collectList().block()).containsExactly(second);
        assertThat(inbox.hasPending(RUN).block()).isTrue();

        inbox.acknowledge(RUN, List.of(second.id(), "unknown")).block();
        assertThat(inbox.hasPending(RUN).block()).isFalse();
    }

    @Test
    void unacknowledgedEntries_areReadAgain() {
        InboxEntry entry = InboxEntry.of(HistoryEvents.cancelRequested("stop"));
        inbox.offer(RUN, entry).block();

        assertThat(inbox.pending(RUN).collectList().block()).containsExactly(entry);
        assertThat(inbox.pending(RUN).collectList().block()).containsExactly(entry);
    }

    @Test
    void purge_dropsEveryEntryOfTheRun() {
        inbox.offer(RUN, InboxEntry.of(HistoryEvents.timerFired(0)))
                .then(inbox.offer(RUN, InboxEntry.of(HistoryEvents.timerFired(1))))
                .then(inbox.offer(OTHER, InboxEntry.of(HistoryEvents.timerFired(2)))).block();

        StepVerifier.create(inbox.purge(RUN))
                .expectNext(2)
                .verifyComplete();
        assertThat(inbox.hasPending(RUN).block()).isFalse();
        assertThat(inbox.hasPending(OTHER).block()).isTrue();
        assertThat(inbox.purge(RUN).block()).isZero();
    }
}

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


package org.fireflyframework.durable.core.inbox;

import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PendingEvent;

import java.util.Objects;
import java.util.UUID;

/**
 * An event waiting in a run's inbox. The event carries the entry id under
 * {@link HistoryEvents#DELIVERY_ID}, so once it is in history a second copy
 * of the same entry can be recognised and skipped.
 */
public record InboxEntry(String id, PendingEvent event) {

    public InboxEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(event, "event");
    }

    public static InboxEntry of(PendingEvent event) {
        String id = UUID.randomUUID().toString();
        return new InboxEntry(id, event.withPayload(HistoryEvents.DELIVERY_ID, id));
    }
}

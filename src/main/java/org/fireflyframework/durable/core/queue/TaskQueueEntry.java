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


package org.fireflyframework.durable.core.queue;

import org.fireflyframework.durable.activity.ActivityTask;

import java.time.Instant;

/**
 * A task held by the queue. Before the first delivery the visibility
 * deadline is the instant the task becomes pollable; once delivered it is the
 * lease expiry, after which the task is visible again.
 */
public record TaskQueueEntry(ActivityTask task, Instant visibilityDeadline, int deliveries, long sequence) {

    public boolean isVisible(Instant now) {
        return !visibilityDeadline.isAfter(now);
    }

    public boolean isLeased(Instant now) {
        return deliveries > 0 && visibilityDeadline.isAfter(now);
    }

    public boolean isLeaseExpired(Instant now) {
        return deliveries > 0 && !visibilityDeadline.isAfter(now);
    }
}

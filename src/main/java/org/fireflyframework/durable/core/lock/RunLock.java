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


package org.fireflyframework.durable.core.lock;

import org.fireflyframework.durable.core.model.RunKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-bounded exclusive claim of one process on one run.
 */
public record RunLock(RunKey runKey, String holderId, Instant leaseExpiry, Duration ttl) {

    public boolean isExpired(Instant now) {
        return !leaseExpiry.isAfter(now);
    }

    public boolean isHeldBy(String holder, Instant now) {
        return holderId.equals(holder) && !isExpired(now);
    }

    RunLock renewed(Instant now) {
        return new RunLock(runKey, holderId, now.plus(ttl), ttl);
    }
}

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
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Lease manager enforcing at most one active executor per run.
 *
 * <p>A lock is valid until its lease expiry; the holder must {@link #renew}
 * before the ttl elapses. Expiry is the only crash detection: a lock whose
 * holder stopped renewing simply becomes acquirable again.
 */
public interface RunLockManager {

    /** Emits {@code true} when acquired, {@code false} when another holder has a valid lock. */
    Mono<Boolean> acquire(RunKey runKey, String holderId, Duration ttl);

    /** Extends the lease by its original ttl; {@code false} when the lock was lost. */
    Mono<Boolean> renew(RunKey runKey, String holderId);

    /** Releases the lock if held by {@code holderId}; otherwise does nothing. */
    Mono<Void> release(RunKey runKey, String holderId);

    /** The current valid lock, if any. */
    Mono<Optional<RunLock>> current(RunKey runKey);
}

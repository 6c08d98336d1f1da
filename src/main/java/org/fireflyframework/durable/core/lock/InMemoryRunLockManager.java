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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock table. Every state transition happens inside
 * {@link ConcurrentHashMap#compute}, so concurrent acquisitions of the same
 * run are serialized.
 */
public class InMemoryRunLockManager implements RunLockManager {

    private final ConcurrentHashMap<RunKey, RunLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRunLockManager() {
        this(Clock.systemUTC());
    }

    public InMemoryRunLockManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Mono<Boolean> acquire(RunKey runKey, String holderId, Duration ttl) {
        Objects.requireNonNull(holderId, "holderId");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Mono.error(new IllegalArgumentException("ttl must be positive"));
        }
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            RunLock result = locks.compute(runKey, (key, existing) -> {
                if (existing == null || existing.isExpired(now) || existing.holderId().equals(holderId)) {
                    return new RunLock(key, holderId, now.plus(ttl), ttl);
                }
                return existing;
            });
            return result.holderId().equals(holderId);
        });
    }

    @Override
    public Mono<Boolean> renew(RunKey runKey, String holderId) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            RunLock result = locks.computeIfPresent(runKey, (key, existing) ->
                    existing.isHeldBy(holderId, now) ? existing.renewed(now) : existing);
            return result != null && result.isHeldBy(holderId, now);
        });
    }

    @Override
    public Mono<Void> release(RunKey runKey, String holderId) {
        return Mono.fromRunnable(() -> locks.computeIfPresent(runKey, (key, existing) ->
                existing.holderId().equals(holderId) ? null : existing));
    }

    @Override
    public Mono<Optional<RunLock>> current(RunKey runKey) {
        return Mono.fromCallable(() -> {
            RunLock lock = locks.get(runKey);
            return lock != null && !lock.isExpired(clock.instant()) ? Optional.of(lock) : Optional.<RunLock>empty();
        });
    }

    // Test helpers
    public int size() { return locks.size(); }
}

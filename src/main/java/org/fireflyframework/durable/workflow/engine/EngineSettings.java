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


package org.fireflyframework.durable.workflow.engine;

import org.fireflyframework.durable.core.model.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Tunables of a {@link WorkflowEngine}.
 *
 * @param holderId                   identity written into every RunLock this engine takes
 * @param lockTtl                    lease length; renewed every {@code lockTtl / 3}
 * @param lockRetryInterval          delay before retrying a run after losing its lease; also how often
 *                                   the inbox of every held run is checked
 * @param retryBackoff               first backoff of engine-level cycle retries
 * @param maxCycleRetries            engine-level retries before a run is left to recovery
 * @param resultPollInterval         how often result waiters re-read the log
 * @param defaultStartToCloseTimeout activity attempt timeout when neither workflow nor registration sets one
 * @param defaultRetryPolicy         activity retry policy when neither workflow nor registration sets one
 */
public record EngineSettings(
        String holderId,
        Duration lockTtl,
        Duration lockRetryInterval,
        Duration retryBackoff,
        int maxCycleRetries,
        Duration resultPollInterval,
        Duration defaultStartToCloseTimeout,
        RetryPolicy defaultRetryPolicy
) {
    public EngineSettings {
        Objects.requireNonNull(holderId, "holderId");
        Objects.requireNonNull(lockTtl, "lockTtl");
        if (lockTtl.isNegative() || lockTtl.isZero()) throw new IllegalArgumentException("lockTtl must be positive");
        if (maxCycleRetries < 0) throw new IllegalArgumentException("maxCycleRetries must be >= 0");
    }

    public static EngineSettings defaults() {
        return new EngineSettings("engine-" + UUID.randomUUID(), Duration.ofSeconds(30), Duration.ofSeconds(1),
                Duration.ofMillis(100), 5, Duration.ofMillis(200), Duration.ofMinutes(5), RetryPolicy.DEFAULT);
    }

    public EngineSettings withHolderId(String id) {
        return new EngineSettings(id, lockTtl, lockRetryInterval, retryBackoff, maxCycleRetries,
                resultPollInterval, defaultStartToCloseTimeout, defaultRetryPolicy);
    }

    public EngineSettings withLockTtl(Duration ttl) {
        return new EngineSettings(holderId, ttl, lockRetryInterval, retryBackoff, maxCycleRetries,
                resultPollInterval, defaultStartToCloseTimeout, defaultRetryPolicy);
    }

    public EngineSettings withLockRetryInterval(Duration interval) {
        return new EngineSettings(holderId, lockTtl, interval, retryBackoff, maxCycleRetries,
                resultPollInterval, defaultStartToCloseTimeout, defaultRetryPolicy);
    }
}

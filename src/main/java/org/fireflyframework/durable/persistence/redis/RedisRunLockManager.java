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


package org.fireflyframework.durable.persistence.redis;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.lock.RunLock;
import org.fireflyframework.durable.core.lock.RunLockManager;
import org.fireflyframework.durable.core.model.RunKey;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed {@link RunLockManager}.
 *
 * <p>Key {@code {prefix}lock:{workflowId}/{runId}} holds {@code holderId|ttlMillis}
 * with a Redis expiry equal to the lease. Acquisition, renewal and release
 * compare the holder inside Lua scripts, so each is a single atomic step.
 */
@Slf4j
public class RedisRunLockManager implements RunLockManager {

    private static final RedisScript<Long> RENEW_SCRIPT = RedisScript.of("""
            local value = redis.call('GET', KEYS[1])
            if not value then return 0 end
            local sep = string.find(value, '|', 1, true)
            if string.sub(value, 1, sep - 1) ~= ARGV[1] then return 0 end
            redis.call('PEXPIRE', KEYS[1], string.sub(value, sep + 1))
            return 1
            """, Long.class);

    private static final RedisScript<Long> ACQUIRE_OWN_SCRIPT = RedisScript.of("""
            local value = redis.call('GET', KEYS[1])
            if not value then
              redis.call('SET', KEYS[1], ARGV[1] .. '|' .. ARGV[2], 'PX', ARGV[2])
              return 1
            end
            local sep = string.find(value, '|', 1, true)
            if string.sub(value, 1, sep - 1) == ARGV[1] then
              redis.call('SET', KEYS[1], ARGV[1] .. '|' .. ARGV[2], 'PX', ARGV[2])
              return 1
            end
            return 0
            """, Long.class);

    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of("""
            local value = redis.call('GET', KEYS[1])
            if not value then return 0 end
            local sep = string.find(value, '|', 1, true)
            if string.sub(value, 1, sep - 1) ~= ARGV[1] then return 0 end
            return redis.call('DEL', KEYS[1])
            """, Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final String lockKeyPrefix;

    public RedisRunLockManager(ReactiveRedisTemplate<String, String> redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.lockKeyPrefix = (keyPrefix != null ? keyPrefix : "durable:") + "lock:";
        log.info("[run-lock] Redis run lock manager initialized with prefix: {}", lockKeyPrefix);
    }

    @Override
    public Mono<Boolean> acquire(RunKey runKey, String holderId, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Mono.error(new IllegalArgumentException("ttl must be positive"));
        }
        return redisTemplate.execute(ACQUIRE_OWN_SCRIPT, List.of(lockKey(runKey)),
                        List.of(holderId, Long.toString(ttl.toMillis())))
                .next()
                .map(result -> result == 1L)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> renew(RunKey runKey, String holderId) {
        return redisTemplate.execute(RENEW_SCRIPT, List.of(lockKey(runKey)), List.of(holderId))
                .next()
                .map(result -> result == 1L)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> release(RunKey runKey, String holderId) {
        return redisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey(runKey)), List.of(holderId))
                .then();
    }

    @Override
    public Mono<Optional<RunLock>> current(RunKey runKey) {
        String key = lockKey(runKey);
        return redisTemplate.opsForValue().get(key)
                .zipWith(redisTemplate.getExpire(key).defaultIfEmpty(Duration.ZERO))
                .map(tuple -> {
                    String value = tuple.getT1();
                    int sep = value.indexOf('|');
                    Duration ttl = Duration.ofMillis(Long.parseLong(value.substring(sep + 1)));
                    Instant expiry = Instant.now().plus(tuple.getT2());
                    return Optional.of(new RunLock(runKey, value.substring(0, sep), expiry, ttl));
                })
                .defaultIfEmpty(Optional.empty());
    }

    private String lockKey(RunKey runKey) {
        return lockKeyPrefix + runKey;
    }
}

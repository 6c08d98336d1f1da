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
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.RunKey;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed {@link EventLog}.
 *
 * <p>Redis key structure:
 * <ul>
 *   <li>{@code {prefix}history:{workflowId}/{runId}}: list of serialized events, index = seq</li>
 *   <li>{@code {prefix}runs}: set of every run key</li>
 * </ul>
 *
 * <p>The length check and the push of the whole batch run inside one Lua
 * script, which Redis executes atomically.
 */
@Slf4j
public class RedisEventLog implements EventLog {

    private static final RedisScript<Long> APPEND_SCRIPT = RedisScript.of("""
            local len = redis.call('LLEN', KEYS[1])
            if len ~= tonumber(ARGV[1]) then
              return -1 - len
            end
            for i = 3, #ARGV do
              redis.call('RPUSH', KEYS[1], ARGV[i])
            end
            redis.call('SADD', KEYS[2], ARGV[2])
            return len + #ARGV - 2
            """, Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final PayloadConverter converter;
    private final String historyKeyPrefix;
    private final String runsKey;

    public RedisEventLog(ReactiveRedisTemplate<String, String> redisTemplate,
                         PayloadConverter converter,
                         String keyPrefix) {
        String prefix = keyPrefix != null ? keyPrefix : "durable:";
        this.redisTemplate = redisTemplate;
        this.converter = converter;
        this.historyKeyPrefix = prefix + "history:";
        this.runsKey = prefix + "runs";
        log.info("[event-log] Redis event log initialized with prefix: {}", prefix);
    }

    @Override
    public Mono<Void> append(RunKey runKey, long expectedSeq, List<HistoryEvent> events) {
        return Mono.fromCallable(() -> {
                    EventLog.checkBatch(runKey, expectedSeq, events);
                    List<String> args = new ArrayList<>(events.size() + 2);
                    args.add(Long.toString(expectedSeq));
                    args.add(runKey.toString());
                    for (HistoryEvent event : events) {
                        args.add(converter.serialize(event));
                    }
                    return args;
                })
                .flatMap(args -> redisTemplate.execute(APPEND_SCRIPT, List.of(historyKey(runKey), runsKey), args)
                        .next())
                .flatMap(result -> {
                    if (result < 0) {
                        return Mono.<Void>error(new EventLogConflictException(runKey, expectedSeq, -1 - result));
                    }
                    return Mono.<Void>empty();
                })
                .doOnSuccess(v -> log.debug("[event-log] Appended {} event(s) to {}", events.size(), runKey))
                .doOnError(e -> !(e instanceof EventLogConflictException),
                        e -> log.error("[event-log] Failed to append to {}", runKey, e));
    }

    @Override
    public Flux<HistoryEvent> read(RunKey runKey, long fromSeq) {
        return redisTemplate.opsForList().range(historyKey(runKey), Math.max(fromSeq, 0), -1)
                .map(converter::deserializeEvent);
    }

    @Override
    public Mono<Long> length(RunKey runKey) {
        return redisTemplate.opsForList().size(historyKey(runKey)).defaultIfEmpty(0L);
    }

    @Override
    public Flux<RunKey> runs() {
        return redisTemplate.opsForSet().members(runsKey)
                .map(RunKey::parse);
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.opsForValue()
                .set(historyKeyPrefix + "health", "ok", Duration.ofSeconds(10))
                .onErrorReturn(false);
    }

    private String historyKey(RunKey runKey) {
        return historyKeyPrefix + runKey;
    }
}

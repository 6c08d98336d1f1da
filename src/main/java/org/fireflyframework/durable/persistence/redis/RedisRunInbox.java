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

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.inbox.InboxEntry;
import org.fireflyframework.durable.core.inbox.RunInbox;
import org.fireflyframework.durable.core.model.RunKey;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Redis-backed {@link RunInbox}.
 *
 * <p>Redis key structure:
 * <ul>
 *   <li>{@code {prefix}inbox:{workflowId}/{runId}}: sorted set of entry ids, score = offer order</li>
 *   <li>{@code {prefix}inbox-entries:{workflowId}/{runId}}: hash of entry id to serialized entry</li>
 *   <li>{@code {prefix}inbox-seq}: counter handing out the scores</li>
 * </ul>
 */
@Slf4j
public class RedisRunInbox implements RunInbox {

    private static final TypeReference<InboxEntry> ENTRY = new TypeReference<>() {};

    private static final RedisScript<Long> OFFER_SCRIPT = RedisScript.of("""
            local score = redis.call('INCR', KEYS[3])
            redis.call('HSET', KEYS[2], ARGV[1], ARGV[2])
            redis.call('ZADD', KEYS[1], score, ARGV[1])
            return score
            """, Long.class);

    private static final RedisScript<Long> ACK_SCRIPT = RedisScript.of("""
            for i = 1, #ARGV do
              redis.call('ZREM', KEYS[1], ARGV[i])
              redis.call('HDEL', KEYS[2], ARGV[i])
            end
            return #ARGV
            """, Long.class);

    private static final RedisScript<Long> PURGE_SCRIPT = RedisScript.of("""
            local n = redis.call('ZCARD', KEYS[1])
            redis.call('DEL', KEYS[1], KEYS[2])
            return n
            """, Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final PayloadConverter converter;
    private final String inboxKeyPrefix;
    private final String entriesKeyPrefix;
    private final String seqKey;

    public RedisRunInbox(ReactiveRedisTemplate<String, String> redisTemplate, PayloadConverter converter,
                         String keyPrefix) {
        String prefix = keyPrefix != null ? keyPrefix : "durable:";
        this.redisTemplate = redisTemplate;
        this.converter = converter;
        this.inboxKeyPrefix = prefix + "inbox:";
        this.entriesKeyPrefix = prefix + "inbox-entries:";
        this.seqKey = prefix + "inbox-seq";
    }

    @Override
    public Mono<Void> offer(RunKey runKey, InboxEntry entry) {
        return Mono.fromCallable(() -> converter.serialize(entry))
                .flatMap(json -> redisTemplate.execute(OFFER_SCRIPT, keys(runKey, true), List.of(entry.id(), json))
                        .next())
                .doOnSuccess(score -> log.debug("[inbox] Offered {} for {}", entry.event().type(), runKey))
                .then();
    }

    @Override
    public Flux<InboxEntry> pending(RunKey runKey) {
        ReactiveHashOperations<String, String, String> hash = redisTemplate.opsForHash();
        return redisTemplate.opsForZSet().range(inboxKey(runKey), Range.unbounded())
                .collectList()
                .flatMapMany(ids -> ids.isEmpty()
                        ? Flux.<String>empty()
                        : hash.multiGet(entriesKey(runKey), ids).flatMapIterable(values -> values))
                .filter(Objects::nonNull)
                .map(json -> converter.deserialize(json, ENTRY));
    }

    @Override
    public Mono<Boolean> hasPending(RunKey runKey) {
        return redisTemplate.opsForZSet().size(inboxKey(runKey))
                .map(size -> size > 0)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> acknowledge(RunKey runKey, Collection<String> entryIds) {
        if (entryIds.isEmpty()) return Mono.empty();
        return redisTemplate.execute(ACK_SCRIPT, keys(runKey, false), new ArrayList<>(entryIds))
                .then();
    }

    @Override
    public Mono<Integer> purge(RunKey runKey) {
        return redisTemplate.execute(PURGE_SCRIPT, keys(runKey, false), List.of())
                .next()
                .map(Long::intValue)
                .defaultIfEmpty(0);
    }

    private List<String> keys(RunKey runKey, boolean withSeq) {
        return withSeq
                ? List.of(inboxKey(runKey), entriesKey(runKey), seqKey)
                : List.of(inboxKey(runKey), entriesKey(runKey));
    }

    private String inboxKey(RunKey runKey) {
        return inboxKeyPrefix + runKey;
    }

    private String entriesKey(RunKey runKey) {
        return entriesKeyPrefix + runKey;
    }
}

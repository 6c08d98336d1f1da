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


package org.fireflyframework.durable.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.eventlog.FileEventLog;
import org.fireflyframework.durable.core.eventlog.InMemoryEventLog;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.inbox.RunInbox;
import org.fireflyframework.durable.core.lock.RunLockManager;
import org.fireflyframework.durable.core.resilience.ResilientEventLog;
import org.fireflyframework.durable.persistence.redis.RedisEventLog;
import org.fireflyframework.durable.persistence.redis.RedisRunInbox;
import org.fireflyframework.durable.persistence.redis.RedisRunLockManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.nio.file.Paths;

/**
 * Auto-configuration of the event log, lock store and run inbox.
 *
 * <p>Selected by {@code firefly.durable.persistence.provider}:
 * <ul>
 *   <li>{@code in-memory} (default)</li>
 *   <li>{@code file}: JSON-lines journals under {@code firefly.durable.persistence.directory}</li>
 *   <li>{@code redis}: when a {@code ReactiveRedisTemplate} bean is present; also supplies the lock store and run inbox</li>
 * </ul>
 *
 * <p>When a {@link CircuitBreakerRegistry} bean exists and
 * {@code firefly.durable.resilience.enabled} is not false, the selected log is
 * wrapped in a {@link ResilientEventLog}.
 */
@Slf4j
@AutoConfiguration(before = DurableAutoConfiguration.class,
        afterName = "org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration")
@EnableConfigurationProperties(DurableProperties.class)
public class DurablePersistenceAutoConfiguration {

    static EventLog decorate(EventLog eventLog, ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                             DurableProperties properties) {
        CircuitBreakerRegistry registry = properties.getResilience().isEnabled()
                ? circuitBreakers.getIfAvailable() : null;
        if (registry == null) {
            return eventLog;
        }
        log.info("[durable] Event log guarded by circuit breaker '{}'", ResilientEventLog.CIRCUIT_BREAKER_NAME);
        return new ResilientEventLog(eventLog, registry);
    }

    @Configuration
    @ConditionalOnProperty(name = "firefly.durable.persistence.provider", havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryPersistenceConfig {

        @Bean
        @ConditionalOnMissingBean(EventLog.class)
        public EventLog inMemoryEventLog(ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                                         DurableProperties properties) {
            log.info("[durable] Using in-memory event log");
            return decorate(new InMemoryEventLog(), circuitBreakers, properties);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "firefly.durable.persistence.provider", havingValue = "file")
    static class FilePersistenceConfig {

        @Bean
        @ConditionalOnMissingBean(EventLog.class)
        public EventLog fileEventLog(PayloadConverter converter, ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                                     DurableProperties properties) {
            String directory = properties.getPersistence().getDirectory();
            log.info("[durable] Using file event log in '{}'", directory);
            return decorate(new FileEventLog(Paths.get(directory), converter), circuitBreakers, properties);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.data.redis.core.ReactiveRedisTemplate")
    @ConditionalOnBean(type = "org.springframework.data.redis.core.ReactiveRedisTemplate")
    @ConditionalOnProperty(name = "firefly.durable.persistence.provider", havingValue = "redis")
    static class RedisPersistenceConfig {

        @Bean
        @ConditionalOnMissingBean(EventLog.class)
        public EventLog redisEventLog(ReactiveRedisTemplate<String, String> redisTemplate, PayloadConverter converter,
                                      ObjectProvider<CircuitBreakerRegistry> circuitBreakers,
                                      DurableProperties properties) {
            log.info("[durable] Using Redis event log");
            return decorate(new RedisEventLog(redisTemplate, converter, properties.getPersistence().getKeyPrefix()),
                    circuitBreakers, properties);
        }

        @Bean
        @ConditionalOnMissingBean(RunLockManager.class)
        public RunLockManager redisRunLockManager(ReactiveRedisTemplate<String, String> redisTemplate,
                                                  DurableProperties properties) {
            log.info("[durable] Using Redis run locks");
            return new RedisRunLockManager(redisTemplate, properties.getPersistence().getKeyPrefix());
        }

        @Bean
        @ConditionalOnMissingBean(RunInbox.class)
        public RunInbox redisRunInbox(ReactiveRedisTemplate<String, String> redisTemplate, PayloadConverter converter,
                                      DurableProperties properties) {
            log.info("[durable] Using Redis run inbox");
            return new RedisRunInbox(redisTemplate, converter, properties.getPersistence().getKeyPrefix());
        }
    }
}

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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.activity.ActivityDefinition;
import org.fireflyframework.durable.activity.ActivityRegistry;
import org.fireflyframework.durable.client.WorkflowClient;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.dlq.DeadLetterStore;
import org.fireflyframework.durable.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.eventlog.InMemoryEventLog;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.inbox.InMemoryRunInbox;
import org.fireflyframework.durable.core.inbox.RunInbox;
import org.fireflyframework.durable.core.lock.InMemoryRunLockManager;
import org.fireflyframework.durable.core.lock.RunLockManager;
import org.fireflyframework.durable.core.model.RetryPolicy;
import org.fireflyframework.durable.core.observability.CompositeDurableEvents;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.observability.DurableLoggerEvents;
import org.fireflyframework.durable.core.observability.DurableTracer;
import org.fireflyframework.durable.core.queue.InMemoryTaskQueue;
import org.fireflyframework.durable.core.queue.TaskQueue;
import org.fireflyframework.durable.core.recovery.RecoveryService;
import org.fireflyframework.durable.core.scheduling.DurableScheduler;
import org.fireflyframework.durable.worker.ActivityWorker;
import org.fireflyframework.durable.worker.WorkerService;
import org.fireflyframework.durable.workflow.engine.EngineSettings;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.fireflyframework.durable.workflow.query.WorkflowQueryService;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import org.fireflyframework.durable.workflow.search.WorkflowSearchService;
import org.fireflyframework.durable.workflow.signal.SignalService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Main auto-configuration of the durable workflow engine.
 *
 * <p>Wires the storage defaults (in-memory event log, lock table and task
 * queue), the registries, observability, dead letters, the engine and the
 * client, the worker and crash recovery. Workflow and activity definitions
 * declared as beans are registered automatically.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DurableProperties.class)
public class DurableAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock durableClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadConverter payloadConverter() {
        return new PayloadConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    public DurableLoggerEvents durableLoggerEvents() {
        return new DurableLoggerEvents();
    }

    /**
     * Fans every other {@link DurableEvents} bean (logger, metrics, user
     * listeners) out behind one primary bean; a single delegate is returned as is.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "durableEvents")
    public DurableEvents durableEvents(ObjectProvider<DurableEvents> listeners) {
        List<DurableEvents> delegates = listeners.orderedStream().collect(Collectors.toList());
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeDurableEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLog eventLog() {
        log.info("[durable] Using in-memory event log (default)");
        return new InMemoryEventLog();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunLockManager runLockManager(Clock clock) {
        return new InMemoryRunLockManager(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueue taskQueue(Clock clock) {
        return new InMemoryTaskQueue(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunInbox runInbox() {
        return new InMemoryRunInbox();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore() {
        return new InMemoryDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.durable.dlq.enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterService deadLetterService(DeadLetterStore store, DurableEvents events, Clock clock) {
        log.info("[durable] Dead letter service initialized");
        return new DeadLetterService(store, events, clock);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public DurableScheduler durableScheduler(DurableProperties properties) {
        int poolSize = properties.getScheduling().getThreadPoolSize();
        log.info("[durable] Scheduler initialized with thread pool size: {}", poolSize);
        return new DurableScheduler(poolSize);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRegistry workflowRegistry(ObjectProvider<WorkflowDefinition<?, ?>> definitions) {
        WorkflowRegistry registry = new WorkflowRegistry();
        definitions.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ActivityRegistry activityRegistry(ObjectProvider<ActivityDefinition<?, ?>> definitions) {
        ActivityRegistry registry = new ActivityRegistry();
        definitions.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineSettings engineSettings(DurableProperties properties) {
        DurableProperties.EngineProperties engine = properties.getEngine();
        DurableProperties.ActivityProperties activity = properties.getActivity();
        DurableProperties.RetryProperties retry = activity.getRetry();
        String holderId = engine.getHolderId() != null ? engine.getHolderId() : "engine-" + UUID.randomUUID();
        return new EngineSettings(holderId, engine.getLockTtl(), engine.getLockRetryInterval(),
                engine.getRetryBackoff(), engine.getMaxCycleRetries(), engine.getResultPollInterval(),
                activity.getDefaultStartToCloseTimeout(),
                new RetryPolicy(retry.getInitialInterval(), retry.getBackoffCoefficient(), retry.getMaxInterval(),
                        retry.getMaxAttempts(), retry.getNonRetryableErrorTypes()));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(EventLog eventLog, RunLockManager lockManager, RunInbox inbox,
                                         WorkflowRegistry registry,
                                         ActivityRegistry activityRegistry, TaskQueue taskQueue,
                                         DurableScheduler scheduler, PayloadConverter converter,
                                         DurableEvents events, ObjectProvider<DeadLetterService> deadLetters,
                                         ObjectProvider<DurableTracer> tracer, Clock clock, EngineSettings settings) {
        log.info("[durable] Workflow engine {} initialized (lock ttl {})", settings.holderId(), settings.lockTtl());
        return new WorkflowEngine(eventLog, lockManager, inbox, registry, activityRegistry, taskQueue, scheduler, converter,
                events, deadLetters.getIfAvailable(), tracer.getIfAvailable(), clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public SignalService signalService(EventLog eventLog, WorkflowEngine engine, PayloadConverter converter,
                                       DurableEvents events) {
        return new SignalService(eventLog, engine, converter, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowQueryService workflowQueryService(EventLog eventLog, WorkflowRegistry registry,
                                                     WorkflowEngine engine, PayloadConverter converter) {
        return new WorkflowQueryService(eventLog, registry, engine.executor(), converter);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowSearchService workflowSearchService(EventLog eventLog) {
        return new WorkflowSearchService(eventLog);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowClient workflowClient(WorkflowEngine engine, SignalService signalService,
                                         WorkflowQueryService queryService, WorkflowSearchService searchService,
                                         PayloadConverter converter, DurableEvents events) {
        log.info("[durable] Workflow client initialized");
        return new WorkflowClient(engine, signalService, queryService, searchService, converter, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerService workerService(WorkflowRegistry workflowRegistry, ActivityRegistry activityRegistry,
                                       TaskQueue taskQueue, WorkflowEngine engine, Clock clock,
                                       DurableProperties properties) {
        return new WorkerService(workflowRegistry, activityRegistry, taskQueue, engine.activityScheduler(), clock,
                properties.getWorker().getPollInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.durable.worker.enabled", havingValue = "true", matchIfMissing = true)
    public ActivityWorker activityWorker(WorkerService workerService, ActivityRegistry activityRegistry,
                                         PayloadConverter converter, ObjectProvider<DurableTracer> tracer,
                                         DurableProperties properties) {
        DurableProperties.WorkerProperties worker = properties.getWorker();
        String workerId = worker.getWorkerId() != null ? worker.getWorkerId() : "worker-" + UUID.randomUUID();
        log.info("[durable] Activity worker '{}' configured for queues {}", workerId, worker.getTaskQueues());
        return new ActivityWorker(workerId, workerService, activityRegistry, converter, tracer.getIfAvailable(),
                worker.getTaskQueues(), worker.getMaxConcurrency(), worker.getPollInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.durable.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryService recoveryService(EventLog eventLog, RunLockManager lockManager, WorkflowEngine engine,
                                           ObjectProvider<DeadLetterService> deadLetters) {
        return new RecoveryService(eventLog, lockManager, engine, deadLetters.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public DurableEngineLifecycle durableEngineLifecycle(WorkflowEngine engine, DurableScheduler scheduler,
                                                         ObjectProvider<RecoveryService> recovery,
                                                         ObjectProvider<ActivityWorker> worker,
                                                         DurableProperties properties) {
        return new DurableEngineLifecycle(engine, scheduler, recovery.getIfAvailable(), worker.getIfAvailable(),
                properties.getRecovery().getInterval(), properties.getActivity().getTimeoutSweepInterval());
    }
}

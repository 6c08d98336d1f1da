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
import org.fireflyframework.durable.client.WorkflowClient;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.health.DurableHealthIndicator;
import org.fireflyframework.durable.core.rest.DeadLetterController;
import org.fireflyframework.durable.worker.WorkerService;
import org.fireflyframework.durable.worker.rest.WorkerController;
import org.fireflyframework.durable.workflow.engine.WorkflowEngine;
import org.fireflyframework.durable.workflow.rest.WorkflowController;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for REST endpoints and health indicators.
 */
@Slf4j
@AutoConfiguration(after = DurableAutoConfiguration.class)
public class DurableRestAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.durable.rest.enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowController workflowController(WorkflowClient client) {
        log.info("[durable] Workflow REST controller initialized");
        return new WorkflowController(client);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.durable.rest.enabled", havingValue = "true", matchIfMissing = true)
    public WorkerController workerController(WorkerService workerService) {
        log.info("[durable] Worker REST controller initialized");
        return new WorkerController(workerService);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DeadLetterService.class)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.durable.rest.enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterController deadLetterController(DeadLetterService deadLetterService, WorkflowEngine engine) {
        log.info("[durable] DLQ REST controller initialized");
        return new DeadLetterController(deadLetterService, engine);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(name = "firefly.durable.health.enabled", havingValue = "true", matchIfMissing = true)
    public DurableHealthIndicator durableHealthIndicator(EventLog eventLog, WorkflowEngine engine) {
        log.info("[durable] Health indicator initialized");
        return new DurableHealthIndicator(eventLog, engine);
    }
}

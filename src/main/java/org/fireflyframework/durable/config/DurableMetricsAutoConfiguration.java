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

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.observability.DurableMetrics;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics.
 *
 * <p>Activated when Micrometer is on the classpath and a {@code MeterRegistry}
 * bean is available. The metrics listener joins the composite
 * {@code DurableEvents} assembled by {@link DurableAutoConfiguration}.
 */
@Slf4j
@AutoConfiguration(before = DurableAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(name = "firefly.durable.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class DurableMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DurableMetrics durableMetrics(MeterRegistry meterRegistry) {
        log.info("[durable] Metrics initialized with MeterRegistry");
        return new DurableMetrics(meterRegistry);
    }
}

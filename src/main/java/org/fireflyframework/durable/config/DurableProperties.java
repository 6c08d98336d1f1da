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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties of the durable workflow engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   durable:
 *     engine:
 *       lock-ttl: 30s
 *       max-cycle-retries: 5
 *     persistence:
 *       provider: file
 *       directory: /var/lib/durable
 *     activity:
 *       default-start-to-close-timeout: 5m
 *       retry:
 *         initial-interval: 1s
 *         backoff-coefficient: 2.0
 *         max-interval: 100s
 *         max-attempts: 0
 *     worker:
 *       enabled: true
 *       task-queues: [default, research-tasks]
 *       max-concurrency: 8
 *     recovery:
 *       enabled: true
 *       interval: 30s
 *     scheduling:
 *       thread-pool-size: 4
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.durable")
public class DurableProperties {

    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private ActivityProperties activity = new ActivityProperties();

    @NestedConfigurationProperty
    private WorkerProperties worker = new WorkerProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private SchedulingProperties scheduling = new SchedulingProperties();

    @NestedConfigurationProperty
    private ToggleProperties dlq = new ToggleProperties();

    @NestedConfigurationProperty
    private ToggleProperties metrics = new ToggleProperties();

    @NestedConfigurationProperty
    private ToggleProperties tracing = new ToggleProperties();

    @NestedConfigurationProperty
    private ToggleProperties health = new ToggleProperties();

    @NestedConfigurationProperty
    private ToggleProperties rest = new ToggleProperties();

    @NestedConfigurationProperty
    private ToggleProperties resilience = new ToggleProperties();

    // --- Getters and Setters ---

    public EngineProperties getEngine() { return engine; }
    public void setEngine(EngineProperties engine) { this.engine = engine; }

    public PersistenceProperties getPersistence() { return persistence; }
    public void setPersistence(PersistenceProperties persistence) { this.persistence = persistence; }

    public ActivityProperties getActivity() { return activity; }
    public void setActivity(ActivityProperties activity) { this.activity = activity; }

    public WorkerProperties getWorker() { return worker; }
    public void setWorker(WorkerProperties worker) { this.worker = worker; }

    public RecoveryProperties getRecovery() { return recovery; }
    public void setRecovery(RecoveryProperties recovery) { this.recovery = recovery; }

    public SchedulingProperties getScheduling() { return scheduling; }
    public void setScheduling(SchedulingProperties scheduling) { this.scheduling = scheduling; }

    public ToggleProperties getDlq() { return dlq; }
    public void setDlq(ToggleProperties dlq) { this.dlq = dlq; }

    public ToggleProperties getMetrics() { return metrics; }
    public void setMetrics(ToggleProperties metrics) { this.metrics = metrics; }

    public ToggleProperties getTracing() { return tracing; }
    public void setTracing(ToggleProperties tracing) { this.tracing = tracing; }

    public ToggleProperties getHealth() { return health; }
    public void setHealth(ToggleProperties health) { this.health = health; }

    public ToggleProperties getRest() { return rest; }
    public void setRest(ToggleProperties rest) { this.rest = rest; }

    public ToggleProperties getResilience() { return resilience; }
    public void setResilience(ToggleProperties resilience) { this.resilience = resilience; }

    // --- Nested property classes ---

    public static class EngineProperties {
        /** Lock holder identity; a random one is generated when unset. */
        private String holderId;
        private Duration lockTtl = Duration.ofSeconds(30);
        private Duration lockRetryInterval = Duration.ofSeconds(1);
        private Duration retryBackoff = Duration.ofMillis(100);
        private int maxCycleRetries = 5;
        private Duration resultPollInterval = Duration.ofMillis(200);

        public String getHolderId() { return holderId; }
        public void setHolderId(String holderId) { this.holderId = holderId; }

        public Duration getLockTtl() { return lockTtl; }
        public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }

        public Duration getLockRetryInterval() { return lockRetryInterval; }
        public void setLockRetryInterval(Duration lockRetryInterval) { this.lockRetryInterval = lockRetryInterval; }

        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

        public int getMaxCycleRetries() { return maxCycleRetries; }
        public void setMaxCycleRetries(int maxCycleRetries) { this.maxCycleRetries = maxCycleRetries; }

        public Duration getResultPollInterval() { return resultPollInterval; }
        public void setResultPollInterval(Duration resultPollInterval) { this.resultPollInterval = resultPollInterval; }
    }

    public static class PersistenceProperties {
        /** {@code in-memory}, {@code file} or {@code redis}. */
        private String provider = "in-memory";
        private String directory = "durable-data";
        private String keyPrefix = "durable:";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }

    public static class ActivityProperties {
        private Duration defaultStartToCloseTimeout = Duration.ofMinutes(5);
        private Duration timeoutSweepInterval = Duration.ofSeconds(1);

        @NestedConfigurationProperty
        private RetryProperties retry = new RetryProperties();

        public Duration getDefaultStartToCloseTimeout() { return defaultStartToCloseTimeout; }
        public void setDefaultStartToCloseTimeout(Duration defaultStartToCloseTimeout) { this.defaultStartToCloseTimeout = defaultStartToCloseTimeout; }

        public Duration getTimeoutSweepInterval() { return timeoutSweepInterval; }
        public void setTimeoutSweepInterval(Duration timeoutSweepInterval) { this.timeoutSweepInterval = timeoutSweepInterval; }

        public RetryProperties getRetry() { return retry; }
        public void setRetry(RetryProperties retry) { this.retry = retry; }
    }

    public static class RetryProperties {
        private Duration initialInterval = Duration.ofSeconds(1);
        private double backoffCoefficient = 2.0;
        private Duration maxInterval = Duration.ofSeconds(100);
        private int maxAttempts = 0;
        private List<String> nonRetryableErrorTypes = new ArrayList<>();

        public Duration getInitialInterval() { return initialInterval; }
        public void setInitialInterval(Duration initialInterval) { this.initialInterval = initialInterval; }

        public double getBackoffCoefficient() { return backoffCoefficient; }
        public void setBackoffCoefficient(double backoffCoefficient) { this.backoffCoefficient = backoffCoefficient; }

        public Duration getMaxInterval() { return maxInterval; }
        public void setMaxInterval(Duration maxInterval) { this.maxInterval = maxInterval; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public List<String> getNonRetryableErrorTypes() { return nonRetryableErrorTypes; }
        public void setNonRetryableErrorTypes(List<String> nonRetryableErrorTypes) { this.nonRetryableErrorTypes = nonRetryableErrorTypes; }
    }

    public static class WorkerProperties {
        private boolean enabled = true;
        private String workerId;
        private List<String> taskQueues = new ArrayList<>(List.of("default"));
        private int maxConcurrency = 8;
        private Duration pollInterval = Duration.ofMillis(100);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getWorkerId() { return workerId; }
        public void setWorkerId(String workerId) { this.workerId = workerId; }

        public List<String> getTaskQueues() { return taskQueues; }
        public void setTaskQueues(List<String> taskQueues) { this.taskQueues = taskQueues; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class RecoveryProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class SchedulingProperties {
        private int threadPoolSize = 4;

        public int getThreadPoolSize() { return threadPoolSize; }
        public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }
    }

    public static class ToggleProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}

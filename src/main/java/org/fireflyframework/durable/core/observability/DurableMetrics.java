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


package org.fireflyframework.durable.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class DurableMetrics implements DurableEvents {
    private static final String PREFIX = "firefly.durable";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public DurableMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onWorkflowStarted(String workflowType, RunKey runKey) {
        counter("workflows.started", "type", workflowType).increment();
    }

    @Override
    public void onDecisionCycle(String workflowType, RunKey runKey, int appendedEvents, long latencyMs) {
        timer("decisions.duration", "type", workflowType).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onWorkflowClosed(String workflowType, RunKey runKey, RunStatus status, long durationMs) {
        counter("workflows.closed", "type", workflowType, "status", status.name()).increment();
        timer("workflows.duration", "type", workflowType).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onActivityCompleted(String activityName, RunKey runKey, int attempt, long latencyMs) {
        counter("activities.completed", "name", activityName, "success", "true").increment();
        timer("activities.duration", "name", activityName).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onActivityRetryScheduled(String activityName, RunKey runKey, int failedAttempt, Duration delay, String errorType) {
        counter("activities.retries", "name", activityName).increment();
    }

    @Override
    public void onActivityFailed(String activityName, RunKey runKey, int attempts, String errorType) {
        counter("activities.completed", "name", activityName, "success", "false").increment();
    }

    @Override
    public void onActivityTimedOut(String activityName, RunKey runKey, int attempt, String timeoutType) {
        counter("activities.timeouts", "name", activityName, "timeout", timeoutType).increment();
    }

    @Override
    public void onLeaseLost(RunKey runKey, String holderId) {
        counter("leases.lost").increment();
    }

    @Override
    public void onRunRecovered(String workflowType, RunKey runKey) {
        counter("runs.recovered", "type", workflowType).increment();
    }

    @Override
    public void onDeadLettered(String workflowType, RunKey runKey, Throwable error) {
        counter("dlq.entries", "type", workflowType).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}

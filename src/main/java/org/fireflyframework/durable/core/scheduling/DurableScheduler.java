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


package org.fireflyframework.durable.core.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named periodic and one-shot tasks on a small daemon pool. Drives timer
 * firing, activity timeout sweeps and recovery scans.
 */
@Slf4j
public class DurableScheduler {
    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    public DurableScheduler(int threadPoolSize) {
        var counter = new AtomicInteger(0);
        this.executor = Executors.newScheduledThreadPool(threadPoolSize, r -> {
            Thread t = new Thread(r, "durable-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Runs {@code task} repeatedly. Scheduling the same id again replaces the previous task. */
    public void scheduleWithFixedDelay(String taskId, Runnable task, long initialDelayMs, long delayMs) {
        replace(taskId, executor.scheduleWithFixedDelay(guarded(taskId, task),
                initialDelayMs, delayMs, TimeUnit.MILLISECONDS));
        log.info("[scheduler] '{}' runs every {}ms", taskId, delayMs);
    }

    /**
     * Runs {@code task} once after {@code delayMs}. Scheduling the same id
     * again replaces the pending execution.
     */
    public void scheduleOnce(String taskId, Runnable task, long delayMs) {
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        Runnable body = guarded(taskId, task);
        synchronized (self) {
            self[0] = executor.schedule(() -> {
                synchronized (self) {
                    scheduledTasks.remove(taskId, self[0]);
                }
                body.run();
            }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
            replace(taskId, self[0]);
        }
        log.debug("[scheduler] '{}' fires in {}ms", taskId, delayMs);
    }

    private void replace(String taskId, ScheduledFuture<?> future) {
        ScheduledFuture<?> previous = scheduledTasks.put(taskId, future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    // A throwing task must not kill its periodic schedule.
    private static Runnable guarded(String taskId, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[scheduler] Task '{}' failed: {}", taskId, e.getMessage(), e);
            }
        };
    }

    public boolean isScheduled(String taskId) {
        return scheduledTasks.containsKey(taskId);
    }

    public void cancel(String taskId) {
        var future = scheduledTasks.remove(taskId);
        if (future != null) {
            future.cancel(false);
            log.debug("[scheduler] Cancelled task '{}'", taskId);
        }
    }

    /** Cancels every task whose id starts with {@code prefix}. Returns how many were cancelled. */
    public int cancelByPrefix(String prefix) {
        int cancelled = 0;
        for (var it = scheduledTasks.entrySet().iterator(); it.hasNext(); ) {
            var entry = it.next();
            if (entry.getKey().startsWith(prefix)) {
                it.remove();
                entry.getValue().cancel(false);
                cancelled++;
            }
        }
        return cancelled;
    }

    public void shutdown() {
        scheduledTasks.values().forEach(f -> f.cancel(false));
        scheduledTasks.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[scheduler] Stopped");
    }

    public int activeTaskCount() {
        return scheduledTasks.size();
    }
}

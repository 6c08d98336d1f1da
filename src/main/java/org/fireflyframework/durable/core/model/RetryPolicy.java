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


package org.fireflyframework.durable.core.model;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.List;

/**
 * Retry policy applied by the activity scheduler to each failed attempt.
 *
 * <p>The delay before attempt {@code n + 1} is
 * {@code min(initialInterval * backoffCoefficient^(n - 1), maxInterval)}.
 * A {@code maxAttempts} of {@code 0} means unlimited attempts.
 *
 * @param initialInterval        delay before the first retry
 * @param backoffCoefficient     multiplier applied per attempt, at least 1.0
 * @param maxInterval            upper bound of any single delay
 * @param maxAttempts            total attempts including the first, 0 for unlimited
 * @param nonRetryableErrorTypes error type names that are never retried
 */
public record RetryPolicy(
        Duration initialInterval,
        double backoffCoefficient,
        Duration maxInterval,
        int maxAttempts,
        List<String> nonRetryableErrorTypes
) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(
            Duration.ofSeconds(1), 2.0, Duration.ofSeconds(100), 0, List.of());

    public static final RetryPolicy NO_RETRY = new RetryPolicy(
            Duration.ofSeconds(1), 1.0, Duration.ofSeconds(1), 1, List.of());

    public RetryPolicy {
        if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
            throw new IllegalArgumentException("initialInterval must be positive");
        }
        if (backoffCoefficient < 1.0) throw new IllegalArgumentException("backoffCoefficient must be >= 1.0");
        if (maxInterval == null || maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= initialInterval");
        }
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        nonRetryableErrorTypes = nonRetryableErrorTypes == null ? List.of() : List.copyOf(nonRetryableErrorTypes);
    }

    public static RetryPolicy of(Duration initialInterval, double backoffCoefficient,
                                 Duration maxInterval, int maxAttempts) {
        return new RetryPolicy(initialInterval, backoffCoefficient, maxInterval, maxAttempts, List.of());
    }

    public RetryPolicy withNonRetryableErrorTypes(String... types) {
        return new RetryPolicy(initialInterval, backoffCoefficient, maxInterval, maxAttempts, List.of(types));
    }

    /**
     * Delay to wait after the given (1-based) attempt failed.
     */
    public Duration calculateDelay(int failedAttempt) {
        int attempt = Math.max(1, failedAttempt);
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                initialInterval, backoffCoefficient, maxInterval);
        return Duration.ofMillis(backoff.apply(attempt));
    }

    public boolean shouldRetry(int failedAttempt) {
        return maxAttempts == 0 || failedAttempt < maxAttempts;
    }

    public boolean isUnlimited() {
        return maxAttempts == 0;
    }

    public boolean isNonRetryable(String errorType) {
        return errorType != null && nonRetryableErrorTypes.contains(errorType);
    }
}

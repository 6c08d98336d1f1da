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


package org.fireflyframework.durable.core.exception;

/**
 * Thrown by activity implementations to fail the activity without any
 * further attempt. The optional error type is recorded in history and
 * surfaces in the {@link ActivityFailureException} the workflow sees.
 */
public class NonRetryableActivityException extends DurableException {
    private final String errorType;

    public NonRetryableActivityException(String message) {
        this(null, message);
    }

    public NonRetryableActivityException(String errorType, String message) {
        super(message, "DURABLE_ACTIVITY_NON_RETRYABLE");
        this.errorType = errorType;
    }

    public NonRetryableActivityException(String errorType, String message, Throwable cause) {
        super(message, "DURABLE_ACTIVITY_NON_RETRYABLE", cause);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType != null ? errorType : getClass().getSimpleName();
    }
}

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
 * A fail-fast join observed its first failing member.
 */
public final class JoinFailedException extends DurableException {
    private final int failedIndex;

    public JoinFailedException(int failedIndex, Throwable cause) {
        super("Join failed at index " + failedIndex + ": " + cause.getMessage(), "DURABLE_JOIN_FAILED", cause);
        this.failedIndex = failedIndex;
    }

    public int getFailedIndex() {
        return failedIndex;
    }
}

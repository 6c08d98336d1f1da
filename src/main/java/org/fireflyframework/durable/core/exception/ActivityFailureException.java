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
 * Typed activity failure handed to workflow logic once the activity has
 * terminally failed or timed out. Workflows may catch it to fall back.
 */
public class ActivityFailureException extends DurableException {
    private final String activityName;
    private final String errorType;
    private final int attempts;
    private final boolean timedOut;

    public ActivityFailureException(String activityName, String errorType, String message,
                                    int attempts, boolean timedOut) {
        super("Activity '" + activityName + "' failed after " + attempts + " attempt(s): " + message,
                timedOut ? "DURABLE_ACTIVITY_TIMED_OUT" : "DURABLE_ACTIVITY_FAILED");
        this.activityName = activityName;
        this.errorType = errorType;
        this.attempts = attempts;
        this.timedOut = timedOut;
    }

    public String getActivityName() { return activityName; }
    public String getErrorType() { return errorType; }
    public int getAttempts() { return attempts; }
    public boolean isTimedOut() { return timedOut; }
}

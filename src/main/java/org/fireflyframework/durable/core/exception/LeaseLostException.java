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

import org.fireflyframework.durable.core.model.RunKey;

public final class LeaseLostException extends DurableException {

    public LeaseLostException(RunKey runKey, String holderId) {
        super("Run lock for " + runKey + " is no longer held by " + holderId, "DURABLE_LEASE_LOST");
    }

    public LeaseLostException(RunKey runKey, String holderId, Throwable cause) {
        super("Run lock for " + runKey + " is no longer held by " + holderId, "DURABLE_LEASE_LOST", cause);
    }
}

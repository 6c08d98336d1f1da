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

/**
 * Replay produced a command that does not match what the run's history
 * recorded at the same position. The run is halted and never retried
 * automatically.
 */
public final class NonDeterminismException extends DurableException {
    private final RunKey runKey;
    private final int commandId;

    public NonDeterminismException(RunKey runKey, int commandId, String message) {
        super("Run " + runKey + " command #" + commandId + ": " + message, "DURABLE_NON_DETERMINISM");
        this.runKey = runKey;
        this.commandId = commandId;
    }

    public RunKey getRunKey() {
        return runKey;
    }

    public int getCommandId() {
        return commandId;
    }
}

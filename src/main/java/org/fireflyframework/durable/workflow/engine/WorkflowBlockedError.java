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


package org.fireflyframework.durable.workflow.engine;

/**
 * Unwinds workflow logic that waits on a result not yet in history. An
 * {@link Error} so ordinary {@code catch (Exception e)} blocks in workflow
 * code do not intercept it.
 */
final class WorkflowBlockedError extends Error {

    static final WorkflowBlockedError INSTANCE = new WorkflowBlockedError();

    private WorkflowBlockedError() {
        super("workflow blocked", null, false, false);
    }
}

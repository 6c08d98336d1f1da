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


package org.fireflyframework.durable.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.exception.DuplicateDefinitionException;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit mapping from workflow type to its registered definition.
 */
@Slf4j
public class WorkflowRegistry {

    private final ConcurrentHashMap<String, WorkflowDefinition<?, ?>> definitions = new ConcurrentHashMap<>();

    public void register(WorkflowDefinition<?, ?> definition) {
        if (definitions.putIfAbsent(definition.workflowType(), definition) != null) {
            throw new DuplicateDefinitionException("Workflow", definition.workflowType());
        }
        log.info("[workflow-registry] Registered workflow '{}'", definition.workflowType());
    }

    public WorkflowDefinition<?, ?> getWorkflow(String workflowType) {
        WorkflowDefinition<?, ?> def = definitions.get(workflowType);
        if (def == null) {
            throw new UnregisteredTypeException("Workflow", workflowType);
        }
        return def;
    }

    public Optional<WorkflowDefinition<?, ?>> get(String workflowType) {
        return Optional.ofNullable(definitions.get(workflowType));
    }

    public boolean hasWorkflow(String workflowType) {
        return definitions.containsKey(workflowType);
    }

    public Collection<WorkflowDefinition<?, ?>> getAll() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public void unregister(String workflowType) {
        definitions.remove(workflowType);
    }
}

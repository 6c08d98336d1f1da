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


package org.fireflyframework.durable.activity;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.core.exception.DuplicateDefinitionException;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit mapping from activity name to its registered definition.
 */
@Slf4j
public class ActivityRegistry {

    private final ConcurrentHashMap<String, ActivityDefinition<?, ?>> definitions = new ConcurrentHashMap<>();

    public void register(ActivityDefinition<?, ?> definition) {
        if (definitions.putIfAbsent(definition.name(), definition) != null) {
            throw new DuplicateDefinitionException("Activity", definition.name());
        }
        log.info("[activity-registry] Registered activity '{}'", definition.name());
    }

    public ActivityDefinition<?, ?> getActivity(String name) {
        ActivityDefinition<?, ?> def = definitions.get(name);
        if (def == null) {
            throw new UnregisteredTypeException("Activity", name);
        }
        return def;
    }

    public Optional<ActivityDefinition<?, ?>> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean hasActivity(String name) {
        return definitions.containsKey(name);
    }

    public Collection<ActivityDefinition<?, ?>> getAll() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public void unregister(String name) {
        definitions.remove(name);
    }
}

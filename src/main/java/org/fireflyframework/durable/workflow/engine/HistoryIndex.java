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

import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only index over one run's history: commands in issue order, the
 * first outcome of each command, signals per name and the run's status.
 */
public final class HistoryIndex {

    private final RunKey runKey;
    private final List<HistoryEvent> events;
    private final List<HistoryEvent> commands = new ArrayList<>();
    private final Map<Integer, HistoryEvent> outcomes = new HashMap<>();
    private final Map<String, List<HistoryEvent>> signals = new LinkedHashMap<>();
    private final Set<Integer> cancelledChildren = new HashSet<>();
    private final Set<String> deliveries = new HashSet<>();
    private HistoryEvent cancelRequested;
    private HistoryEvent terminal;

    private HistoryIndex(RunKey runKey, List<HistoryEvent> events) {
        this.runKey = runKey;
        this.events = List.copyOf(events);
    }

    public static HistoryIndex of(List<HistoryEvent> events) {
        return of(null, events);
    }

    public static HistoryIndex of(RunKey runKey, List<HistoryEvent> events) {
        if (events.isEmpty() || events.get(0).type() != EventType.WORKFLOW_STARTED) {
            throw new IllegalStateException("History must begin with WORKFLOW_STARTED");
        }
        HistoryIndex index = new HistoryIndex(runKey, events);
        for (int i = 0; i < events.size(); i++) {
            HistoryEvent event = events.get(i);
            if (event.seq() != i) {
                throw new IllegalStateException("History is not contiguous at seq " + i);
            }
            index.accept(event);
        }
        return index;
    }

    private void accept(HistoryEvent event) {
        EventType type = event.type();
        String deliveryId = event.getString(HistoryEvents.DELIVERY_ID);
        if (deliveryId != null) deliveries.add(deliveryId);
        if (type.isCommand()) {
            if (event.commandId() != commands.size()) {
                throw new IllegalStateException("Command event " + event.seq() + " has commandId "
                        + event.commandId() + ", expected " + commands.size());
            }
            commands.add(event);
            if (type == EventType.CHILD_WORKFLOW_CANCEL_REQUESTED) {
                cancelledChildren.add(event.getInt(HistoryEvents.TARGET_COMMAND_ID));
            }
        } else if (type.isOutcome()) {
            outcomes.putIfAbsent(event.commandId(), event);
        } else if (type == EventType.SIGNAL_RECEIVED) {
            signals.computeIfAbsent(event.getString(HistoryEvents.SIGNAL_NAME), k -> new ArrayList<>()).add(event);
        } else if (type == EventType.CANCEL_REQUESTED) {
            if (cancelRequested == null) cancelRequested = event;
        } else if (type.isTerminal()) {
            if (terminal == null) terminal = event;
        }
    }

    /** Run this history belongs to, when known. */
    public RunKey runKey() {
        return runKey;
    }

    public List<HistoryEvent> events() {
        return events;
    }

    public int length() {
        return events.size();
    }

    public HistoryEvent started() {
        return events.get(0);
    }

    public String workflowType() {
        return started().getString(HistoryEvents.WORKFLOW_TYPE);
    }

    public Object input() {
        return started().get(HistoryEvents.INPUT);
    }

    public String taskQueue() {
        return started().getString(HistoryEvents.TASK_QUEUE);
    }

    public Instant startTime() {
        return started().timestamp();
    }

    public Instant closeTime() {
        return terminal != null ? terminal.timestamp() : null;
    }

    public RunStatus status() {
        return terminal != null ? terminal.type().terminalStatus() : RunStatus.RUNNING;
    }

    public boolean isClosed() {
        return terminal != null;
    }

    public HistoryEvent terminal() {
        return terminal;
    }

    public HistoryEvent cancelRequested() {
        return cancelRequested;
    }

    public int commandCount() {
        return commands.size();
    }

    public HistoryEvent command(int commandId) {
        return commands.get(commandId);
    }

    public HistoryEvent outcome(int commandId) {
        return outcomes.get(commandId);
    }

    public boolean isResolved(int commandId) {
        return outcomes.containsKey(commandId);
    }

    /** Whether the inbox entry with this id is already part of history. */
    public boolean isDelivered(String deliveryId) {
        return deliveries.contains(deliveryId);
    }

    public boolean isCancelRequested(int childCommandId) {
        return cancelledChildren.contains(childCommandId);
    }

    public HistoryEvent signal(String name, int ordinal) {
        List<HistoryEvent> received = signals.getOrDefault(name, List.of());
        return ordinal < received.size() ? received.get(ordinal) : null;
    }

    public Map<String, Integer> signalCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        signals.forEach((name, list) -> counts.put(name, list.size()));
        return Collections.unmodifiableMap(counts);
    }

    public List<HistoryEvent> outstanding(EventType commandType) {
        List<HistoryEvent> pending = new ArrayList<>();
        for (HistoryEvent command : commands) {
            if (command.type() == commandType && !outcomes.containsKey(command.commandId())) {
                pending.add(command);
            }
        }
        return pending;
    }

    /**
     * Name compared by the determinism check: activity name, child workflow
     * type, target of a child cancellation; timers have none.
     */
    static String commandName(HistoryEvent command) {
        return switch (command.type()) {
            case ACTIVITY_SCHEDULED -> command.getString(HistoryEvents.ACTIVITY_NAME);
            case CHILD_WORKFLOW_STARTED -> command.getString(HistoryEvents.WORKFLOW_TYPE);
            case CHILD_WORKFLOW_CANCEL_REQUESTED -> command.getString(HistoryEvents.TARGET_COMMAND_ID);
            default -> null;
        };
    }
}

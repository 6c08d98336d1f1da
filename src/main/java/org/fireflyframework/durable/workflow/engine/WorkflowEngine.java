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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.durable.activity.ActivityRegistry;
import org.fireflyframework.durable.activity.ActivityScheduler;
import org.fireflyframework.durable.activity.ActivityTask;
import org.fireflyframework.durable.core.dlq.DeadLetterService;
import org.fireflyframework.durable.core.eventlog.EventLog;
import org.fireflyframework.durable.core.exception.EventLogConflictException;
import org.fireflyframework.durable.core.exception.LeaseLostException;
import org.fireflyframework.durable.core.exception.NonDeterminismException;
import org.fireflyframework.durable.core.exception.UnregisteredTypeException;
import org.fireflyframework.durable.core.exception.WorkflowAlreadyStartedException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.history.PendingEvent;
import org.fireflyframework.durable.core.history.RunEventSink;
import org.fireflyframework.durable.core.inbox.InboxEntry;
import org.fireflyframework.durable.core.inbox.RunInbox;
import org.fireflyframework.durable.core.lock.RunLockManager;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.core.model.RunStatus;
import org.fireflyframework.durable.core.observability.DurableEvents;
import org.fireflyframework.durable.core.observability.DurableTracer;
import org.fireflyframework.durable.core.queue.TaskQueue;
import org.fireflyframework.durable.core.scheduling.DurableScheduler;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import org.fireflyframework.durable.workflow.registry.WorkflowRegistry;
import org.fireflyframework.durable.workflow.timer.TimerService;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives decision cycles. Every event for a run (activity outcomes, timer
 * fires, signals, cancellations, child outcomes) is offered to the run's
 * shared {@link RunInbox}, whichever engine produced it. A cycle reads the
 * pending entries, replays the workflow against history plus those events,
 * and appends the events together with the new decisions as one batch; the
 * entries are acknowledged only after that append. Side effects of the
 * decisions are dispatched only after the append succeeded.
 *
 * <p>At most one cycle per run runs at a time in this process, and only while
 * the engine holds the run's {@link org.fireflyframework.durable.core.lock.RunLock}.
 * The lock is kept across cycles and renewed every {@code ttl / 3} until the
 * run closes. The first cycle after the lock is (re)acquired reconciles the
 * run's outstanding timers, activities, children and run timeout with history.
 * Entries offered by other engines are picked up by checking the inbox of
 * every held run each {@code lockRetryInterval}.
 */
@Slf4j
public class WorkflowEngine implements RunEventSink {

    public static final String START_GUARD_RUN_ID = "~start";
    static final String CANCELLED_BY_PARENT = "Cancelled by parent workflow";

    private final EventLog eventLog;
    private final RunLockManager lockManager;
    private final RunInbox inbox;
    private final WorkflowRegistry registry;
    private final WorkflowExecutor executor;
    private final ActivityScheduler activityScheduler;
    private final TimerService timerService;
    private final DurableScheduler scheduler;
    private final DeadLetterService deadLetters;
    private final PayloadConverter converter;
    private final DurableEvents events;
    private final DurableTracer tracer;
    private final Clock clock;
    private final EngineSettings settings;

    private final Map<RunKey, RunSlot> slots = new ConcurrentHashMap<>();
    private final Map<RunKey, Sinks.One<HistoryEvent>> closeWaiters = new ConcurrentHashMap<>();
    private volatile boolean stopped;

    public WorkflowEngine(EventLog eventLog, RunLockManager lockManager, RunInbox inbox, WorkflowRegistry registry,
                          ActivityRegistry activityRegistry, TaskQueue taskQueue, DurableScheduler scheduler,
                          PayloadConverter converter, DurableEvents events, DeadLetterService deadLetters,
                          DurableTracer tracer, Clock clock, EngineSettings settings) {
        this.eventLog = eventLog;
        this.lockManager = lockManager;
        this.inbox = inbox;
        this.registry = registry;
        this.scheduler = scheduler;
        this.deadLetters = deadLetters;
        this.converter = converter;
        this.events = events;
        this.tracer = tracer;
        this.clock = clock;
        this.settings = settings;
        this.executor = new WorkflowExecutor(converter);
        this.activityScheduler = new ActivityScheduler(taskQueue, activityRegistry, this, converter, events, clock,
                settings.defaultStartToCloseTimeout(), settings.defaultRetryPolicy());
        this.timerService = new TimerService(scheduler, this, events, clock);
        long pollMs = settings.lockRetryInterval().toMillis();
        scheduler.scheduleWithFixedDelay(inboxPollTask(), this::pollInboxes, pollMs, pollMs);
    }

    // ── Public API ────────────────────────────────────────────────

    /**
     * Starts a new run of {@code workflowType}. Fails with
     * {@link WorkflowAlreadyStartedException} when the workflowId's current run
     * is still running; a closed workflowId gets a fresh run.
     */
    public Mono<RunKey> start(String workflowType, String workflowId, Object input,
                              String taskQueue, Duration runTimeout) {
        return Mono.defer(() -> {
            if (stopped) return Mono.error(new IllegalStateException("Engine " + settings.holderId() + " is stopped"));
            WorkflowDefinition<?, ?> definition = registry.getWorkflow(workflowType);
            String id = workflowId != null ? workflowId : UUID.randomUUID().toString();
            RunKey runKey = RunKey.of(id, UUID.randomUUID().toString());
            String queue = taskQueue != null ? taskQueue : definition.defaultTaskQueue();
            Duration timeout = runTimeout != null ? runTimeout : definition.defaultRunTimeout();
            Object payload = converter.toPayload(input);

            RunKey guard = RunKey.of(id, START_GUARD_RUN_ID);
            Mono<RunKey> create = currentRun(id)
                    .flatMap(current -> current.isClosed()
                            ? Mono.<RunKey>empty()
                            : Mono.<RunKey>error(new WorkflowAlreadyStartedException(id, current.runKey().runId())))
                    .switchIfEmpty(Mono.defer(() -> {
                        Instant now = clock.instant();
                        PendingEvent started = HistoryEvents.workflowStarted(workflowType, payload, queue,
                                timeout != null ? now.plus(timeout) : null, null, null);
                        return eventLog.append(runKey, 0, List.of(started.toHistoryEvent(0, now)))
                                .thenReturn(runKey);
                    }));
            return Mono.usingWhen(acquireStartGuard(guard), acquired -> create,
                            acquired -> lockManager.release(guard, settings.holderId()))
                    .doOnSuccess(key -> {
                        log.info("[engine] Started workflow '{}' as {}", workflowType, key);
                        events.onWorkflowStarted(workflowType, key);
                        wake(key);
                    });
        });
    }

    /**
     * Offers the event to the run's inbox and wakes the run here. When another
     * engine holds the run's lock, that engine picks the entry up.
     */
    @Override
    public Mono<Void> deliver(RunKey runKey, PendingEvent event) {
        return Mono.defer(() -> {
            if (stopped) {
                log.debug("[engine] Engine stopped, dropping {} for {}", event.type(), runKey);
                return Mono.<Void>empty();
            }
            return inbox.offer(runKey, InboxEntry.of(event))
                    .doOnSuccess(v -> wake(runKey));
        });
    }

    /** Schedules a decision cycle without delivering anything. */
    public void wake(RunKey runKey) {
        if (stopped) return;
        trigger(slots.computeIfAbsent(runKey, RunSlot::new));
    }

    /**
     * Takes over a run that no process is driving. Emits {@code false} when this
     * engine already drives it.
     */
    public Mono<Boolean> recover(RunKey runKey, String workflowType) {
        return Mono.fromCallable(() -> {
            if (stopped) return false;
            RunSlot existing = slots.get(runKey);
            if (existing != null && existing.lockHeld) return false;
            log.info("[engine] Recovering run {} ({})", runKey, workflowType);
            events.onRunRecovered(workflowType, runKey);
            wake(runKey);
            return true;
        });
    }

    /** Lets a run halted for non-determinism run again. */
    public Mono<Void> resume(RunKey runKey) {
        return Mono.fromRunnable(() -> {
            RunSlot slot = slots.get(runKey);
            if (slot != null) {
                slot.deadLettered = false;
                slot.reconciled = false;
            }
            log.info("[engine] Resuming run {}", runKey);
            wake(runKey);
        });
    }

    /** Emits the run's terminal event once it is recorded. */
    public Mono<HistoryEvent> awaitClose(RunKey runKey) {
        Sinks.One<HistoryEvent> waiter = closeWaiters.computeIfAbsent(runKey, k -> Sinks.one());
        Mono<HistoryEvent> polled = Flux.interval(Duration.ZERO, settings.resultPollInterval())
                .concatMap(tick -> terminalEvent(runKey))
                .next();
        return Mono.firstWithValue(waiter.asMono(), polled)
                .doFinally(signal -> closeWaiters.remove(runKey, waiter));
    }

    public Mono<List<HistoryEvent>> history(RunKey runKey) {
        return eventLog.read(runKey).collectList();
    }

    /** The most recently started run of a workflowId, if any. */
    public Mono<HistoryIndex> currentRun(String workflowId) {
        return eventLog.runs(workflowId)
                .concatMap(key -> eventLog.read(key).collectList()
                        .filter(history -> !history.isEmpty())
                        .map(history -> HistoryIndex.of(key, history)))
                .reduce((a, b) -> LATEST_RUN.compare(a, b) >= 0 ? a : b);
    }

    private static final Comparator<HistoryIndex> LATEST_RUN = Comparator
            .comparing(HistoryIndex::startTime)
            .thenComparing(index -> !index.isClosed());

    public boolean isDriving(RunKey runKey) {
        RunSlot slot = slots.get(runKey);
        return slot != null && slot.lockHeld;
    }

    public int activeRunCount() {
        return slots.size();
    }

    public boolean isStopped() {
        return stopped;
    }

    public String holderId() {
        return settings.holderId();
    }

    public EngineSettings settings() {
        return settings;
    }

    public ActivityScheduler activityScheduler() {
        return activityScheduler;
    }

    public TimerService timerService() {
        return timerService;
    }

    public WorkflowExecutor executor() {
        return executor;
    }

    /**
     * Stops processing immediately, as if the process died: locks are neither
     * renewed nor released. Inbox entries stay pending for the next holder.
     */
    public void halt() {
        stopped = true;
        scheduler.cancel(inboxPollTask());
        slots.values().forEach(slot -> {
            slot.disposeRenewal();
            timerService.cancelRun(slot.runKey);
            scheduler.cancel(runTimeoutTask(slot.runKey));
        });
        slots.clear();
        log.warn("[engine] Engine {} halted", settings.holderId());
    }

    /** Stops processing and releases every lock this engine holds. */
    public Mono<Void> shutdown() {
        stopped = true;
        scheduler.cancel(inboxPollTask());
        List<RunSlot> active = new ArrayList<>(slots.values());
        slots.clear();
        return Flux.fromIterable(active)
                .concatMap(slot -> {
                    timerService.cancelRun(slot.runKey);
                    scheduler.cancel(runTimeoutTask(slot.runKey));
                    return releaseLock(slot).onErrorResume(e -> {
                        log.warn("[engine] Failed to release lock of {}: {}", slot.runKey, e.getMessage());
                        return Mono.empty();
                    });
                })
                .then()
                .doOnSuccess(v -> log.info("[engine] Engine {} shut down, released {} run(s)",
                        settings.holderId(), active.size()));
    }

    // ── Cycle scheduling ──────────────────────────────────────────

    private void trigger(RunSlot slot) {
        if (stopped) return;
        slot.dirty.set(true);
        if (slot.running.compareAndSet(false, true)) {
            slot.dirty.set(false);
            Mono.defer(() -> cycle(slot))
                    .retryWhen(Retry.backoff(settings.maxCycleRetries(), settings.retryBackoff())
                            .filter(WorkflowEngine::isTransient)
                            .doBeforeRetry(signal -> log.warn("[engine] Retrying decision cycle of {} (attempt {}): {}",
                                    slot.runKey, signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(outcome -> afterCycle(slot, outcome), error -> afterError(slot, error));
        }
    }

    private void afterCycle(RunSlot slot, CycleOutcome outcome) {
        slot.running.set(false);
        if (stopped) return;
        switch (outcome) {
            case CLOSED -> { }
            // the holder drains what was offered; lock expiry hands the run to recovery
            case LOCK_BUSY -> slots.remove(slot.runKey, slot);
            default -> {
                if (slot.dirty.get()) trigger(slot);
            }
        }
    }

    private void afterError(RunSlot slot, Throwable error) {
        slot.running.set(false);
        slot.reconciled = false;
        if (stopped) return;
        if (error instanceof LeaseLostException || error instanceof EventLogConflictException) {
            log.warn("[engine] Decision cycle of {} lost ownership: {}", slot.runKey, error.getMessage());
            onLeaseLost(slot);
            retryLater(slot);
            return;
        }
        log.error("[engine] Decision cycle of {} failed, leaving the run to recovery: {}",
                slot.runKey, error.getMessage(), error);
        releaseLock(slot).subscribe(null, e -> log.warn("[engine] Failed to release lock of {}: {}",
                slot.runKey, e.getMessage()));
    }

    private void pollInboxes() {
        if (stopped) return;
        for (RunSlot slot : slots.values()) {
            if (!slot.lockHeld || slot.running.get()) continue;
            inbox.hasPending(slot.runKey)
                    .filter(Boolean::booleanValue)
                    .subscribe(pending -> trigger(slot),
                            e -> log.warn("[engine] Checking inbox of {} failed: {}", slot.runKey, e.getMessage()));
        }
    }

    private String inboxPollTask() {
        return "durable-inbox-" + settings.holderId();
    }

    private void retryLater(RunSlot slot) {
        Mono.delay(settings.lockRetryInterval())
                .subscribe(tick -> {
                    if (slots.get(slot.runKey) == slot) trigger(slot);
                });
    }

    private static boolean isTransient(Throwable error) {
        return !(error instanceof NonDeterminismException)
                && !(error instanceof LeaseLostException)
                && !(error instanceof EventLogConflictException)
                && !(error instanceof UnregisteredTypeException);
    }

    // ── Decision cycle ────────────────────────────────────────────

    private Mono<CycleOutcome> cycle(RunSlot slot) {
        if (stopped) return Mono.just(CycleOutcome.HALTED);
        return ensureLock(slot).flatMap(acquired -> {
            if (!acquired) {
                log.debug("[engine] Lock of {} is held elsewhere", slot.runKey);
                return Mono.just(CycleOutcome.LOCK_BUSY);
            }
            return Mono.zip(eventLog.read(slot.runKey).collectList(), inbox.pending(slot.runKey).collectList())
                    .flatMap(state -> process(slot, state.getT1(), state.getT2()));
        });
    }

    private Mono<CycleOutcome> process(RunSlot slot, List<HistoryEvent> history, List<InboxEntry> pending) {
        RunKey runKey = slot.runKey;
        if (history.isEmpty()) {
            log.warn("[engine] Dropping {} event(s) delivered to unknown run {}", pending.size(), runKey);
            slots.remove(runKey, slot);
            return inbox.purge(runKey).then(releaseLock(slot)).thenReturn(CycleOutcome.CLOSED);
        }
        HistoryIndex index = HistoryIndex.of(history);
        if (index.isClosed()) {
            if (!pending.isEmpty()) log.debug("[engine] Dropping {} late event(s) for closed run {}", pending.size(), runKey);
            return inbox.purge(runKey).then(close(slot, index, false)).thenReturn(CycleOutcome.CLOSED);
        }
        String workflowType = index.workflowType();
        long startedAt = System.nanoTime();

        Drained drained = drain(runKey, pending, index);
        List<PendingEvent> inbound = drained.events();
        long base = history.size();
        Instant now = clock.instant();
        List<HistoryEvent> received = number(inbound, base, now);
        List<HistoryEvent> replayHistory = concat(history, received);

        if (slot.deadLettered) {
            return appendBatch(slot, base, received, drained)
                    .then(releaseLock(slot))
                    .thenReturn(CycleOutcome.HALTED);
        }

        WorkflowDefinition<?, ?> definition = registry.getWorkflow(workflowType);
        HistoryIndex afterInbound = HistoryIndex.of(replayHistory);
        ReplayResult result;
        if (afterInbound.isClosed()) {
            result = ReplayResult.none(now);
        } else {
            try {
                result = executor.decide(definition, runKey, replayHistory);
            } catch (NonDeterminismException e) {
                return haltNonDeterministic(slot, workflowType, base, received, drained, e);
            }
        }
        List<PendingEvent> decisionEvents = new ArrayList<>(result.decisions().size());
        for (Decision decision : result.decisions()) {
            decisionEvents.add(decision.toEvent());
        }
        List<HistoryEvent> decided = number(decisionEvents, base + received.size(), now);
        List<HistoryEvent> batch = concat(received, decided);
        ReplayResult decisions = result;

        Mono<CycleOutcome> cycle = appendBatch(slot, base, batch, drained)
                .then(Mono.defer(() -> slot.reconciled ? Mono.<Void>empty() : reconcile(slot, afterInbound)))
                .then(Mono.defer(() -> dispatch(slot, afterInbound, decisions)))
                .then(Mono.defer(() -> {
                    events.onDecisionCycle(workflowType, runKey, batch.size(), (System.nanoTime() - startedAt) / 1_000_000);
                    HistoryIndex closed = HistoryIndex.of(concat(replayHistory, decided));
                    if (closed.isClosed()) {
                        return inbox.purge(runKey).then(close(slot, closed, true)).thenReturn(CycleOutcome.CLOSED);
                    }
                    return Mono.just(CycleOutcome.IDLE);
                }));
        return tracer != null ? tracer.traceDecision(workflowType, runKey, cycle) : cycle;
    }

    /**
     * Appends the batch, then acknowledges the inbox entries it consumed. A
     * failed append leaves the entries pending for the next cycle. A failed
     * acknowledgement only logs: the entries are recorded by then and the next
     * cycle consumes them as already delivered.
     */
    private Mono<Void> appendBatch(RunSlot slot, long expectedSeq, List<HistoryEvent> batch, Drained drained) {
        Mono<Void> append = batch.isEmpty() ? Mono.empty() : lockManager.renew(slot.runKey, settings.holderId())
                .flatMap(renewed -> renewed
                        ? eventLog.append(slot.runKey, expectedSeq, batch)
                        : Mono.<Void>error(new LeaseLostException(slot.runKey, settings.holderId())));
        return append.then(inbox.acknowledge(slot.runKey, drained.consumedIds())
                .onErrorResume(e -> {
                    log.warn("[engine] Failed to acknowledge {} inbox entries of {}: {}",
                            drained.consumedIds().size(), slot.runKey, e.getMessage());
                    return Mono.empty();
                }));
    }

    /**
     * Picks the pending entries that go into this cycle's batch. Entries
     * already in history, duplicate outcomes and outcomes of unknown commands
     * are consumed without being recorded; entries after a terminal event stay
     * pending.
     */
    private Drained drain(RunKey runKey, List<InboxEntry> pending, HistoryIndex index) {
        List<PendingEvent> accepted = new ArrayList<>();
        List<String> consumed = new ArrayList<>();
        Set<Integer> resolved = new HashSet<>();
        boolean cancelSeen = index.cancelRequested() != null;
        for (InboxEntry entry : pending) {
            PendingEvent event = entry.event();
            EventType type = event.type();
            consumed.add(entry.id());
            if (index.isDelivered(entry.id())) {
                log.debug("[engine] Inbox entry {} of {} is already recorded", entry.id(), runKey);
                continue;
            }
            if (type.isOutcome()) {
                int commandId = commandId(event);
                if (commandId < 0 || commandId >= index.commandCount()) {
                    log.warn("[engine] Ignoring {} for unknown command {} of {}", type, commandId, runKey);
                    continue;
                }
                if (index.isResolved(commandId) || !resolved.add(commandId)) {
                    log.debug("[engine] Ignoring duplicate {} for command {} of {}", type, commandId, runKey);
                    continue;
                }
            } else if (type == EventType.CANCEL_REQUESTED) {
                if (cancelSeen) continue;
                cancelSeen = true;
            }
            accepted.add(event);
            if (type.isTerminal()) break;
        }
        return new Drained(accepted, consumed);
    }

    private Mono<CycleOutcome> haltNonDeterministic(RunSlot slot, String workflowType, long base,
                                                    List<HistoryEvent> received, Drained drained,
                                                    NonDeterminismException error) {
        log.error("[engine] Halting {} ({}): {}", slot.runKey, workflowType, error.getMessage());
        events.onNonDeterminism(workflowType, slot.runKey, error);
        Mono<Void> deadLetter = deadLetters != null
                ? deadLetters.deadLetter(workflowType, slot.runKey, error.getCommandId(), error).then()
                : Mono.empty();
        return appendBatch(slot, base, received, drained)
                .then(deadLetter)
                .then(Mono.fromRunnable(() -> slot.deadLettered = true))
                .then(releaseLock(slot))
                .thenReturn(CycleOutcome.HALTED);
    }

    // ── Locks ─────────────────────────────────────────────────────

    private Mono<Boolean> ensureLock(RunSlot slot) {
        if (slot.lockHeld) return Mono.just(true);
        return lockManager.acquire(slot.runKey, settings.holderId(), settings.lockTtl())
                .flatMap(acquired -> {
                    if (!acquired) return Mono.just(false);
                    slot.lockHeld = true;
                    slot.reconciled = false;
                    startRenewal(slot);
                    Mono<Boolean> deadLettered = deadLetters != null
                            ? deadLetters.isDeadLettered(slot.runKey) : Mono.just(false);
                    return deadLettered.doOnNext(halted -> slot.deadLettered = halted).thenReturn(true);
                });
    }

    private void startRenewal(RunSlot slot) {
        slot.disposeRenewal();
        Duration period = settings.lockTtl().dividedBy(3);
        slot.renewal = Flux.interval(period, period)
                .concatMap(tick -> lockManager.renew(slot.runKey, settings.holderId())
                        .onErrorResume(e -> {
                            log.warn("[engine] Renewing lock of {} failed: {}", slot.runKey, e.getMessage());
                            return Mono.just(false);
                        }))
                .filter(renewed -> !renewed)
                .next()
                .subscribe(lost -> onLeaseLost(slot));
    }

    private void onLeaseLost(RunSlot slot) {
        slot.disposeRenewal();
        if (!slot.lockHeld) return;
        slot.lockHeld = false;
        slot.reconciled = false;
        log.warn("[engine] Lease on {} lost by {}", slot.runKey, settings.holderId());
        events.onLeaseLost(slot.runKey, settings.holderId());
    }

    private Mono<Void> releaseLock(RunSlot slot) {
        return Mono.defer(() -> {
            slot.disposeRenewal();
            if (!slot.lockHeld) return Mono.empty();
            slot.lockHeld = false;
            return lockManager.release(slot.runKey, settings.holderId());
        });
    }

    private Mono<Boolean> acquireStartGuard(RunKey guard) {
        return lockManager.acquire(guard, settings.holderId(), settings.lockTtl())
                .flatMap(acquired -> acquired
                        ? Mono.just(true)
                        : Mono.<Boolean>error(new LeaseLostException(guard, settings.holderId())))
                .retryWhen(Retry.backoff(settings.maxCycleRetries(), settings.retryBackoff())
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    // ── Reconciliation ────────────────────────────────────────────

    private Mono<Void> reconcile(RunSlot slot, HistoryIndex index) {
        RunKey runKey = slot.runKey;
        for (HistoryEvent timer : index.outstanding(EventType.TIMER_STARTED)) {
            if (!timerService.isArmed(runKey, timer.commandId())) {
                timerService.arm(runKey, timer.commandId(), HistoryEvents.instant(timer, HistoryEvents.FIRE_AT));
            }
        }
        armRunTimeout(runKey, HistoryEvents.instant(index.started(), HistoryEvents.RUN_TIMEOUT_AT));
        Mono<Void> activities = Flux.fromIterable(index.outstanding(EventType.ACTIVITY_SCHEDULED))
                .concatMap(scheduled -> activityScheduler.ensureScheduled(taskFor(runKey, scheduled)))
                .then();
        Mono<Void> children = Flux.fromIterable(index.outstanding(EventType.CHILD_WORKFLOW_STARTED))
                .concatMap(child -> reconcileChild(slot, child))
                .then();
        return activities.then(children)
                .doOnSuccess(v -> {
                    slot.reconciled = true;
                    log.debug("[engine] Reconciled {}", runKey);
                });
    }

    private ActivityTask taskFor(RunKey runKey, HistoryEvent scheduled) {
        return activityScheduler.newTask(runKey, scheduled.commandId(),
                scheduled.getString(HistoryEvents.ACTIVITY_NAME), scheduled.get(HistoryEvents.INPUT),
                scheduled.getString(HistoryEvents.TASK_QUEUE),
                HistoryEvents.millis(scheduled, HistoryEvents.START_TO_CLOSE_MS),
                HistoryEvents.millis(scheduled, HistoryEvents.SCHEDULE_TO_START_MS),
                HistoryEvents.retryPolicy(scheduled));
    }

    private Mono<Void> reconcileChild(RunSlot slot, HistoryEvent started) {
        String childWorkflowId = started.getString(HistoryEvents.CHILD_WORKFLOW_ID);
        RunKey childKey = RunKey.of(childWorkflowId, started.getString(HistoryEvents.CHILD_RUN_ID));
        return latestOfChain(childKey)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        log.info("[engine] Child {} of {} was never started, starting it", childKey, slot.runKey);
                        return startChild(slot.runKey, new Decision.StartChildWorkflow(
                                started.commandId(), childWorkflowId, childKey.runId(),
                                started.getString(HistoryEvents.WORKFLOW_TYPE), started.get(HistoryEvents.INPUT),
                                started.getString(HistoryEvents.TASK_QUEUE),
                                HistoryEvents.millis(started, HistoryEvents.RUN_TIMEOUT_MS)));
                    }
                    HistoryIndex child = found.get();
                    PendingEvent outcome = child.isClosed()
                            ? childOutcome(started.commandId(), childWorkflowId, child) : null;
                    if (outcome == null) {
                        wake(child.runKey());
                        return Mono.<Void>empty();
                    }
                    log.info("[engine] Child {} of {} already closed, delivering its outcome",
                            child.runKey(), slot.runKey);
                    return inbox.offer(slot.runKey, InboxEntry.of(outcome))
                            .doOnSuccess(v -> slot.dirty.set(true));
                });
    }

    /** Follows continue-as-new links from {@code runKey}; empty when the run does not exist. */
    private Mono<HistoryIndex> latestOfChain(RunKey runKey) {
        return eventLog.read(runKey).collectList()
                .filter(history -> !history.isEmpty())
                .flatMap(history -> {
                    HistoryIndex index = HistoryIndex.of(runKey, history);
                    if (index.status() != RunStatus.CONTINUED_AS_NEW) return Mono.just(index);
                    RunKey successor = RunKey.of(runKey.workflowId(),
                            index.terminal().getString(HistoryEvents.NEW_RUN_ID));
                    return latestOfChain(successor).defaultIfEmpty(index);
                });
    }

    private void armRunTimeout(RunKey runKey, Instant timeoutAt) {
        if (timeoutAt == null) return;
        long delayMs = Duration.between(clock.instant(), timeoutAt).toMillis();
        scheduler.scheduleOnce(runTimeoutTask(runKey), () -> deliver(runKey, HistoryEvents.workflowTimedOut())
                .subscribe(null, e -> log.error("[engine] Failed to deliver run timeout of {}: {}",
                        runKey, e.getMessage(), e)), delayMs);
    }

    private static String runTimeoutTask(RunKey runKey) {
        return runKey + "#run-timeout";
    }

    // ── Dispatch ──────────────────────────────────────────────────

    private Mono<Void> dispatch(RunSlot slot, HistoryIndex index, ReplayResult result) {
        RunKey runKey = slot.runKey;
        return Flux.fromIterable(result.decisions())
                .concatMap(decision -> {
                    if (decision instanceof Decision.ScheduleActivity activity) {
                        return activityScheduler.schedule(activityScheduler.newTask(runKey, activity.commandId(),
                                activity.activityName(), activity.input(), activity.taskQueue(),
                                activity.startToCloseTimeout(), activity.scheduleToStartTimeout(),
                                activity.retryPolicy()));
                    }
                    if (decision instanceof Decision.StartTimer timer) {
                        timerService.arm(runKey, timer.commandId(), timer.fireAt());
                        return Mono.<Void>empty();
                    }
                    if (decision instanceof Decision.StartChildWorkflow child) {
                        return startChild(runKey, child);
                    }
                    if (decision instanceof Decision.RequestCancelChild cancel) {
                        log.info("[engine] {} requests cancellation of child {}/{}",
                                runKey, cancel.childWorkflowId(), cancel.childRunId());
                        return deliver(RunKey.of(cancel.childWorkflowId(), cancel.childRunId()),
                                HistoryEvents.cancelRequested(CANCELLED_BY_PARENT));
                    }
                    return Mono.<Void>empty();
                })
                .then()
                .doOnError(e -> slot.reconciled = false);
    }

    private Mono<Void> startChild(RunKey parentKey, Decision.StartChildWorkflow child) {
        RunKey childKey = RunKey.of(child.childWorkflowId(), child.childRunId());
        Optional<WorkflowDefinition<?, ?>> definition = registry.get(child.workflowType());
        if (definition.isEmpty()) {
            log.error("[engine] Child workflow type '{}' started by {} is not registered", child.workflowType(), parentKey);
            Failure failure = new Failure("UnregisteredWorkflow",
                    "Workflow type '" + child.workflowType() + "' is not registered", true);
            return deliver(parentKey, HistoryEvents.childWorkflowFailed(child.commandId(), child.childWorkflowId(), failure));
        }
        Instant now = clock.instant();
        Duration timeout = child.runTimeout() != null ? child.runTimeout() : definition.get().defaultRunTimeout();
        PendingEvent started = HistoryEvents.workflowStarted(child.workflowType(), child.input(), child.taskQueue(),
                timeout != null ? now.plus(timeout) : null,
                new HistoryEvents.ParentRef(parentKey.workflowId(), parentKey.runId(), child.commandId()), null);
        return createRun(childKey, started, now)
                .doOnNext(created -> {
                    if (created) {
                        events.onWorkflowStarted(child.workflowType(), childKey);
                        events.onChildWorkflowStarted(parentKey, childKey, child.workflowType());
                    }
                    wake(childKey);
                })
                .then();
    }

    /** Appends the first event of a run. Emits {@code false} when the run already exists. */
    private Mono<Boolean> createRun(RunKey runKey, PendingEvent started, Instant now) {
        return eventLog.append(runKey, 0, List.of(started.toHistoryEvent(0, now)))
                .thenReturn(true)
                .onErrorResume(EventLogConflictException.class, e -> Mono.just(false));
    }

    // ── Close ─────────────────────────────────────────────────────

    private Mono<Void> close(RunSlot slot, HistoryIndex index, boolean closedNow) {
        RunKey runKey = slot.runKey;
        RunStatus status = index.status();
        String workflowType = index.workflowType();
        timerService.cancelRun(runKey);
        scheduler.cancel(runTimeoutTask(runKey));

        Mono<Void> effects = activityScheduler.cancelRun(runKey).then();
        if (closedNow) {
            log.info("[engine] Run {} ({}) closed as {}", runKey, workflowType, status);
            effects = effects.then(cancelOutstandingChildren(index)).then(notifyParent(runKey, index));
            events.onWorkflowClosed(workflowType, runKey, status,
                    Duration.between(index.startTime(), index.closeTime()).toMillis());
        }
        if (status == RunStatus.CONTINUED_AS_NEW) {
            effects = effects.then(startSuccessor(runKey, index, closedNow));
        }
        return effects
                .then(releaseLock(slot))
                .doFinally(signal -> {
                    slots.remove(runKey, slot);
                    Sinks.One<HistoryEvent> waiter = closeWaiters.remove(runKey);
                    if (waiter != null) waiter.tryEmitValue(index.terminal());
                });
    }

    private Mono<Void> cancelOutstandingChildren(HistoryIndex index) {
        if (index.status() == RunStatus.CANCELLED) return Mono.empty();
        return Flux.fromIterable(index.outstanding(EventType.CHILD_WORKFLOW_STARTED))
                .filter(child -> !index.isCancelRequested(child.commandId()))
                .concatMap(child -> deliver(RunKey.of(child.getString(HistoryEvents.CHILD_WORKFLOW_ID),
                                child.getString(HistoryEvents.CHILD_RUN_ID)),
                        HistoryEvents.cancelRequested("Parent workflow closed as " + index.status())))
                .then();
    }

    private Mono<Void> notifyParent(RunKey runKey, HistoryIndex index) {
        HistoryEvents.ParentRef parent = HistoryEvents.parent(index.started());
        if (parent == null) return Mono.empty();
        PendingEvent outcome = childOutcome(parent.commandId(), runKey.workflowId(), index);
        if (outcome == null) return Mono.empty();
        RunKey parentKey = RunKey.of(parent.workflowId(), parent.runId());
        return deliver(parentKey, outcome)
                .doOnSuccess(v -> events.onChildWorkflowClosed(parentKey, runKey,
                        index.status() == RunStatus.COMPLETED));
    }

    /**
     * The outcome a parent records for a closed child; {@code null} while the
     * child continued as new, since its successor reports instead.
     */
    static PendingEvent childOutcome(int commandId, String childWorkflowId, HistoryIndex child) {
        HistoryEvent terminal = child.terminal();
        return switch (child.status()) {
            case COMPLETED -> HistoryEvents.childWorkflowCompleted(commandId, childWorkflowId,
                    terminal.get(HistoryEvents.RESULT));
            case FAILED -> HistoryEvents.childWorkflowFailed(commandId, childWorkflowId, HistoryEvents.failure(terminal));
            case CANCELLED -> {
                String reason = terminal.getString(HistoryEvents.REASON);
                yield HistoryEvents.childWorkflowFailed(commandId, childWorkflowId,
                        Failure.of("ChildWorkflowCancelled", reason != null ? reason : "Child workflow was cancelled"));
            }
            case TIMED_OUT -> HistoryEvents.childWorkflowFailed(commandId, childWorkflowId,
                    Failure.of("ChildWorkflowTimedOut", "Child workflow exceeded its run timeout"));
            default -> null;
        };
    }

    private Mono<Void> startSuccessor(RunKey runKey, HistoryIndex index, boolean closedNow) {
        RunKey successor = RunKey.of(runKey.workflowId(), index.terminal().getString(HistoryEvents.NEW_RUN_ID));
        Instant now = clock.instant();
        Instant previousTimeoutAt = HistoryEvents.instant(index.started(), HistoryEvents.RUN_TIMEOUT_AT);
        Instant timeoutAt = previousTimeoutAt != null
                ? now.plus(Duration.between(index.startTime(), previousTimeoutAt)) : null;
        PendingEvent started = HistoryEvents.workflowStarted(index.workflowType(),
                index.terminal().get(HistoryEvents.INPUT), index.taskQueue(), timeoutAt,
                HistoryEvents.parent(index.started()), runKey.runId());
        return createRun(successor, started, now)
                .doOnNext(created -> {
                    if (created) {
                        log.info("[engine] Run {} continued as {}", runKey, successor);
                        events.onContinueAsNew(index.workflowType(), runKey, successor);
                        events.onWorkflowStarted(index.workflowType(), successor);
                    }
                    if (created || closedNow) wake(successor);
                })
                .then();
    }

    private Mono<HistoryEvent> terminalEvent(RunKey runKey) {
        return eventLog.read(runKey).filter(e -> e.type().isTerminal()).next();
    }

    // ── Helpers ───────────────────────────────────────────────────

    private static int commandId(PendingEvent event) {
        Object value = event.payload().get(HistoryEvents.COMMAND_ID);
        return value instanceof Number n ? n.intValue() : -1;
    }

    private static List<HistoryEvent> number(List<PendingEvent> pending, long firstSeq, Instant timestamp) {
        List<HistoryEvent> numbered = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            numbered.add(pending.get(i).toHistoryEvent(firstSeq + i, timestamp));
        }
        return numbered;
    }

    private static List<HistoryEvent> concat(List<HistoryEvent> a, List<HistoryEvent> b) {
        if (b.isEmpty()) return a;
        List<HistoryEvent> all = new ArrayList<>(a.size() + b.size());
        all.addAll(a);
        all.addAll(b);
        return all;
    }

    private enum CycleOutcome { IDLE, LOCK_BUSY, CLOSED, HALTED }

    /** Events a cycle records, and the inbox entries it acknowledges once they are appended. */
    private record Drained(List<PendingEvent> events, List<String> consumedIds) {}

    /** In-process state of one run this engine has seen. */
    private static final class RunSlot {
        final RunKey runKey;
        final AtomicBoolean running = new AtomicBoolean();
        final AtomicBoolean dirty = new AtomicBoolean();
        volatile boolean lockHeld;
        volatile boolean reconciled;
        volatile boolean deadLettered;
        volatile Disposable renewal;

        RunSlot(RunKey runKey) {
            this.runKey = runKey;
        }

        void disposeRenewal() {
            Disposable current = renewal;
            if (current != null) {
                current.dispose();
                renewal = null;
            }
        }
    }
}

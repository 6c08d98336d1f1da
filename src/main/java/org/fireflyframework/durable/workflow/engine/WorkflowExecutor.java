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
import org.fireflyframework.durable.core.exception.NonDeterminismException;
import org.fireflyframework.durable.core.history.Failure;
import org.fireflyframework.durable.core.history.HistoryEvent;
import org.fireflyframework.durable.core.history.HistoryEvents;
import org.fireflyframework.durable.core.history.PayloadConverter;
import org.fireflyframework.durable.core.model.EventType;
import org.fireflyframework.durable.core.model.RunKey;
import org.fireflyframework.durable.workflow.Workflow;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs workflow logic from the start against a run's history and returns the
 * decisions the logic reaches beyond it. Pure with respect to its inputs: the
 * same definition and history always produce the same decisions.
 */
@Slf4j
public class WorkflowExecutor {

    private final PayloadConverter converter;

    public WorkflowExecutor(PayloadConverter converter) {
        this.converter = converter;
    }

    /**
     * Computes the next decisions for a run. Anything the logic throws,
     * including a failure to build the workflow or read its input, becomes a
     * {@code FailWorkflow} decision.
     *
     * @throws NonDeterminismException when the logic diverges from the recorded commands
     */
    public ReplayResult decide(WorkflowDefinition<?, ?> definition, RunKey runKey, List<HistoryEvent> history) {
        HistoryIndex index = HistoryIndex.of(history);
        if (index.isClosed()) {
            return ReplayResult.none(index.closeTime());
        }
        if (index.cancelRequested() != null) {
            return cancellation(index);
        }
        return execute(definition, runKey, index);
    }

    /**
     * Replays the logic only to collect query handlers and workflow time.
     * Decisions in the result are never recorded.
     */
    public ReplayResult replay(WorkflowDefinition<?, ?> definition, RunKey runKey, List<HistoryEvent> history) {
        return execute(definition, runKey, HistoryIndex.of(history));
    }

    @SuppressWarnings("unchecked")
    private ReplayResult execute(WorkflowDefinition<?, ?> definition, RunKey runKey, HistoryIndex index) {
        ReplayContext ctx = new ReplayContext(runKey, index, converter);
        try {
            Workflow<Object, Object> workflow = (Workflow<Object, Object>) definition.newInstance();
            Object input = converter.fromPayload(index.input(), definition.inputType());
            Object result = workflow.run(ctx, input);
            ctx.verifyReplayed("completed");
            ctx.addDecision(new Decision.CompleteWorkflow(converter.toPayload(result)));
        } catch (WorkflowBlockedError blocked) {
            ctx.verifyReplayed("blocked");
        } catch (ContinueAsNewRequest request) {
            ctx.verifyReplayed("continued as new");
            String newRunId = ReplayContext.deterministicUuid(runKey.runId() + ":continue").toString();
            ctx.addDecision(new Decision.ContinueAsNew(newRunId, request.input()));
        } catch (NonDeterminismException | VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            ctx.verifyReplayed("failed");
            log.debug("[durable] Workflow {} failed: {}", runKey, e.getMessage());
            ctx.addDecision(new Decision.FailWorkflow(Failure.from(e)));
        }
        return new ReplayResult(ctx.decisions(), ctx.queryHandlers(), ctx.currentTime());
    }

    private ReplayResult cancellation(HistoryIndex index) {
        List<Decision> decisions = new ArrayList<>();
        int commandId = index.commandCount();
        for (HistoryEvent child : index.outstanding(EventType.CHILD_WORKFLOW_STARTED)) {
            if (index.isCancelRequested(child.commandId())) continue;
            decisions.add(new Decision.RequestCancelChild(commandId++, child.commandId(),
                    child.getString(HistoryEvents.CHILD_WORKFLOW_ID), child.getString(HistoryEvents.CHILD_RUN_ID)));
        }
        decisions.add(new Decision.CancelWorkflow(index.cancelRequested().getString(HistoryEvents.REASON)));
        return new ReplayResult(decisions, Map.of(), index.cancelRequested().timestamp());
    }
}

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


package org.fireflyframework.durable.support;

import org.fireflyframework.durable.activity.ActivityDefinition;
import org.fireflyframework.durable.core.model.JoinPolicy;
import org.fireflyframework.durable.core.model.RetryPolicy;
import org.fireflyframework.durable.workflow.ChildHandle;
import org.fireflyframework.durable.workflow.ChildWorkflowSpec;
import org.fireflyframework.durable.workflow.registry.WorkflowDefinition;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The research pipeline used by the integration tests: a {@code research}
 * workflow per topic (search, then render a report) and an orchestrator that
 * fans out one research child per topic.
 */
public final class ResearchWorkflows {

    public static final String RESEARCH = "research";
    public static final String ORCHESTRATOR = "research-orchestrator";
    public static final String SEARCH = "search";
    public static final String RENDER_REPORT = "render-report";
    public static final String TASK_QUEUE = "research-tasks";

    public static final RetryPolicy SEARCH_RETRY = RetryPolicy.of(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(15), 3);

    public record Findings(String topic, List<String> sources) {}

    public record ResearchRequest(List<String> topics) {}

    private final Map<String, AtomicInteger> searches = new ConcurrentHashMap<>();

    public void registerOn(DurableTestCluster cluster) {
        cluster.activity(search())
                .activity(renderReport())
                .workflow(research())
                .workflow(orchestrator());
    }

    public int searchesFor(String topic) {
        AtomicInteger count = searches.get(topic);
        return count != null ? count.get() : 0;
    }

    ActivityDefinition<String, Findings> search() {
        return ActivityDefinition.<String, Findings>of(SEARCH, String.class, (topic, ctx) -> Mono.fromCallable(() -> {
                    searches.computeIfAbsent(topic, t -> new AtomicInteger()).incrementAndGet();
                    String slug = topic.toLowerCase(Locale.ROOT).replace(' ', '-');
                    return new Findings(topic, List.of("https://papers.example/" + slug, "https://notes.example/" + slug));
                }))
                .withStartToCloseTimeout(Duration.ofMinutes(3))
                .withRetryPolicy(SEARCH_RETRY);
    }

    static ActivityDefinition<Findings, String> renderReport() {
        return ActivityDefinition.<Findings, String>of(RENDER_REPORT, Findings.class, (findings, ctx) ->
                        Mono.just("# " + findings.topic() + " (" + findings.sources().size() + " sources)"))
                .withStartToCloseTimeout(Duration.ofMinutes(1));
    }

    static WorkflowDefinition<String, String> research() {
        return WorkflowDefinition.<String, String>of(RESEARCH, String.class, () -> (ctx, topic) -> {
                    ctx.logger().info("Researching '{}'", topic);
                    Findings findings = ctx.executeActivity(SEARCH, topic, Findings.class);
                    return ctx.executeActivity(RENDER_REPORT, findings, String.class);
                })
                .withTaskQueue(TASK_QUEUE)
                .withActivities(SEARCH, RENDER_REPORT);
    }

    static WorkflowDefinition<ResearchRequest, List<String>> orchestrator() {
        return WorkflowDefinition.<ResearchRequest, List<String>>of(ORCHESTRATOR, ResearchRequest.class, () -> (ctx, request) -> {
                    List<ChildWorkflowSpec> specs = new ArrayList<>();
                    for (int i = 0; i < request.topics().size(); i++) {
                        specs.add(ChildWorkflowSpec.of(RESEARCH, request.topics().get(i))
                                .withWorkflowId("research-" + i + "-" + ctx.workflowId())
                                .withTaskQueue(TASK_QUEUE));
                    }
                    List<ChildHandle<String>> children = ctx.fanOut(specs, String.class);
                    return ctx.join(children, JoinPolicy.COLLECT_ALL).values();
                })
                .withTaskQueue(TASK_QUEUE);
    }
}

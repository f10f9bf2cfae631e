package dev.ragflow.workflow;

import dev.ragflow.backend.Generator;
import dev.ragflow.backend.Retriever;
import dev.ragflow.backend.WebSearcher;
import dev.ragflow.engine.GraphDefinition;
import dev.ragflow.engine.GraphExecutor;
import dev.ragflow.engine.WorkflowListener;
import dev.ragflow.model.WorkflowResult;
import dev.ragflow.model.WorkflowSettings;

import java.util.Objects;

/**
 * A ready-to-run question answering workflow: one validated graph plus the executor
 * that runs it. Immutable; {@link #execute} may be called from many threads at once.
 */
public final class RagWorkflow {

    private final WorkflowType type;
    private final GraphDefinition graph;
    private final GraphExecutor executor;

    private RagWorkflow(WorkflowType type, GraphDefinition graph, GraphExecutor executor) {
        this.type = type;
        this.graph = graph;
        this.executor = executor;
    }

    /**
     * Build a workflow of the given type.
     *
     * @param webSearcher required for {@link WorkflowType#SEARCH}, ignored otherwise, nullable
     */
    public static RagWorkflow create(WorkflowType type, Retriever retriever, Generator generator,
                                     WebSearcher webSearcher, WorkflowSettings settings,
                                     WorkflowListener listener) {
        Objects.requireNonNull(type, "type");
        if (type.needsWebSearch() && webSearcher == null) {
            throw new IllegalArgumentException("Workflow '%s' requires a web searcher".formatted(type.id()));
        }
        var nodes = new RagNodes(retriever, generator, webSearcher, settings);
        GraphDefinition graph = switch (type) {
            case BASIC -> WorkflowGraphs.basic(nodes);
            case SUGGESTION -> WorkflowGraphs.suggestion(nodes, settings);
            case SEARCH -> WorkflowGraphs.search(nodes, settings);
        };
        return new RagWorkflow(type, graph, new GraphExecutor(settings.guardrails(), listener));
    }

    public static RagWorkflow basic(Retriever retriever, Generator generator, WorkflowSettings settings) {
        return create(WorkflowType.BASIC, retriever, generator, null, settings, WorkflowListener.NONE);
    }

    public static RagWorkflow suggestion(Retriever retriever, Generator generator, WorkflowSettings settings) {
        return create(WorkflowType.SUGGESTION, retriever, generator, null, settings, WorkflowListener.NONE);
    }

    public static RagWorkflow search(Retriever retriever, Generator generator, WebSearcher webSearcher,
                                     WorkflowSettings settings) {
        return create(WorkflowType.SEARCH, retriever, generator, webSearcher, settings, WorkflowListener.NONE);
    }

    public WorkflowType type() {
        return type;
    }

    public GraphDefinition graph() {
        return graph;
    }

    /**
     * Answer one question. Runs to completion on the calling thread.
     *
     * @throws dev.ragflow.backend.CapabilityException        if a provider call fails
     * @throws dev.ragflow.engine.StructuredOutputException   if a structured reply is malformed
     */
    public WorkflowResult execute(String question) {
        return executor.execute(graph, question);
    }
}

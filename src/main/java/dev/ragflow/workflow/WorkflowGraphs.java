package dev.ragflow.workflow;

import dev.ragflow.engine.GraphDefinition;
import dev.ragflow.model.NodeId;
import dev.ragflow.model.Transition;
import dev.ragflow.model.WorkflowSettings;

import java.util.Map;

/**
 * The fixed graph of each workflow variant, wired from {@link RagNodes} primitives.
 */
public final class WorkflowGraphs {

    private WorkflowGraphs() {}

    /**
     * retrieve -> generate -> END.
     */
    public static GraphDefinition basic(RagNodes nodes) {
        return GraphDefinition.builder(WorkflowType.BASIC.id())
            .startAt(NodeId.RETRIEVE)
            .node(NodeId.RETRIEVE, nodes::retrieve)
            .node(NodeId.GENERATE, nodes::generate)
            .edge(NodeId.RETRIEVE, NodeId.GENERATE)
            .edgeToEnd(NodeId.GENERATE, "answered")
            .build();
    }

    /**
     * retrieve -> grade -> {relevant: generate, not relevant: suggest_enrichment -> END}.
     * Generate either ends or, when enabled, passes through a confidence check first.
     */
    public static GraphDefinition suggestion(RagNodes nodes, WorkflowSettings settings) {
        var builder = GraphDefinition.builder(WorkflowType.SUGGESTION.id())
            .startAt(NodeId.RETRIEVE)
            .node(NodeId.RETRIEVE, nodes::retrieve)
            .node(NodeId.GRADE_DOCUMENTS, nodes::gradeDocuments)
            .node(NodeId.GENERATE, nodes::generate)
            .node(NodeId.SUGGEST_ENRICHMENT, nodes::suggestEnrichment)
            .edge(NodeId.RETRIEVE, NodeId.GRADE_DOCUMENTS)
            .conditionalEdge(NodeId.GRADE_DOCUMENTS, RagNodes.decideToGenerate(RagNodes.SUGGEST_ENRICHMENT),
                Map.of(
                    RagNodes.GENERATE, Transition.to(NodeId.GENERATE),
                    RagNodes.SUGGEST_ENRICHMENT, Transition.to(NodeId.SUGGEST_ENRICHMENT)))
            .edgeToEnd(NodeId.SUGGEST_ENRICHMENT, "enrichment-suggested");

        if (settings.suggestionConfidenceCheck()) {
            builder.node(NodeId.CHECK_CONFIDENCE, nodes::checkConfidence)
                .edge(NodeId.GENERATE, NodeId.CHECK_CONFIDENCE)
                .edgeToEnd(NodeId.CHECK_CONFIDENCE, "answered");
        } else {
            builder.edgeToEnd(NodeId.GENERATE, "answered");
        }
        return builder.build();
    }

    /**
     * retrieve -> grade -> {relevant: generate, not relevant: web_search -> generate};
     * generate -> check_confidence -> {complete: END, incomplete: query_rewrite -> web_search}.
     */
    public static GraphDefinition search(RagNodes nodes, WorkflowSettings settings) {
        return GraphDefinition.builder(WorkflowType.SEARCH.id())
            .startAt(NodeId.RETRIEVE)
            .node(NodeId.RETRIEVE, nodes::retrieve)
            .node(NodeId.GRADE_DOCUMENTS, nodes::gradeDocuments)
            .node(NodeId.WEB_SEARCH, nodes::webSearch)
            .node(NodeId.GENERATE, nodes::generate)
            .node(NodeId.CHECK_CONFIDENCE, nodes::checkConfidence)
            .node(NodeId.QUERY_REWRITE, nodes::queryRewrite)
            .edge(NodeId.RETRIEVE, NodeId.GRADE_DOCUMENTS)
            .conditionalEdge(NodeId.GRADE_DOCUMENTS, RagNodes.decideToGenerate(RagNodes.WEB_SEARCH),
                Map.of(
                    RagNodes.GENERATE, Transition.to(NodeId.GENERATE),
                    RagNodes.WEB_SEARCH, Transition.to(NodeId.WEB_SEARCH)))
            .edge(NodeId.WEB_SEARCH, NodeId.GENERATE)
            .edge(NodeId.GENERATE, NodeId.CHECK_CONFIDENCE)
            .conditionalEdge(NodeId.CHECK_CONFIDENCE, RagNodes.decideEnd(settings.confidenceThreshold()),
                Map.of(
                    RagNodes.COMPLETE, Transition.end("confident-answer"),
                    RagNodes.INCOMPLETE, Transition.to(NodeId.QUERY_REWRITE)))
            .edge(NodeId.QUERY_REWRITE, NodeId.WEB_SEARCH)
            .build();
    }
}

package dev.ragflow.engine;

import dev.ragflow.model.NodeId;
import dev.ragflow.model.StateUpdate;
import dev.ragflow.model.Transition;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphValidatorTest {

    private static final Node NOOP = state -> StateUpdate.empty();

    @Test
    void validGraphReturnsNoErrors() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP, NodeId.GENERATE, NOOP),
            Map.of(
                NodeId.RETRIEVE, new Edge.Static(Transition.to(NodeId.GENERATE)),
                NodeId.GENERATE, new Edge.Static(Transition.end("answered"))
            ));

        assertThat(GraphValidator.validate(graph)).isEmpty();
    }

    @Test
    void detectsMissingStartNode() {
        var graph = new GraphDefinition("test", NodeId.WEB_SEARCH,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Static(Transition.end("done"))));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("Start node not registered: web_search"));
    }

    @Test
    void detectsUnsetStartNode() {
        var graph = new GraphDefinition("test", null,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Static(Transition.end("done"))));

        assertThat(GraphValidator.validate(graph)).anyMatch(e -> e.contains("Start node not set"));
    }

    @Test
    void detectsNodeWithoutEdge() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP, NodeId.GENERATE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Static(Transition.to(NodeId.GENERATE))));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("Node 'generate' has no outgoing edge"));
    }

    @Test
    void detectsEdgeFromUnregisteredNode() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(
                NodeId.RETRIEVE, new Edge.Static(Transition.end("done")),
                NodeId.GENERATE, new Edge.Static(Transition.end("done"))
            ));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("Edge declared from unregistered node 'generate'"));
    }

    @Test
    void detectsUnregisteredTarget() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Static(Transition.to(NodeId.GENERATE))));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("next node 'generate' not registered"));
    }

    @Test
    void detectsLabelWithoutRoute() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Conditional(
                Set.of("done", "other"), state -> "done",
                Map.of("done", Transition.end("completed")))));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("label 'other' has no route"));
    }

    @Test
    void detectsRouteNotInLabels() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Conditional(
                Set.of("done"), state -> "done",
                Map.of(
                    "done", Transition.end("completed"),
                    "extra", Transition.end("other")
                ))));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("route 'extra' not in labels"));
    }

    @Test
    void detectsConditionalEdgeWithoutLabels() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Conditional(Set.of(), state -> "x", Map.of())));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("conditional edge declares no labels"));
    }

    @Test
    void detectsBlankEndReason() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP),
            Map.of(NodeId.RETRIEVE, new Edge.Static(new Transition.End(" "))));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("end transition has empty reason"));
    }

    @Test
    void detectsUnreachableNode() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP, NodeId.WEB_SEARCH, NOOP),
            Map.of(
                NodeId.RETRIEVE, new Edge.Static(Transition.end("done")),
                NodeId.WEB_SEARCH, new Edge.Static(Transition.end("done"))
            ));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("Node 'web_search' is unreachable"));
    }

    @Test
    void rejectsCycleOfStaticEdges() {
        var graph = new GraphDefinition("test", NodeId.RETRIEVE,
            Map.of(NodeId.RETRIEVE, NOOP, NodeId.GENERATE, NOOP),
            Map.of(
                NodeId.RETRIEVE, new Edge.Static(Transition.to(NodeId.GENERATE)),
                NodeId.GENERATE, new Edge.Static(Transition.to(NodeId.RETRIEVE))
            ));

        assertThat(GraphValidator.validate(graph))
            .anyMatch(e -> e.contains("can never terminate"));
    }

    @Test
    void acceptsCycleLeftThroughConditionalEdge() {
        var graph = new GraphDefinition("test", NodeId.GENERATE,
            Map.of(NodeId.GENERATE, NOOP, NodeId.CHECK_CONFIDENCE, NOOP, NodeId.QUERY_REWRITE, NOOP),
            Map.of(
                NodeId.GENERATE, new Edge.Static(Transition.to(NodeId.CHECK_CONFIDENCE)),
                NodeId.CHECK_CONFIDENCE, new Edge.Conditional(Set.of("complete", "incomplete"), state -> "complete",
                    Map.of(
                        "complete", Transition.end("done"),
                        "incomplete", Transition.to(NodeId.QUERY_REWRITE)
                    )),
                NodeId.QUERY_REWRITE, new Edge.Static(Transition.to(NodeId.GENERATE))
            ));

        assertThat(GraphValidator.validate(graph)).isEmpty();
    }

    @Test
    void builderRejectsInvalidGraphWithAllErrors() {
        var builder = GraphDefinition.builder("broken")
            .startAt(NodeId.RETRIEVE)
            .node(NodeId.RETRIEVE, NOOP)
            .node(NodeId.RETRIEVE, NOOP)
            .edge(NodeId.RETRIEVE, NodeId.GENERATE);

        assertThatThrownBy(builder::build)
            .isInstanceOf(GraphConfigurationException.class)
            .hasMessageContaining("Invalid workflow graph 'broken'")
            .satisfies(e -> assertThat(((GraphConfigurationException) e).errors())
                .anyMatch(msg -> msg.contains("Node registered twice: retrieve"))
                .anyMatch(msg -> msg.contains("next node 'generate' not registered")));
    }
}

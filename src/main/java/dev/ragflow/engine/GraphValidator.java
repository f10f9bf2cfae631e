package dev.ragflow.engine;

import dev.ragflow.model.NodeId;
import dev.ragflow.model.Transition;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates workflow graph definitions before execution.
 */
public final class GraphValidator {

    private GraphValidator() {}

    /**
     * Validate a graph definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(GraphDefinition graph) {
        var errors = new ArrayList<String>();

        // Rule 1: start node must be registered
        if (graph.startNode() == null) {
            errors.add("Start node not set");
        } else if (!graph.nodes().containsKey(graph.startNode())) {
            errors.add("Start node not registered: " + graph.startNode());
        }

        // Rule 2: every node needs exactly one outgoing edge, every edge a registered source
        for (NodeId node : graph.nodes().keySet()) {
            if (!graph.edges().containsKey(node)) {
                errors.add("Node '%s' has no outgoing edge".formatted(node));
            }
        }
        for (NodeId source : graph.edges().keySet()) {
            if (!graph.nodes().containsKey(source)) {
                errors.add("Edge declared from unregistered node '%s'".formatted(source));
            }
        }

        for (var entry : graph.edges().entrySet()) {
            NodeId source = entry.getKey();
            Edge edge = entry.getValue();

            if (edge instanceof Edge.Static s) {
                validateTransition(graph, source, null, s.transition(), errors);
            } else if (edge instanceof Edge.Conditional c) {
                // Rule 3: labels and route table must agree in both directions
                if (c.labels().isEmpty()) {
                    errors.add("Node '%s': conditional edge declares no labels".formatted(source));
                }
                for (String label : c.routes().keySet()) {
                    if (!c.labels().contains(label)) {
                        errors.add("Node '%s': route '%s' not in labels %s"
                            .formatted(source, label, c.labels()));
                    }
                }
                for (String label : c.labels()) {
                    if (!c.routes().containsKey(label)) {
                        errors.add("Node '%s': label '%s' has no route".formatted(source, label));
                    } else {
                        validateTransition(graph, source, label, c.routes().get(label), errors);
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            return errors;
        }

        // Rule 5: every node reachable from the start node
        Set<NodeId> reachable = reachableFrom(graph, graph.startNode());
        for (NodeId node : graph.nodes().keySet()) {
            if (!reachable.contains(node)) {
                errors.add("Node '%s' is unreachable from start node '%s'".formatted(node, graph.startNode()));
            }
        }

        // Rule 6: a cycle made only of static edges can never be left
        NodeId cycleNode = findStaticCycle(graph);
        if (cycleNode != null) {
            errors.add("Cycle through node '%s' has no conditional edge and can never terminate"
                .formatted(cycleNode));
        }

        return errors;
    }

    private static void validateTransition(GraphDefinition graph, NodeId source, String label,
                                           Transition transition, List<String> errors) {
        String where = label == null ? "'%s'".formatted(source) : "'%s' [%s]".formatted(source, label);
        if (transition instanceof Transition.NextNode next) {
            // Rule 4: targets must be registered
            if (!graph.nodes().containsKey(next.node())) {
                errors.add("Node %s: next node '%s' not registered".formatted(where, next.node()));
            }
        } else if (transition instanceof Transition.End end) {
            if (end.reason() == null || end.reason().isBlank()) {
                errors.add("Node %s: end transition has empty reason".formatted(where));
            }
        } else {
            errors.add("Node %s: missing transition".formatted(where));
        }
    }

    private static Set<NodeId> reachableFrom(GraphDefinition graph, NodeId start) {
        Set<NodeId> seen = EnumSet.noneOf(NodeId.class);
        var queue = new ArrayDeque<NodeId>();
        queue.add(start);
        while (!queue.isEmpty()) {
            NodeId node = queue.poll();
            if (!seen.add(node)) {
                continue;
            }
            for (NodeId successor : successors(graph.edges().get(node))) {
                queue.add(successor);
            }
        }
        return seen;
    }

    private static List<NodeId> successors(Edge edge) {
        var result = new ArrayList<NodeId>();
        if (edge instanceof Edge.Static s) {
            if (s.transition() instanceof Transition.NextNode next) {
                result.add(next.node());
            }
        } else if (edge instanceof Edge.Conditional c) {
            for (Transition t : c.routes().values()) {
                if (t instanceof Transition.NextNode next) {
                    result.add(next.node());
                }
            }
        }
        return result;
    }

    /**
     * Follows static edges only. Each node has at most one static successor, so a
     * walk either reaches END, a conditional edge, or comes back to a node already
     * on the current walk.
     */
    private static NodeId findStaticCycle(GraphDefinition graph) {
        Map<NodeId, Integer> walkOf = new EnumMap<>(NodeId.class);
        int walk = 0;
        for (NodeId origin : graph.nodes().keySet()) {
            walk++;
            NodeId node = origin;
            while (node != null && !walkOf.containsKey(node)) {
                walkOf.put(node, walk);
                node = staticSuccessor(graph.edges().get(node));
            }
            if (node != null && walkOf.get(node) == walk) {
                return node;
            }
        }
        return null;
    }

    private static NodeId staticSuccessor(Edge edge) {
        if (edge instanceof Edge.Static s && s.transition() instanceof Transition.NextNode next) {
            return next.node();
        }
        return null;
    }
}

package dev.ragflow.engine;

import dev.ragflow.model.NodeId;
import dev.ragflow.model.Transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A named workflow graph: node handlers, their outgoing edges and the start node.
 * Instances produced by {@link Builder#build()} have passed {@link GraphValidator}.
 */
public record GraphDefinition(
    String name,
    NodeId startNode,
    Map<NodeId, Node> nodes,
    Map<NodeId, Edge> edges
) {
    public GraphDefinition {
        nodes = Collections.unmodifiableMap(copy(nodes));
        edges = Collections.unmodifiableMap(copy(edges));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Node node(NodeId id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new GraphConfigurationException("Node not registered in graph '%s': %s".formatted(name, id));
        }
        return node;
    }

    public Edge edge(NodeId id) {
        Edge edge = edges.get(id);
        if (edge == null) {
            throw new GraphConfigurationException("Node '%s' has no outgoing edge in graph '%s'".formatted(id, name));
        }
        return edge;
    }

    /**
     * Human-readable outline of the graph, one edge per line, in {@link NodeId} order.
     */
    public String describe() {
        var sb = new StringBuilder();
        sb.append(name).append('\n');
        sb.append("  START -> ").append(startNode).append('\n');
        for (var entry : edges.entrySet()) {
            Edge edge = entry.getValue();
            if (edge instanceof Edge.Static s) {
                sb.append("  ").append(entry.getKey()).append(" -> ")
                    .append(describe(s.transition())).append('\n');
            } else if (edge instanceof Edge.Conditional c) {
                for (String label : new TreeSet<>(c.labels())) {
                    sb.append("  ").append(entry.getKey()).append(" -[").append(label).append("]-> ")
                        .append(describe(c.routes().get(label))).append('\n');
                }
            }
        }
        return sb.toString();
    }

    private static String describe(Transition transition) {
        if (transition instanceof Transition.NextNode next) {
            return next.node().label();
        }
        if (transition instanceof Transition.End end) {
            return "END (" + end.reason() + ")";
        }
        return String.valueOf(transition);
    }

    private static <V> Map<NodeId, V> copy(Map<NodeId, V> source) {
        var copy = new EnumMap<NodeId, V>(NodeId.class);
        copy.putAll(source);
        return copy;
    }

    /**
     * Fluent construction of a graph; {@link #build()} validates the result.
     */
    public static final class Builder {
        private final String name;
        private NodeId startNode;
        private final Map<NodeId, Node> nodes = new EnumMap<>(NodeId.class);
        private final Map<NodeId, Edge> edges = new EnumMap<>(NodeId.class);
        private final Set<String> duplicates = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder startAt(NodeId node) {
            this.startNode = node;
            return this;
        }

        public Builder node(NodeId id, Node handler) {
            if (nodes.put(id, handler) != null) {
                duplicates.add("Node registered twice: " + id);
            }
            return this;
        }

        public Builder edge(NodeId from, NodeId to) {
            return edge(from, Transition.to(to));
        }

        public Builder edgeToEnd(NodeId from, String reason) {
            return edge(from, Transition.end(reason));
        }

        public Builder edge(NodeId from, Transition transition) {
            return putEdge(from, new Edge.Static(transition));
        }

        /**
         * Conditional edge whose declared labels are exactly the keys of {@code routes}.
         */
        public Builder conditionalEdge(NodeId from, Router router, Map<String, Transition> routes) {
            return conditionalEdge(from, routes.keySet(), router, routes);
        }

        public Builder conditionalEdge(NodeId from, Set<String> labels, Router router,
                                       Map<String, Transition> routes) {
            return putEdge(from, new Edge.Conditional(labels, router, routes));
        }

        private Builder putEdge(NodeId from, Edge edge) {
            if (edges.put(from, edge) != null) {
                duplicates.add("Node has more than one outgoing edge: " + from);
            }
            return this;
        }

        public GraphDefinition build() {
            var definition = new GraphDefinition(name, startNode, nodes, edges);
            var errors = new ArrayList<>(duplicates);
            errors.addAll(GraphValidator.validate(definition));
            if (!errors.isEmpty()) {
                throw new GraphConfigurationException(name, errors);
            }
            return definition;
        }
    }
}

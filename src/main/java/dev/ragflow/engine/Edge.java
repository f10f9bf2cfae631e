package dev.ragflow.engine;

import dev.ragflow.model.Transition;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The single outgoing edge of a node: either fixed or chosen by a router.
 */
public sealed interface Edge {

    /** Always follow the same transition. */
    record Static(Transition transition) implements Edge {
        public Static {
            Objects.requireNonNull(transition, "transition");
        }
    }

    /**
     * Ask the router for a label and follow the transition registered for it.
     *
     * @param labels every label the router may return
     * @param router label chooser
     * @param routes transition per label
     */
    record Conditional(Set<String> labels, Router router, Map<String, Transition> routes) implements Edge {
        public Conditional {
            Objects.requireNonNull(router, "router");
            labels = Set.copyOf(labels);
            routes = Map.copyOf(routes);
        }

        /**
         * Resolve a label returned by the router.
         *
         * @throws GraphConfigurationException if the label was not declared or has no route
         */
        public Transition resolve(String source, String label) {
            if (label == null || !labels.contains(label) || !routes.containsKey(label)) {
                throw new GraphConfigurationException(
                    "Router of node '%s' returned unregistered label '%s'; known labels: %s"
                        .formatted(source, label, labels));
            }
            return routes.get(label);
        }
    }
}

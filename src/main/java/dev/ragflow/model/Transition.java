package dev.ragflow.model;

import java.util.Objects;

/**
 * Where execution goes after a node completes.
 * Exactly one of two forms: next-node or end.
 */
public sealed interface Transition {

    /** Advance to another node in the graph. */
    record NextNode(NodeId node) implements Transition {
        public NextNode {
            Objects.requireNonNull(node, "node");
        }
    }

    /** Terminate the workflow with a reason. */
    record End(String reason) implements Transition {}

    static Transition to(NodeId node) {
        return new NextNode(node);
    }

    static Transition end(String reason) {
        return new End(reason);
    }
}

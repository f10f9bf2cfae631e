package dev.ragflow.engine;

import dev.ragflow.model.NodeId;
import dev.ragflow.model.StateUpdate;
import dev.ragflow.model.Transition;

/**
 * Observes a workflow run. Implementations shared across runs must be thread-safe.
 */
public interface WorkflowListener {

    WorkflowListener NONE = new WorkflowListener() {};

    /** Called after a node's update has been merged into the state. */
    default void onNodeCompleted(NodeId node, StateUpdate update, WorkflowState state) {}

    /**
     * Called when an edge has been resolved.
     *
     * @param label the router's label, or null for a static edge
     */
    default void onTransition(NodeId from, String label, Transition transition) {}
}

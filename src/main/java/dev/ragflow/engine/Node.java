package dev.ragflow.engine;

import dev.ragflow.model.StateUpdate;

/**
 * A unit of work in a workflow graph. Reads the current state and returns the
 * fields it wants changed; the executor merges them.
 */
@FunctionalInterface
public interface Node {

    StateUpdate apply(WorkflowState state);
}

package dev.ragflow.engine;

/**
 * Picks the outgoing label of a conditional edge from the current state.
 */
@FunctionalInterface
public interface Router {

    String route(WorkflowState state);
}

package dev.ragflow.model;

/**
 * How a workflow run ended.
 */
public enum ExitStatus {
    /** An edge routed to END. */
    COMPLETED,
    /** A guardrail stopped the run; the result carries the best state reached so far. */
    LOOP_LIMIT
}

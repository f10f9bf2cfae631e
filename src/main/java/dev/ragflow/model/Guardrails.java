package dev.ragflow.model;

/**
 * Safety limits that bound every workflow execution, cycles included.
 *
 * @param maxNodeVisits how many times a conditional edge may route into the same node
 * @param maxTotalSteps how many node executions a single run may perform in total
 */
public record Guardrails(
    int maxNodeVisits,
    int maxTotalSteps
) {
    public static final int DEFAULT_MAX_NODE_VISITS = 3;
    public static final int DEFAULT_MAX_TOTAL_STEPS = 50;

    public Guardrails {
        if (maxNodeVisits < 1) {
            throw new IllegalArgumentException("maxNodeVisits must be positive: " + maxNodeVisits);
        }
        if (maxTotalSteps < 1) {
            throw new IllegalArgumentException("maxTotalSteps must be positive: " + maxTotalSteps);
        }
    }

    public static Guardrails defaults() {
        return new Guardrails(DEFAULT_MAX_NODE_VISITS, DEFAULT_MAX_TOTAL_STEPS);
    }
}

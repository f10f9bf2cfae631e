package dev.ragflow.engine;

import dev.ragflow.model.ExitStatus;
import dev.ragflow.model.Guardrails;
import dev.ragflow.model.NodeId;
import dev.ragflow.model.StateUpdate;
import dev.ragflow.model.Transition;
import dev.ragflow.model.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs a {@link GraphDefinition} from its start node until an edge routes to END
 * or a guardrail stops the run.
 *
 * <p>Execution is strictly sequential. The executor holds no per-run state, so a
 * single instance can serve concurrent runs; every run gets its own
 * {@link WorkflowState}.
 *
 * <p>Two limits bound every run, cycles included:
 * <ul>
 *   <li>{@link Guardrails#maxTotalSteps()} caps node executions across the run;</li>
 *   <li>{@link Guardrails#maxNodeVisits()} caps how often a conditional edge may route
 *       into the same node.</li>
 * </ul>
 * Hitting either ends the run with {@link ExitStatus#LOOP_LIMIT} and the state reached
 * so far. Exceptions thrown by nodes propagate unchanged.
 */
public final class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final Guardrails guardrails;
    private final WorkflowListener listener;

    public GraphExecutor(Guardrails guardrails) {
        this(guardrails, WorkflowListener.NONE);
    }

    public GraphExecutor(Guardrails guardrails, WorkflowListener listener) {
        this.guardrails = Objects.requireNonNull(guardrails, "guardrails");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Execute the graph for one question.
     *
     * @throws IllegalArgumentException     if the question is blank
     * @throws GraphConfigurationException  if a router returns an unregistered label
     */
    public WorkflowResult execute(GraphDefinition graph, String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }

        var state = WorkflowState.initial(question);
        NodeId current = graph.startNode();
        state.enter(current);
        log.info("[{}] Starting workflow at '{}'", graph.name(), current);

        while (true) {
            StateUpdate update = run(graph, current, state);
            state.apply(update);
            listener.onNodeCompleted(current, update, state);

            Edge edge = graph.edge(current);
            Transition next;
            String label = null;
            if (edge instanceof Edge.Conditional conditional) {
                label = conditional.router().route(state);
                next = conditional.resolve(current.label(), label);
                log.info("[{}] Decision at '{}': {}", graph.name(), current, label);
            } else {
                next = ((Edge.Static) edge).transition();
            }
            listener.onTransition(current, label, next);

            if (next instanceof Transition.End end) {
                log.info("[{}] Completed after {} steps: {}", graph.name(), state.stepCount(), end.reason());
                return toResult(graph, state, ExitStatus.COMPLETED, end.reason());
            }

            NodeId target = ((Transition.NextNode) next).node();
            if (state.stepCount() >= guardrails.maxTotalSteps()) {
                String reason = "max-total-steps-exceeded (%d)".formatted(guardrails.maxTotalSteps());
                log.warn("[{}] Stopping before '{}': {}", graph.name(), target, reason);
                return toResult(graph, state, ExitStatus.LOOP_LIMIT, reason);
            }
            if (label != null && state.visitCount(target) >= guardrails.maxNodeVisits()) {
                String reason = "max-node-visits-exceeded for '%s' (%d)".formatted(target, guardrails.maxNodeVisits());
                log.warn("[{}] Stopping before '{}': {}", graph.name(), target, reason);
                return toResult(graph, state, ExitStatus.LOOP_LIMIT, reason);
            }

            state.enter(target);
            current = target;
        }
    }

    private StateUpdate run(GraphDefinition graph, NodeId current, WorkflowState state) {
        log.debug("[{}] ---{}--- (step {})", graph.name(), current, state.stepCount());
        StateUpdate update;
        try {
            update = graph.node(current).apply(state);
        } catch (RuntimeException e) {
            log.debug("[{}] Node '{}' failed", graph.name(), current, e);
            throw e;
        }
        if (update == null) {
            throw new IllegalStateException("Node '%s' returned no update".formatted(current));
        }
        return update;
    }

    private static WorkflowResult toResult(GraphDefinition graph, WorkflowState state,
                                           ExitStatus status, String reason) {
        return new WorkflowResult(
            graph.name(),
            state.question(),
            state.answer(),
            state.confidence(),
            state.suggestions(),
            state.missingInfo(),
            state.documents(),
            state.path(),
            status,
            reason,
            state.stepCount()
        );
    }
}

package dev.ragflow.cli;

import dev.ragflow.engine.WorkflowListener;
import dev.ragflow.engine.WorkflowState;
import dev.ragflow.model.NodeId;
import dev.ragflow.model.StateUpdate;
import dev.ragflow.model.Transition;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Prints each executed node and the edge taken after it, for {@code --verbose}.
 */
class TraceListener implements WorkflowListener {

    private final PrintStream out;

    TraceListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onNodeCompleted(NodeId node, StateUpdate update, WorkflowState state) {
        out.printf(Locale.ROOT, "[%d] %s%s%n", state.stepCount(), node, state.confidence() == null
            ? "" : String.format(Locale.ROOT, " (confidence %.2f)", state.confidence()));
    }

    @Override
    public void onTransition(NodeId from, String label, Transition transition) {
        String target = transition instanceof Transition.NextNode next
            ? next.node().label()
            : "END";
        if (label == null) {
            out.printf("    %s -> %s%n", from, target);
        } else {
            out.printf("    %s -[%s]-> %s%n", from, label, target);
        }
    }
}

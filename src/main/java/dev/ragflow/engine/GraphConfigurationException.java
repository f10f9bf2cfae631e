package dev.ragflow.engine;

import java.util.List;

/**
 * A workflow graph is wired incorrectly. Always a programming error, never a user error.
 */
public class GraphConfigurationException extends RuntimeException {

    private final List<String> errors;

    public GraphConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public GraphConfigurationException(String graphName, List<String> errors) {
        super("Invalid workflow graph '%s': %s".formatted(graphName, String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}

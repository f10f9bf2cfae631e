package dev.ragflow.engine;

/**
 * A structured model response could not be decoded into its schema.
 */
public class StructuredOutputException extends RuntimeException {

    private final String rawResponse;

    public StructuredOutputException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public StructuredOutputException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    /** The offending response text or JSON candidate, nullable. */
    public String rawResponse() {
        return rawResponse;
    }
}

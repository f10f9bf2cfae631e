package dev.ragflow.backend;

/**
 * A retriever, generator or web search call failed.
 */
public class CapabilityException extends RuntimeException {

    private final String capability;

    public CapabilityException(String capability, String message) {
        super("%s failed: %s".formatted(capability, message));
        this.capability = capability;
    }

    public CapabilityException(String capability, String message, Throwable cause) {
        super("%s failed: %s".formatted(capability, message), cause);
        this.capability = capability;
    }

    /** Name of the failing provider, e.g. "retriever". */
    public String capability() {
        return capability;
    }
}

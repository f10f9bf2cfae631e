package dev.ragflow.model;

import java.util.Map;
import java.util.Objects;

/**
 * A unit of retrieved text together with its provider metadata.
 */
public record Document(String content, Map<String, String> metadata) {

    public static final String SOURCE = "source";

    public Document {
        Objects.requireNonNull(content, "content");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Document of(String content) {
        return new Document(content, Map.of());
    }

    public static Document of(String content, String source) {
        return new Document(content, Map.of(SOURCE, source));
    }

    /** The {@code source} metadata entry, or null when the provider did not set one. */
    public String source() {
        return metadata.get(SOURCE);
    }
}

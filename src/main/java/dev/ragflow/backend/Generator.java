package dev.ragflow.backend;

import java.util.List;

/**
 * Abstraction over chat language models.
 */
public interface Generator {

    /**
     * Send a prompt and return the model's free-text reply.
     *
     * @param messages system and user messages, in order
     * @return the reply text
     * @throws CapabilityException if the model call fails
     */
    String invoke(List<ChatMessage> messages);

    /**
     * Send a prompt and decode the reply into a schema record.
     *
     * @param messages system and user messages, in order
     * @param schema   record type the reply must conform to
     * @return the decoded record, never null
     * @throws CapabilityException if the model call fails
     * @throws dev.ragflow.engine.StructuredOutputException if the reply does not match the schema
     */
    <T> T invokeStructured(List<ChatMessage> messages, Class<T> schema);
}

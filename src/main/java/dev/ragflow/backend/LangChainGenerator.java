package dev.ragflow.backend;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import dev.ragflow.engine.StructuredOutputParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Generator} backed by a LangChain4j chat model. Structured mode appends
 * JSON format instructions to the last message and decodes the reply strictly.
 */
public class LangChainGenerator implements Generator {

    private static final Logger log = LoggerFactory.getLogger(LangChainGenerator.class);

    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final ChatLanguageModel model;

    public LangChainGenerator(ChatLanguageModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    /**
     * Generator for an OpenAI-compatible endpoint at temperature 0.
     *
     * @param baseUrl   endpoint base URL, or null for the OpenAI default
     * @param modelName model identifier, or null for {@link #DEFAULT_MODEL}
     */
    public static LangChainGenerator openAi(String apiKey, String baseUrl, String modelName) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("An API key is required for the OpenAI generator");
        }
        var builder = OpenAiChatModel.builder()
            .apiKey(apiKey)
            .modelName(modelName == null || modelName.isBlank() ? DEFAULT_MODEL : modelName)
            .temperature(0.0)
            .timeout(Duration.ofSeconds(60));
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return new LangChainGenerator(builder.build());
    }

    @Override
    public String invoke(List<ChatMessage> messages) {
        return call(toLangChain(messages));
    }

    @Override
    public <T> T invokeStructured(List<ChatMessage> messages, Class<T> schema) {
        var withFormat = new ArrayList<>(messages);
        if (withFormat.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        ChatMessage last = withFormat.remove(withFormat.size() - 1);
        withFormat.add(new ChatMessage(last.role(),
            last.content() + "\n\n" + StructuredOutputParser.formatInstructions(schema)));

        String raw = call(toLangChain(withFormat));
        return StructuredOutputParser.parse(raw, schema);
    }

    private String call(List<dev.langchain4j.data.message.ChatMessage> messages) {
        long startedAt = System.currentTimeMillis();
        Response<AiMessage> response;
        try {
            response = model.generate(messages);
        } catch (RuntimeException e) {
            throw new CapabilityException("generator", e.getMessage(), e);
        }
        String text = response == null || response.content() == null ? null : response.content().text();
        if (text == null) {
            throw new CapabilityException("generator", "model returned no text");
        }
        log.debug("Generator replied in {} ms ({} chars)", System.currentTimeMillis() - startedAt, text.length());
        return text;
    }

    private static List<dev.langchain4j.data.message.ChatMessage> toLangChain(List<ChatMessage> messages) {
        var converted = new ArrayList<dev.langchain4j.data.message.ChatMessage>(messages.size());
        for (ChatMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> converted.add(SystemMessage.from(message.content()));
                case USER -> converted.add(UserMessage.from(message.content()));
                case ASSISTANT -> converted.add(AiMessage.from(message.content()));
            }
        }
        return converted;
    }
}

package dev.ragflow.engine;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.List;

/**
 * Decodes model responses into schema records, strictly: missing, null, unknown
 * or mistyped fields are errors, never silently defaulted.
 */
public final class StructuredOutputParser {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
        .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
        .build();

    private StructuredOutputParser() {}

    /**
     * Extract the JSON object from a response and decode it into {@code schema}.
     *
     * @param responseText the full model response
     * @param schema       a record type describing the expected object
     * @return the decoded record, never null
     * @throws StructuredOutputException if no object is found or it does not match the schema
     */
    public static <T> T parse(String responseText, Class<T> schema) {
        if (responseText == null || responseText.isBlank()) {
            throw new StructuredOutputException("Empty response, expected %s".formatted(schema.getSimpleName()),
                responseText);
        }

        // Step 1: Strip markdown fences if present
        String text = stripFences(responseText.strip());

        // Step 2: Take the outermost object
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new StructuredOutputException("No JSON object found in response", responseText);
        }
        String candidate = text.substring(start, end + 1);

        // Step 3: Parse JSON
        JsonNode node;
        try {
            node = MAPPER.readTree(candidate);
        } catch (JsonProcessingException e) {
            throw new StructuredOutputException("Invalid JSON: " + e.getOriginalMessage(), candidate, e);
        }
        if (node == null || !node.isObject()) {
            throw new StructuredOutputException("Response is not a JSON object", candidate);
        }

        // Step 4: Bind against the schema
        try {
            return MAPPER.treeToValue(node, schema);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StructuredOutputException(
                "Response does not match %s: %s".formatted(schema.getSimpleName(), rootMessage(e)),
                candidate, e);
        }
    }

    /**
     * Instructions appended to a prompt so the model answers with an object
     * {@link #parse} accepts. Built from the record components of {@code schema}.
     */
    public static String formatInstructions(Class<?> schema) {
        if (!schema.isRecord()) {
            throw new IllegalArgumentException("Schema must be a record: " + schema.getName());
        }
        var sb = new StringBuilder();
        JsonClassDescription classDescription = schema.getAnnotation(JsonClassDescription.class);
        if (classDescription != null) {
            sb.append(classDescription.value()).append("\n\n");
        }
        sb.append("Respond with ONLY a JSON object, no other text, in this format:\n\n");

        var example = new StringBuilder("{");
        var fields = new StringBuilder();
        RecordComponent[] components = schema.getRecordComponents();
        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            String name = jsonName(component);
            String type = jsonType(component.getGenericType());
            if (i > 0) {
                example.append(", ");
            }
            example.append('"').append(name).append("\": <").append(type).append('>');

            fields.append("- ").append(name).append(" (").append(type).append(")");
            JsonPropertyDescription description = component.getAccessor().getAnnotation(JsonPropertyDescription.class);
            if (description != null) {
                fields.append(": ").append(description.value());
            }
            fields.append('\n');
        }
        example.append('}');

        sb.append(example).append("\n\nFields:\n").append(fields);
        sb.append("\nAll fields are required.");
        return sb.toString();
    }

    private static String jsonName(RecordComponent component) {
        JsonProperty property = component.getAccessor().getAnnotation(JsonProperty.class);
        return property != null && !property.value().isEmpty() ? property.value() : component.getName();
    }

    private static String jsonType(Type type) {
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() == List.class) {
            return "array of " + jsonType(parameterized.getActualTypeArguments()[0]) + "s";
        }
        if (type == String.class) {
            return "string";
        }
        if (type == double.class || type == Double.class || type == float.class || type == Float.class) {
            return "number";
        }
        if (type == int.class || type == Integer.class || type == long.class || type == Long.class) {
            return "integer";
        }
        if (type == boolean.class || type == Boolean.class) {
            return "boolean";
        }
        return "object";
    }

    private static String stripFences(String text) {
        // Remove ```json prefix and ``` suffix if wrapping the object
        String stripped = text;
        if (stripped.startsWith("```json")) {
            stripped = stripped.substring(7);
        } else if (stripped.startsWith("```")) {
            stripped = stripped.substring(3);
        }
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3);
        }
        return stripped.strip();
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return root.getMessage();
    }
}

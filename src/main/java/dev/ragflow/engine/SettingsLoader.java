package dev.ragflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ragflow.model.Guardrails;
import dev.ragflow.model.WorkflowSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Loads {@link WorkflowSettings} from JSON. Every key is optional:
 *
 * <pre>
 * {
 *   "nResults": 5,
 *   "rerankTopK": 3,
 *   "confidenceThreshold": 0.9,
 *   "suggestionConfidenceCheck": false,
 *   "guardrails": { "maxNodeVisits": 3, "maxTotalSteps": 50 }
 * }
 * </pre>
 *
 * {@code "rerankTopK": null} disables reranking.
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> KNOWN_KEYS = Set.of(
        "nResults", "rerankTopK", "confidenceThreshold", "suggestionConfidenceCheck", "guardrails");

    private static final Set<String> GUARDRAIL_KEYS = Set.of("maxNodeVisits", "maxTotalSteps");

    private SettingsLoader() {}

    /**
     * Load settings from a JSON file.
     */
    public static WorkflowSettings loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseSettings(root);
    }

    /**
     * Load settings from a JSON string.
     */
    public static WorkflowSettings loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseSettings(root);
    }

    private static WorkflowSettings parseSettings(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return WorkflowSettings.defaults();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Settings must be a JSON object");
        }
        checkKeys(root, KNOWN_KEYS, "settings key");

        int nResults = root.has("nResults")
            ? intValue(root, "nResults") : WorkflowSettings.DEFAULT_N_RESULTS;
        Integer rerankTopK = WorkflowSettings.DEFAULT_RERANK_TOP_K;
        if (root.has("rerankTopK")) {
            rerankTopK = root.get("rerankTopK").isNull() ? null : intValue(root, "rerankTopK");
        }
        double threshold = root.has("confidenceThreshold")
            ? doubleValue(root, "confidenceThreshold") : WorkflowSettings.DEFAULT_CONFIDENCE_THRESHOLD;
        boolean suggestionCheck = root.has("suggestionConfidenceCheck")
            && booleanValue(root, "suggestionConfidenceCheck");

        Guardrails guardrails = parseGuardrails(root.get("guardrails"));
        return new WorkflowSettings(nResults, rerankTopK, threshold, suggestionCheck, guardrails);
    }

    private static Guardrails parseGuardrails(JsonNode node) {
        if (node == null || node.isNull()) {
            return Guardrails.defaults();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Settings key 'guardrails' must be an object, got " + node);
        }
        checkKeys(node, GUARDRAIL_KEYS, "guardrails key");
        int maxNodeVisits = node.has("maxNodeVisits")
            ? intValue(node, "maxNodeVisits") : Guardrails.DEFAULT_MAX_NODE_VISITS;
        int maxTotalSteps = node.has("maxTotalSteps")
            ? intValue(node, "maxTotalSteps") : Guardrails.DEFAULT_MAX_TOTAL_STEPS;
        return new Guardrails(maxNodeVisits, maxTotalSteps);
    }

    private static int intValue(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Settings key '%s' must be an integer, got %s".formatted(key, value));
        }
        return value.asInt();
    }

    private static boolean booleanValue(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("Settings key '%s' must be a boolean, got %s".formatted(key, value));
        }
        return value.booleanValue();
    }

    private static void checkKeys(JsonNode node, Set<String> known, String kind) {
        node.fieldNames().forEachRemaining(key -> {
            if (!known.contains(key)) {
                throw new IllegalArgumentException("Unknown %s '%s'. Valid keys: %s".formatted(kind, key, known));
            }
        });
    }

    private static double doubleValue(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("Settings key '%s' must be a number, got %s".formatted(key, value));
        }
        return value.asDouble();
    }
}

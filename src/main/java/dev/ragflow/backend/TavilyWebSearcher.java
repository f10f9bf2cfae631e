package dev.ragflow.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tavily web search client returning the {@code content} snippet of each result.
 */
public class TavilyWebSearcher implements WebSearcher {

    private static final Logger log = LoggerFactory.getLogger(TavilyWebSearcher.class);

    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.tavily.com/search");
    public static final int DEFAULT_MAX_RESULTS = 3;

    private final HttpClient client;
    private final ObjectMapper om = new ObjectMapper();
    private final String apiKey;
    private final URI endpoint;
    private final int maxResults;

    public TavilyWebSearcher(String apiKey) {
        this(apiKey, DEFAULT_ENDPOINT, DEFAULT_MAX_RESULTS);
    }

    public TavilyWebSearcher(String apiKey, URI endpoint, int maxResults) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("A Tavily API key is required");
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        this.apiKey = apiKey;
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.maxResults = maxResults;
        this.client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(8)).build();
    }

    @Override
    public List<String> search(String query) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("api_key", apiKey);
            payload.put("query", query);
            payload.put("max_results", maxResults);
            payload.put("search_depth", "basic");
            payload.put("include_answer", false);

            String json = om.writeValueAsString(payload);
            HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofSeconds(15))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() / 100 != 2) {
                throw new CapabilityException("web search", "HTTP " + resp.statusCode() + " from " + endpoint);
            }

            JsonNode results = om.readTree(resp.body()).get("results");
            if (results == null || !results.isArray()) {
                throw new CapabilityException("web search", "response has no 'results' array");
            }
            List<String> snippets = new ArrayList<>();
            for (JsonNode item : results) {
                JsonNode content = item.get("content");
                if (content != null && !content.isNull() && !content.asText().isBlank()) {
                    snippets.add(content.asText());
                }
            }
            log.debug("Web search returned {} snippets for '{}'", snippets.size(), query);
            return snippets;
        } catch (IOException e) {
            throw new CapabilityException("web search", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("web search", "interrupted", e);
        }
    }
}

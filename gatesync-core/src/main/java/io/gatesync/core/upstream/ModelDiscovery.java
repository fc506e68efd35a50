package io.gatesync.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatesync.core.catalog.VendorInfo.DiscoveryDialect;
import io.gatesync.core.http.JsonHttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lists model ids through a vendor-compatible {@code models} endpoint using an end-user key.
 */
public final class ModelDiscovery {
    private final JsonHttpClient http;

    public ModelDiscovery(JsonHttpClient http) {
        this.http = http;
    }

    public List<String> listModels(String baseUrl, String apiKey, DiscoveryDialect dialect) {
        String root = NewApiSession.stripTrailingSlash(baseUrl);
        return switch (dialect) {
            case GEMINI -> names(http.get(root + "/v1beta/models?key=" + apiKey, Map.of()).path("models"));
            case ANTHROPIC -> ids(http.get(root + "/v1/models", Map.of(
                "x-api-key", apiKey,
                "anthropic-version", "2023-06-01"
            )).path("data"));
            case OPENAI -> ids(http.get(root + "/v1/models", Map.of("Authorization", "Bearer " + apiKey)).path("data"));
        };
    }

    private static List<String> ids(JsonNode data) {
        List<String> ids = new ArrayList<>();
        for (JsonNode model : data) {
            String id = model.path("id").asText("");
            if (!id.isBlank()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static List<String> names(JsonNode models) {
        List<String> names = new ArrayList<>();
        for (JsonNode model : models) {
            String name = stripModelsPrefix(model.path("name").asText(""));
            if (!name.isBlank()) {
                names.add(name);
            }
        }
        return names;
    }

    static String stripModelsPrefix(String id) {
        return id.startsWith("models/") ? id.substring("models/".length()) : id;
    }
}

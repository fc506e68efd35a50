package io.gatesync.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatesync.core.http.ApiRejectedException;
import io.gatesync.core.http.JsonHttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Authenticated access to one new-api style instance: the admin headers, the
 * {@code {success, message, data}} envelope and page-by-page listing.
 */
public final class NewApiSession {
    public static final int PAGE_SIZE = 100;

    private final JsonHttpClient http;
    private final String baseUrl;
    private final Map<String, String> headers;

    public NewApiSession(JsonHttpClient http, String baseUrl, String accessToken, long userId) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.headers = Map.of(
            "Authorization", "Bearer " + accessToken,
            "New-Api-User", String.valueOf(userId)
        );
    }

    public String baseUrl() {
        return baseUrl;
    }

    public JsonHttpClient http() {
        return http;
    }

    public JsonNode get(String path) {
        return http.get(baseUrl + path, headers);
    }

    /**
     * Unauthenticated read; public endpoints such as pricing reject unexpected headers on some forks.
     */
    public JsonNode getPublic(String path) {
        return http.get(baseUrl + path, Map.of());
    }

    public JsonNode call(String method, String path, Object body) {
        JsonNode response = http.send(method, baseUrl + path, headers, body);
        requireSuccess(response, method + " " + path);
        return response;
    }

    /**
     * Reads every page of a list endpoint. {@code pageParam} is {@code p} for zero-based endpoints
     * and {@code page} for one-based ones.
     */
    public <T> List<T> listAll(String path, String pageParam, int firstPage, Function<JsonNode, T> converter) {
        List<T> all = new ArrayList<>();
        String separator = path.contains("?") ? "&" : "?";
        for (int page = firstPage; ; page++) {
            JsonNode response = get(path + separator + pageParam + "=" + page + "&page_size=" + PAGE_SIZE);
            requireSuccess(response, "GET " + path);
            List<JsonNode> items = items(response.path("data"));
            items.forEach(item -> all.add(converter.apply(item)));
            if (items.size() < PAGE_SIZE) {
                return all;
            }
        }
    }

    static void requireSuccess(JsonNode response, String operation) {
        if (response.has("success") && !response.path("success").asBoolean(false)) {
            String message = response.path("message").asText("");
            throw new ApiRejectedException(operation + " rejected: " + (message.isBlank() ? "success=false" : message));
        }
    }

    // Lists come back as a bare array, or wrapped in {items: [...]} or {data: [...]}.
    static List<JsonNode> items(JsonNode data) {
        JsonNode array = data;
        if (!data.isArray()) {
            array = data.has("items") ? data.path("items") : data.path("data");
        }
        List<JsonNode> items = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(items::add);
        }
        return items;
    }

    static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}

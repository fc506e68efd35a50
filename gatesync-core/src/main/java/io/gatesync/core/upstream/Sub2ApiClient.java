package io.gatesync.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatesync.core.catalog.VendorInfo.DiscoveryDialect;
import io.gatesync.core.http.ApiRejectedException;
import io.gatesync.core.http.JsonHttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Admin API of a sub2api account pool. Responses use a {@code {code, message, data}} envelope
 * with {@code code == 0} on success.
 */
public final class Sub2ApiClient {
    private static final int PAGE_SIZE = 100;
    private static final String ACTIVE = "active";

    private final JsonHttpClient http;
    private final String baseUrl;
    private final Map<String, String> adminHeaders;

    public Sub2ApiClient(JsonHttpClient http, String baseUrl, String adminApiKey) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.baseUrl = NewApiSession.stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.adminHeaders = Map.of("x-api-key", adminApiKey == null ? "" : adminApiKey);
    }

    public String baseUrl() {
        return baseUrl;
    }

    public List<Group> listGroups() {
        return listPaged("/api/v1/admin/groups", node -> new Group(
            node.path("id").asLong(),
            node.path("name").asText(""),
            node.path("platform").asText(""),
            node.path("status").asText("")
        ));
    }

    public List<Account> listAccounts() {
        return listPaged("/api/v1/admin/accounts", node -> new Account(
            node.path("id").asLong(),
            node.path("name").asText(""),
            node.path("platform").asText(""),
            node.path("type").asText(""),
            node.path("status").asText("")
        ));
    }

    public List<String> accountModels(long accountId) {
        JsonNode data = unwrap(http.get(baseUrl + "/api/v1/admin/accounts/" + accountId + "/models", adminHeaders),
            "account " + accountId + " models");
        List<String> models = new ArrayList<>();
        for (JsonNode model : data) {
            String id = ModelDiscovery.stripModelsPrefix(model.path("id").asText(""));
            if (!id.isBlank()) {
                models.add(id);
            }
        }
        return models;
    }

    /**
     * First active API key bound to the group, if any.
     */
    public Optional<String> groupApiKey(long groupId) {
        JsonNode data = unwrap(
            http.get(baseUrl + "/api/v1/admin/groups/" + groupId + "/api-keys?page=1&page_size=1", adminHeaders),
            "group " + groupId + " api keys"
        );
        for (JsonNode key : data.path("items")) {
            if (ACTIVE.equalsIgnoreCase(key.path("status").asText("")) && !key.path("key").asText("").isBlank()) {
                return Optional.of(key.path("key").asText());
            }
        }
        return Optional.empty();
    }

    /**
     * Models visible to an end-user key of the given platform, for groups configured by key only.
     */
    public List<String> gatewayModels(String apiKey, String platform) {
        DiscoveryDialect dialect = "gemini".equalsIgnoreCase(platform) ? DiscoveryDialect.GEMINI : DiscoveryDialect.OPENAI;
        return new ModelDiscovery(http).listModels(baseUrl, apiKey, dialect);
    }

    private <T> List<T> listPaged(String path, Function<JsonNode, T> converter) {
        List<T> all = new ArrayList<>();
        for (int page = 1; ; page++) {
            JsonNode data = unwrap(http.get(baseUrl + path + "?page=" + page + "&page_size=" + PAGE_SIZE, adminHeaders), path);
            data.path("items").forEach(item -> all.add(converter.apply(item)));
            if (page >= data.path("pages").asInt(1)) {
                return all;
            }
        }
    }

    private static JsonNode unwrap(JsonNode response, String what) {
        if (response.path("code").asInt(-1) != 0) {
            throw new ApiRejectedException("sub2api " + what + " failed: " + response.path("message").asText("unknown error"));
        }
        return response.path("data");
    }

    public record Group(long id, String name, String platform, String status) {
        public boolean active() {
            return ACTIVE.equalsIgnoreCase(status);
        }
    }

    public record Account(long id, String name, String platform, String type, String status) {
        public boolean active() {
            return ACTIVE.equalsIgnoreCase(status);
        }
    }
}

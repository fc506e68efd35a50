package io.gatesync.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatesync.core.http.TransportException;
import io.gatesync.core.token.TokenStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upstream gateway of the new-api family: pricing catalog, balance and group-scoped tokens.
 */
public final class NewApiClient implements TokenStore {
    private static final Logger LOG = LoggerFactory.getLogger(NewApiClient.class);
    /** new-api stores quota in units of 1/500000 USD. */
    public static final double QUOTA_PER_DOLLAR = 500_000.0;

    private final NewApiSession session;
    private final String name;
    private final PricingParsers parsers;

    public NewApiClient(NewApiSession session, String name) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.parsers = new PricingParsers(session.http().mapper());
    }

    public String baseUrl() {
        return session.baseUrl();
    }

    public HealthStatus healthCheck() {
        try {
            JsonNode response = session.get("/api/user/self");
            if (!response.path("success").asBoolean(false)) {
                String message = response.path("message").asText("");
                return HealthStatus.failed(message.isBlank() ? "API returned success: false" : message);
            }
            JsonNode quota = response.path("data").path("quota");
            return HealthStatus.healthy(quota.isNumber() ? quota.asDouble() / QUOTA_PER_DOLLAR : null);
        } catch (TransportException e) {
            return HealthStatus.failed(e.getMessage());
        }
    }

    /**
     * Balance in dollars, empty when the instance does not report it.
     */
    public OptionalDouble fetchBalance() {
        HealthStatus status = healthCheck();
        if (!status.ok() || status.balance() == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(status.balance());
    }

    /**
     * Prefers {@code /api/pricing_new} when it serves the flat shape, which carries endpoint
     * kinds, and falls back to {@code /api/pricing}.
     */
    public UpstreamPricing fetchPricing() {
        JsonNode chosen = null;
        for (String path : List.of("/api/pricing_new", "/api/pricing")) {
            JsonNode body;
            try {
                body = session.getPublic(path);
            } catch (TransportException e) {
                LOG.debug("[{}] {} unavailable: {}", name, path, e.getMessage());
                continue;
            }
            if (!body.path("success").asBoolean(false) || body.path("data").isMissingNode() || body.path("data").isNull()) {
                continue;
            }
            if (path.endsWith("_new") && !body.path("data").isArray()) {
                continue;
            }
            chosen = body;
            break;
        }
        if (chosen == null) {
            throw new TransportException("Failed to fetch pricing from both /api/pricing_new and /api/pricing", false);
        }
        UpstreamPricing pricing = parsers.parse(chosen);
        LOG.info("[{}] {} pricing: {} groups, {} models", name, pricing.shape(), pricing.groups().size(), pricing.models().size());
        return pricing;
    }

    @Override
    public List<UpstreamToken> listTokens() {
        return session.listAll("/api/token/", "p", 0, node -> new UpstreamToken(
            node.path("id").asLong(),
            node.path("name").asText(""),
            node.path("key").asText(""),
            node.path("group").asText(""),
            node.path("status").asInt(0)
        ));
    }

    @Override
    public void createToken(String tokenName, String group) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", tokenName);
        body.put("group", group);
        body.put("expired_time", -1);
        body.put("unlimited_quota", true);
        body.put("model_limits_enabled", false);
        session.call("POST", "/api/token/", body);
    }

    @Override
    public void deleteToken(long id) {
        session.call("DELETE", "/api/token/" + id, null);
    }
}

package io.gatesync.core.target;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.http.HttpStatusException;
import io.gatesync.core.upstream.HealthStatus;
import io.gatesync.core.upstream.NewApiClient;
import io.gatesync.core.upstream.NewApiSession;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NewApiTargetClient implements TargetClient {
    private static final Logger LOG = LoggerFactory.getLogger(NewApiTargetClient.class);

    private final NewApiSession session;
    private final NewApiClient account;
    private final ObjectMapper mapper;

    public NewApiTargetClient(NewApiSession session) {
        this.session = session;
        this.account = new NewApiClient(session, "target");
        this.mapper = session.http().mapper();
    }

    @Override
    public HealthStatus healthCheck() {
        return account.healthCheck();
    }

    @Override
    public List<Channel> listChannels() {
        return session.listAll("/api/channel/", "p", 0, node -> mapper.convertValue(node, Channel.class));
    }

    /**
     * Newer targets expect {@code {mode: "single", channel}}; older ones reject it with a 4xx
     * and take the bare channel.
     */
    @Override
    public long createChannel(Channel channel) {
        Channel payload = channel.withId(null);
        JsonNode response;
        try {
            response = session.call("POST", "/api/channel/", Map.of("mode", "single", "channel", payload));
        } catch (HttpStatusException e) {
            if (e.status() != 400 && e.status() != 422) {
                throw e;
            }
            LOG.debug("[target] Wrapped channel create rejected ({}), retrying flat", e.status());
            response = session.call("POST", "/api/channel/", payload);
        }
        return response.path("data").path("id").asLong(0);
    }

    @Override
    public void updateChannel(Channel channel) {
        if (channel.id() == null) {
            throw new IllegalArgumentException("channel " + channel.name() + " has no id");
        }
        session.call("PUT", "/api/channel/", channel);
    }

    @Override
    public void deleteChannel(long id) {
        session.call("DELETE", "/api/channel/" + id, null);
    }

    @Override
    public List<ModelMeta> listModels() {
        return session.listAll("/api/models/", "p", 0, node -> mapper.convertValue(node, ModelMeta.class));
    }

    @Override
    public void createModel(ModelMeta model) {
        session.call("POST", "/api/models/", model.withId(null));
    }

    @Override
    public void updateModel(ModelMeta model) {
        session.call("PUT", "/api/models/", model);
    }

    @Override
    public void deleteModel(long id) {
        session.call("DELETE", "/api/models/" + id, null);
    }

    @Override
    public List<Vendor> listVendors() {
        return session.listAll("/api/vendors/", "page", 1, node -> mapper.convertValue(node, Vendor.class));
    }

    @Override
    public Map<String, String> getOptions(Collection<String> keys) {
        Set<String> wanted = new HashSet<>(keys);
        JsonNode response = session.get("/api/option/");
        Map<String, String> options = new LinkedHashMap<>();
        for (JsonNode option : response.path("data")) {
            String key = option.path("key").asText("");
            if (wanted.contains(key)) {
                options.put(key, option.path("value").asText(""));
            }
        }
        return options;
    }

    @Override
    public void updateOption(String key, String value) {
        session.call("PUT", "/api/option/", Map.of("key", key, "value", value));
    }

    @Override
    public int cleanupOrphanedModels() {
        JsonNode response = session.call("DELETE", "/api/models/orphaned", null);
        int deleted = response.path("data").path("deleted").asInt(0);
        if (deleted > 0) {
            LOG.info("[target] Cleaned up {} orphaned models", deleted);
        }
        return deleted;
    }
}

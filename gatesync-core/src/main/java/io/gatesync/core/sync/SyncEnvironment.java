package io.gatesync.core.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.config.model.SyncSettings;
import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.json.JsonSupport;
import io.gatesync.core.provider.ProviderAdapterFactory;
import io.gatesync.core.provider.ProviderContext;
import io.gatesync.core.target.NewApiTargetClient;
import io.gatesync.core.target.TargetClient;
import io.gatesync.core.tester.ModelTester;
import io.gatesync.core.token.TokenStore;
import io.gatesync.core.upstream.NewApiClient;
import io.gatesync.core.upstream.NewApiSession;
import java.time.Duration;
import java.util.Objects;

/**
 * Wires the HTTP clients, target client and provider adapters for one configuration.
 * Administrative calls retry transient failures; model probes are sent once.
 */
public final class SyncEnvironment {
    private static final Duration INITIAL_BACKOFF = Duration.ofMillis(500);

    private final SyncConfig config;
    private final ObjectMapper mapper;
    private final JsonHttpClient http;
    private final TargetClient target;
    private final ProviderAdapterFactory adapterFactory;

    public SyncEnvironment(SyncConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = JsonSupport.newMapper();
        SyncSettings settings = config.settings();
        this.http = new JsonHttpClient(JsonHttpClient.defaultClient(settings.httpTimeout()), mapper, settings.maxAttempts(), INITIAL_BACKOFF);
        JsonHttpClient probeHttp = new JsonHttpClient(JsonHttpClient.defaultClient(settings.probeTimeout()), mapper, 1, Duration.ZERO);
        this.target = new NewApiTargetClient(new NewApiSession(
            http,
            config.target().baseUrl(),
            config.target().systemAccessToken(),
            config.target().userId()
        ));
        this.adapterFactory = new ProviderAdapterFactory(
            new ProviderContext(config, http, new ModelTester(probeHttp, settings.probeConcurrency()))
        );
    }

    public SyncConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public TargetClient target() {
        return target;
    }

    public ProviderAdapterFactory adapterFactory() {
        return adapterFactory;
    }

    public TokenStore tokenStore(NewApiProviderConfig provider) {
        return new NewApiClient(
            new NewApiSession(http, provider.baseUrl(), provider.systemAccessToken(), provider.userId()),
            provider.name()
        );
    }
}

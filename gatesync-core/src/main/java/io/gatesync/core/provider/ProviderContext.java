package io.gatesync.core.provider;

import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.tester.ModelTester;
import java.util.Objects;

/**
 * Collaborators shared by every adapter of one run.
 */
public record ProviderContext(SyncConfig config, JsonHttpClient http, ModelTester tester) {
    public ProviderContext {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(http, "http must not be null");
        Objects.requireNonNull(tester, "tester must not be null");
    }
}

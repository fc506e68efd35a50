package io.gatesync.core.sync;

import io.gatesync.core.apply.ApplyError;
import io.gatesync.core.apply.ApplyExecutor;
import io.gatesync.core.apply.ApplyReport;
import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.diff.DiffEngine;
import io.gatesync.core.diff.SyncDiff;
import io.gatesync.core.http.TransportException;
import io.gatesync.core.pipeline.DesiredState;
import io.gatesync.core.target.SnapshotReader;
import io.gatesync.core.target.TargetClient;
import io.gatesync.core.target.TargetSnapshot;
import io.gatesync.core.token.TokenManager;
import io.gatesync.core.token.TokenStore;
import io.gatesync.core.upstream.HealthStatus;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes everything the selected providers own: their channels, the owned models nothing else
 * references, their option entries and their upstream tokens. Resources of other providers stay.
 */
public final class ResetService {
    private static final Logger LOG = LoggerFactory.getLogger(ResetService.class);

    private final SyncConfig config;
    private final TargetClient target;
    private final Function<NewApiProviderConfig, TokenStore> tokenStores;

    public ResetService(SyncEnvironment environment) {
        this(environment.config(), environment.target(), environment::tokenStore);
    }

    ResetService(SyncConfig config, TargetClient target, Function<NewApiProviderConfig, TokenStore> tokenStores) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.tokenStores = Objects.requireNonNull(tokenStores, "tokenStores must not be null");
    }

    public ResetResult reset() {
        HealthStatus health = target.healthCheck();
        if (!health.ok()) {
            throw new SyncAbortedException("Target health check failed: " + (health.error() == null ? "unknown" : health.error()));
        }

        Set<String> providers = new LinkedHashSet<>();
        config.providers().forEach(provider -> providers.add(provider.name()));
        LOG.info("[target] Resetting resources of {}", providers);

        TargetSnapshot snapshot = new SnapshotReader(target).read();
        SyncDiff diff = new DiffEngine().buildSyncDiff(DesiredState.emptyFor(providers), snapshot);
        ApplyReport report = new ApplyExecutor(target).apply(diff, false);

        List<ApplyError> errors = new ArrayList<>(report.errors());
        int tokensDeleted = 0;
        for (ProviderConfig provider : config.providers()) {
            if (!(provider instanceof NewApiProviderConfig newApi)) {
                continue;
            }
            try {
                int deleted = new TokenManager(tokenStores.apply(newApi), newApi.name()).deleteAll();
                LOG.info("[{}] Deleted {} tokens", newApi.name(), deleted);
                tokensDeleted += deleted;
            } catch (TransportException e) {
                LOG.warn("[{}] Token cleanup failed: {}", newApi.name(), e.getMessage());
                errors.add(new ApplyError(ApplyError.Phase.TOKENS, newApi.name(), e.getMessage()));
            }
        }

        return new ResetResult(
            report.channels().deleted(),
            report.models().deleted(),
            report.models().orphansDeleted(),
            tokensDeleted,
            report.options().updated(),
            errors
        );
    }
}

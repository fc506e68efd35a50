package io.gatesync.core.provider;

import io.gatesync.core.config.model.DirectProviderConfig;
import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.Sub2ApiProviderConfig;
import java.util.Comparator;
import java.util.List;

public final class ProviderAdapterFactory {
    private final ProviderContext context;

    public ProviderAdapterFactory(ProviderContext context) {
        this.context = context;
    }

    public ProviderAdapter create(ProviderConfig provider) {
        if (provider instanceof NewApiProviderConfig newApi) {
            return new GatewayProviderAdapter(newApi, context);
        }
        if (provider instanceof DirectProviderConfig direct) {
            return new DirectProviderAdapter(direct, context);
        }
        if (provider instanceof Sub2ApiProviderConfig sub2api) {
            return new AccountPoolProviderAdapter(sub2api, context);
        }
        throw new IllegalArgumentException("Unsupported provider type: " + provider.getClass().getSimpleName());
    }

    /**
     * Adapters in pipeline order: gateways, then direct vendors, then account pools. The sort is
     * stable, so configuration order is kept within a kind.
     */
    public List<ProviderAdapter> createAll(List<ProviderConfig> providers) {
        return providers.stream()
            .sorted(Comparator.comparing(ProviderConfig::kind))
            .map(this::create)
            .toList();
    }
}

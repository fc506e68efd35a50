package io.gatesync.core.provider;

import io.gatesync.core.catalog.ResourceNames;
import io.gatesync.core.catalog.VendorCatalog;
import io.gatesync.core.catalog.VendorInfo;
import io.gatesync.core.config.model.DirectProviderConfig;
import io.gatesync.core.config.model.ProviderKind;
import io.gatesync.core.pricing.PriceAdjustment;
import io.gatesync.core.pricing.PriceTiers;
import io.gatesync.core.pricing.RoutingWeights;
import io.gatesync.core.tester.ModelTestResult;
import io.gatesync.core.tester.ProbeDialect;
import io.gatesync.core.upstream.DirectVendorClient;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A vendor key used directly. Priced at a fixed group ratio, or relative to the cheapest group
 * already aggregated for each model when a price adjustment is configured.
 */
public final class DirectProviderAdapter implements ProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(DirectProviderAdapter.class);

    private final DirectProviderConfig provider;
    private final ProviderContext context;
    private final String vendor;
    private final VendorInfo vendorInfo;
    private final DirectVendorClient client;

    private List<String> candidates = List.of();
    private ModelTestResult result;

    public DirectProviderAdapter(DirectProviderConfig provider, ProviderContext context) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.vendor = provider.vendor().toLowerCase(Locale.ROOT);
        this.vendorInfo = VendorCatalog.info(vendor)
            .orElseThrow(() -> new ProviderException("Unknown vendor: " + provider.vendor()));
        this.client = new DirectVendorClient(context.http(), provider.baseUrl(), provider.apiKey(), vendorInfo);
    }

    @Override
    public String name() {
        return provider.name();
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.DIRECT;
    }

    @Override
    public TokenCounts tokenCounts() {
        return TokenCounts.NONE;
    }

    @Override
    public void discover(AggregationState state) {
        List<String> discovered = client.discoverModels();
        LOG.info("[{}] Discovered {} models from {}", provider.name(), discovered.size(), vendor);
        ModelSelection selection = new ModelSelection(provider.name(), context.config().blacklist(), List.of(), provider.enabledModels());
        candidates = selection.select(discovered, state.modelEndpoints(), model -> model);
        if (candidates.isEmpty()) {
            throw new ProviderException("No models passed filters");
        }
        LOG.info("[{}] {} models after filtering", provider.name(), candidates.size());
    }

    @Override
    public void healthProbe(AggregationState state) {
        result = context.tester().testModels(
            client.baseUrl(),
            provider.apiKey(),
            candidates,
            ProbeDialect.forChannelType(vendorInfo.channelType(), "openai".equals(vendor))
        );
        if (result.workingModels().isEmpty()) {
            throw new ProviderException("No working models (0/" + candidates.size() + " passed)");
        }
        String latency = result.avgResponseTimeMs() == null ? "N/A" : Math.round(result.avgResponseTimeMs()) + "ms";
        LOG.info("[{}] {}/{} working | {} -> +{}", provider.name(), result.workingModels().size(), candidates.size(),
            latency, RoutingWeights.priority(result.avgResponseTimeMs()));
    }

    @Override
    public ProviderReport materialize(AggregationState state) {
        List<String> models = result.workingModels().stream()
            .map(context.config()::mapModel)
            .distinct()
            .toList();
        int priority = RoutingWeights.priority(result.avgResponseTimeMs());
        int weight = RoutingWeights.weight(priority);
        String baseName = ResourceNames.channelName(vendor, provider.name(), Set.of());
        String description = vendor + " via " + provider.name() + " (direct)";

        List<PriceTiers.Tier> tiers;
        if (provider.priceAdjustment() == null) {
            double groupRatio = provider.groupRatio() == null ? 1.0 : provider.groupRatio();
            tiers = PriceTiers.split(models, model -> groupRatio);
        } else {
            PriceAdjustment adjustment = provider.priceAdjustment();
            tiers = PriceTiers.split(models, model -> PriceTiers.effectiveRatio(
                state.cheapestGroupRatio(model, provider.name()).orElse(1.0),
                adjustment,
                model
            ));
        }
        if (tiers.isEmpty()) {
            throw new ProviderException("Every price tier exceeds ratio 1");
        }

        for (int i = 0; i < tiers.size(); i++) {
            PriceTiers.Tier tier = tiers.get(i);
            String tierName = PriceTiers.tierName(baseName, i, tiers.size());
            state.addGroup(new MergedGroup(tierName, tier.ratio(), description, provider.name()));
            state.addChannel(new ChannelSpec(
                tierName,
                vendorInfo.channelType(),
                provider.apiKey(),
                client.baseUrl(),
                tier.models(),
                tierName,
                priority,
                weight,
                provider.name(),
                tierName
            ));
        }
        for (String model : models) {
            state.putModelIfAbsent(model, MergedModel.ratios(1.0, 1.0));
        }
        return ProviderReport.succeeded(provider.name(), tiers.size(), result.workingModels().size(), TokenCounts.NONE);
    }
}

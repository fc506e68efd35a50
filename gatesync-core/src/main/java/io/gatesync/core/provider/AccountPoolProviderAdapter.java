package io.gatesync.core.provider;

import io.gatesync.core.catalog.ChannelTypes;
import io.gatesync.core.catalog.ResourceNames;
import io.gatesync.core.catalog.VendorCatalog;
import io.gatesync.core.config.model.ProviderKind;
import io.gatesync.core.config.model.Sub2ApiGroupConfig;
import io.gatesync.core.config.model.Sub2ApiProviderConfig;
import io.gatesync.core.http.TransportException;
import io.gatesync.core.pricing.PriceAdjustment;
import io.gatesync.core.pricing.PriceTiers;
import io.gatesync.core.pricing.RoutingWeights;
import io.gatesync.core.tester.ModelTestResult;
import io.gatesync.core.tester.ProbeDialect;
import io.gatesync.core.upstream.Sub2ApiClient;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A sub2api account pool. Each pool group becomes a channel priced below the cheapest ratio
 * aggregated so far for the same models, so this kind always runs last.
 */
public final class AccountPoolProviderAdapter implements ProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(AccountPoolProviderAdapter.class);

    private final Sub2ApiProviderConfig provider;
    private final ProviderContext context;
    private final Sub2ApiClient client;
    private final ModelSelection selection;

    private final List<PoolGroup> pools = new ArrayList<>();
    private final List<ProbedPool> probed = new ArrayList<>();

    public AccountPoolProviderAdapter(Sub2ApiProviderConfig provider, ProviderContext context) {
        this(provider, context, new Sub2ApiClient(context.http(), provider.baseUrl(), provider.adminApiKey()));
    }

    AccountPoolProviderAdapter(Sub2ApiProviderConfig provider, ProviderContext context, Sub2ApiClient client) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.selection = new ModelSelection(provider.name(), context.config().blacklist(), List.of(), provider.enabledModels());
    }

    @Override
    public String name() {
        return provider.name();
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.SUB2API;
    }

    @Override
    public TokenCounts tokenCounts() {
        return TokenCounts.NONE;
    }

    @Override
    public void discover(AggregationState state) {
        if (provider.hasAdminKey()) {
            discoverAdminGroups(state);
        }
        for (Sub2ApiGroupConfig group : provider.groups()) {
            String platform = group.platform().toLowerCase(Locale.ROOT);
            if (!platformEnabled(platform)) {
                continue;
            }
            String label = group.name() == null || group.name().isBlank() ? platform : group.name();
            List<String> models;
            try {
                models = client.gatewayModels(group.key(), platform);
            } catch (TransportException e) {
                LOG.warn("[{}/{}] Model listing failed: {}", provider.name(), label, e.getMessage());
                continue;
            }
            pools.add(new PoolGroup(label, platform, group.key(), selection.select(models, state.modelEndpoints(), m -> m)));
        }
        if (pools.isEmpty()) {
            throw new ProviderException("No active groups with API keys");
        }
        LOG.info("[{}] {} groups with API keys", provider.name(), pools.size());
    }

    private void discoverAdminGroups(AggregationState state) {
        List<Sub2ApiClient.Group> active = client.listGroups().stream()
            .filter(Sub2ApiClient.Group::active)
            .filter(group -> platformEnabled(group.platform().toLowerCase(Locale.ROOT)))
            .toList();
        if (active.isEmpty()) {
            return;
        }

        List<Sub2ApiClient.Account> accounts = client.listAccounts();
        List<Sub2ApiClient.Account> activeAccounts = accounts.stream().filter(Sub2ApiClient.Account::active).toList();
        LOG.info("[{}] {}/{} active accounts", provider.name(), activeAccounts.size(), accounts.size());
        Map<String, Set<String>> platformModels = new LinkedHashMap<>();
        for (Sub2ApiClient.Account account : activeAccounts) {
            Set<String> models = platformModels.computeIfAbsent(account.platform().toLowerCase(Locale.ROOT), ignored -> new LinkedHashSet<>());
            models.addAll(selection.select(client.accountModels(account.id()), state.modelEndpoints(), m -> m));
        }

        for (Sub2ApiClient.Group group : active) {
            Optional<String> apiKey = client.groupApiKey(group.id());
            if (apiKey.isEmpty()) {
                LOG.warn("[{}] No API key for group {}, skipping", provider.name(), group.name());
                continue;
            }
            String platform = group.platform().toLowerCase(Locale.ROOT);
            pools.add(new PoolGroup(group.name(), platform, apiKey.get(),
                new ArrayList<>(platformModels.getOrDefault(platform, Set.of()))));
        }
    }

    @Override
    public void healthProbe(AggregationState state) {
        for (PoolGroup pool : pools) {
            if (pool.models().isEmpty()) {
                LOG.warn("[{}/{}] No models for group", provider.name(), pool.name());
                continue;
            }
            ModelTestResult result = context.tester().testModels(
                client.baseUrl(),
                pool.apiKey(),
                pool.models(),
                ProbeDialect.forChannelType(ChannelTypes.fromPlatform(pool.platform()), "openai".equals(pool.platform()))
            );
            if (result.workingModels().isEmpty()) {
                LOG.warn("[{}/{}] No working models (0/{} passed)", provider.name(), pool.name(), pool.models().size());
                continue;
            }
            LOG.info("[{}/{}] {}/{} models working", provider.name(), pool.name(), result.workingModels().size(), pool.models().size());
            probed.add(new ProbedPool(pool, result));
        }
    }

    @Override
    public ProviderReport materialize(AggregationState state) {
        PriceAdjustment adjustment = provider.effectiveAdjustment();
        Set<String> takenNames = new HashSet<>();
        int groupsProduced = 0;
        int modelCount = 0;
        for (ProbedPool entry : probed) {
            PoolGroup pool = entry.pool();
            List<String> models = entry.result().workingModels().stream()
                .map(context.config()::mapModel)
                .distinct()
                .toList();
            List<PriceTiers.Tier> tiers = PriceTiers.split(models, model -> PriceTiers.effectiveRatio(
                state.cheapestGroupRatio(model, provider.name()).orElse(1.0),
                adjustment,
                model
            ));
            if (tiers.isEmpty()) {
                LOG.info("[{}/{}] Every price tier exceeds ratio 1, skipping", provider.name(), pool.name());
                continue;
            }
            String baseName = ResourceNames.channelName(pool.name(), provider.name(), takenNames);
            takenNames.add(baseName);
            int priority = RoutingWeights.priority(entry.result().avgResponseTimeMs());
            int weight = RoutingWeights.weight(priority);
            int channelType = ChannelTypes.fromPlatform(pool.platform());
            String description = pool.platform() + " via " + provider.name();

            for (int i = 0; i < tiers.size(); i++) {
                PriceTiers.Tier tier = tiers.get(i);
                String tierName = PriceTiers.tierName(baseName, i, tiers.size());
                state.addGroup(new MergedGroup(tierName, tier.ratio(), description, provider.name()));
                state.addChannel(new ChannelSpec(
                    tierName,
                    channelType,
                    pool.apiKey(),
                    client.baseUrl(),
                    tier.models(),
                    tierName,
                    priority,
                    weight,
                    provider.name(),
                    pool.name() + "-" + provider.name()
                ));
                LOG.info("[{}/{}] {} models, ratio {}", provider.name(), tierName, tier.models().size(),
                    String.format(Locale.ROOT, "%.4f", tier.ratio()));
            }
            for (String model : models) {
                state.putModelIfAbsent(model, MergedModel.ratios(1.0, 1.0));
            }
            groupsProduced++;
            modelCount += models.size();
        }
        if (groupsProduced == 0) {
            throw new ProviderException("No groups produced working channels");
        }
        return ProviderReport.succeeded(provider.name(), groupsProduced, modelCount, TokenCounts.NONE);
    }

    private boolean platformEnabled(String platform) {
        if (provider.enabledVendors().isEmpty()) {
            return true;
        }
        return provider.enabledVendors().stream()
            .flatMap(vendor -> VendorCatalog.platformsFor(vendor).stream())
            .anyMatch(platform::equals);
    }

    private record PoolGroup(String name, String platform, String apiKey, List<String> models) {
    }

    private record ProbedPool(PoolGroup pool, ModelTestResult result) {
    }
}

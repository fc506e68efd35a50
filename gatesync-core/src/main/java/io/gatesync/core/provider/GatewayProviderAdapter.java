package io.gatesync.core.provider;

import io.gatesync.core.catalog.ModelPatterns;
import io.gatesync.core.catalog.ResourceNames;
import io.gatesync.core.catalog.VendorCatalog;
import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.ProviderKind;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.pricing.PriceAdjustment;
import io.gatesync.core.pricing.PriceTiers;
import io.gatesync.core.pricing.RoutingWeights;
import io.gatesync.core.tester.ModelTestResult;
import io.gatesync.core.tester.ProbeDialect;
import io.gatesync.core.token.TokenManager;
import io.gatesync.core.token.TokenResult;
import io.gatesync.core.upstream.GroupInfo;
import io.gatesync.core.upstream.ModelInfo;
import io.gatesync.core.upstream.NewApiClient;
import io.gatesync.core.upstream.NewApiSession;
import io.gatesync.core.upstream.UpstreamPricing;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A new-api gateway: one channel (or one per price tier) for each upstream group, authenticated
 * with a token this tool provisions on the upstream.
 */
public final class GatewayProviderAdapter implements ProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayProviderAdapter.class);
    private static final int ANTHROPIC_VENDOR_ID = 2;

    private final NewApiProviderConfig provider;
    private final ProviderContext context;
    private final NewApiClient client;
    private final TokenManager tokenManager;
    private final ModelSelection selection;

    private UpstreamPricing pricing;
    private List<GroupInfo> groups = List.of();
    private TokenResult tokens;
    private TokenCounts tokenCounts = TokenCounts.NONE;
    private final List<ProbedGroup> probed = new ArrayList<>();
    private double totalProbeCost;

    public GatewayProviderAdapter(NewApiProviderConfig provider, ProviderContext context) {
        this(provider, context, new NewApiClient(
            new NewApiSession(context.http(), provider.baseUrl(), provider.systemAccessToken(), provider.userId()),
            provider.name()
        ));
    }

    GatewayProviderAdapter(NewApiProviderConfig provider, ProviderContext context, NewApiClient client) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.tokenManager = new TokenManager(client, provider.name());
        this.selection = new ModelSelection(
            provider.name(),
            context.config().blacklist(),
            provider.enabledVendors(),
            provider.enabledModels()
        );
    }

    @Override
    public String name() {
        return provider.name();
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.NEWAPI;
    }

    @Override
    public TokenCounts tokenCounts() {
        return tokenCounts;
    }

    @Override
    public void discover(AggregationState state) {
        pricing = client.fetchPricing();
        for (ModelInfo model : pricing.models()) {
            state.recordEndpoints(model.name(), model.supportedEndpoints());
        }
        state.recordEndpointPaths(pricing.endpointPaths());
        logSuggestedGroups();

        List<String> blacklist = context.config().blacklist();
        List<GroupInfo> candidates = pricing.groups().stream()
            .filter(group -> provider.enabledGroups().isEmpty() || provider.enabledGroups().contains(group.name()))
            .filter(group -> !selection.hasVendorFilter() || selection.anyFromEnabledVendor(group.models()))
            .filter(group -> !ModelPatterns.blacklisted(group.name(), blacklist, provider.name()))
            .filter(group -> !ModelPatterns.blacklisted(group.description(), blacklist, provider.name()))
            .toList();

        double cheapestMultiplier = PriceAdjustment.multiplier(PriceAdjustment.orNone(provider.priceAdjustment()).minimum());
        List<GroupInfo> tooExpensive = candidates.stream()
            .filter(group -> group.ratio() * cheapestMultiplier > PriceTiers.MAX_RATIO)
            .toList();
        if (!tooExpensive.isEmpty()) {
            LOG.info("[{}] Skipping {} group(s) with effective ratio > 1: {}", provider.name(), tooExpensive.size(),
                tooExpensive.stream()
                    .map(group -> String.format(Locale.ROOT, "%s (%.4f)", group.name(), group.ratio() * cheapestMultiplier))
                    .collect(Collectors.joining(", ")));
        }
        groups = candidates.stream()
            .filter(group -> group.ratio() * cheapestMultiplier <= PriceTiers.MAX_RATIO)
            .toList();

        tokens = tokenManager.ensureTokens(groups.stream().map(GroupInfo::name).toList());
        tokenCounts = new TokenCounts(tokens.created(), tokens.existing(), tokens.deleted());
    }

    @Override
    public void healthProbe(AggregationState state) {
        SyncConfig config = context.config();
        OptionalDouble startBalance = client.fetchBalance();
        startBalance.ifPresent(balance -> LOG.info("[{}] Balance: ${}", provider.name(), format(balance)));
        double balance = startBalance.orElse(Double.NaN);

        int deleted = 0;
        for (GroupInfo group : groups) {
            List<String> candidates = selection.select(group.models(), state.modelEndpoints(), config::mapModel);
            if (candidates.isEmpty()) {
                continue;
            }
            String apiKey = tokens.tokens().get(group.name());
            if (apiKey == null) {
                LOG.warn("[{}/{}] No token, skipping group", provider.name(), group.name());
                continue;
            }
            ModelTestResult result = context.tester().testModels(
                provider.baseUrl(),
                apiKey,
                candidates,
                ProbeDialect.forChannelType(group.channelType(), false)
            );

            double cost = 0;
            OptionalDouble after = client.fetchBalance();
            if (after.isPresent() && !Double.isNaN(balance)) {
                cost = Math.max(0, balance - after.getAsDouble());
                totalProbeCost += cost;
                balance = after.getAsDouble();
            }

            String latency = result.avgResponseTimeMs() == null ? "-" : Math.round(result.avgResponseTimeMs()) + "ms";
            if (result.workingModels().isEmpty()) {
                LOG.info("[{}/{}] 0/{} | {} | ${} | skip", provider.name(), group.name(), candidates.size(), latency, format(cost));
                if (tokenManager.deleteToken(tokens.tokenNames().get(group.name()))) {
                    deleted++;
                }
                continue;
            }
            if (!result.failedModels().isEmpty()) {
                LOG.info("[{}/{}] Failed: {}", provider.name(), group.name(), String.join(", ", result.failedModels()));
            }
            int priority = RoutingWeights.priority(result.avgResponseTimeMs());
            LOG.info("[{}/{}] {}/{} | {} -> +{} | ${}", provider.name(), group.name(), result.workingModels().size(),
                candidates.size(), latency, priority, format(cost));
            probed.add(new ProbedGroup(group, result));
        }
        tokenCounts = tokenCounts.plusDeleted(deleted);
        if (totalProbeCost > 0) {
            LOG.info("[{}] Total probe cost: ${}", provider.name(), format(totalProbeCost));
        }
    }

    @Override
    public ProviderReport materialize(AggregationState state) {
        SyncConfig config = context.config();
        Set<String> takenNames = new HashSet<>();
        for (ProbedGroup entry : probed) {
            GroupInfo group = entry.group();
            String baseName = ResourceNames.channelName(group.name(), provider.name(), takenNames);
            takenNames.add(baseName);
            int priority = RoutingWeights.priority(entry.result().avgResponseTimeMs());
            int weight = RoutingWeights.weight(priority);

            List<PriceTiers.Tier> tiers = PriceTiers.split(
                entry.result().workingModels(),
                model -> PriceTiers.effectiveRatio(group.ratio(), provider.priceAdjustment(), model)
            );
            for (int i = 0; i < tiers.size(); i++) {
                PriceTiers.Tier tier = tiers.get(i);
                String tierName = PriceTiers.tierName(baseName, i, tiers.size());
                state.addGroup(new MergedGroup(
                    tierName,
                    tier.ratio(),
                    ResourceNames.sanitize(group.name()) + " via " + provider.name(),
                    provider.name()
                ));
                state.addChannel(new ChannelSpec(
                    tierName,
                    VendorCatalog.channelTypeFor(tier.models(), state.modelEndpoints()),
                    tokens.tokens().get(group.name()),
                    provider.baseUrl(),
                    tier.models(),
                    tierName,
                    priority,
                    weight,
                    provider.name(),
                    group.name() + "-" + provider.name()
                ));
            }
        }

        for (ModelInfo model : pricing.models()) {
            state.mergeCheapest(config.mapModel(model.name()), new MergedModel(
                model.ratio(),
                model.completionRatio(),
                model.fixedPrice() ? model.modelPrice() : null
            ));
        }
        return ProviderReport.succeeded(provider.name(), groups.size(), pricing.models().size(), tokenCounts);
    }

    private void logSuggestedGroups() {
        if (provider.enabledGroups().isEmpty()) {
            return;
        }
        Set<String> claudeModels = pricing.models().stream()
            .filter(model -> model.name().toLowerCase(Locale.ROOT).contains("claude")
                || Objects.equals(model.vendorId(), ANTHROPIC_VENDOR_ID))
            .map(ModelInfo::name)
            .collect(Collectors.toSet());
        List<String> suggested = pricing.groups().stream()
            .filter(group -> !provider.enabledGroups().contains(group.name()))
            .filter(group -> group.models().stream().anyMatch(claudeModels::contains))
            .map(GroupInfo::name)
            .toList();
        if (!suggested.isEmpty()) {
            LOG.info("[{}] Groups with Claude models (not in config): {}", provider.name(), String.join(", ", suggested));
        }
    }

    private static String format(double dollars) {
        return String.format(Locale.ROOT, "%.4f", dollars);
    }

    private record ProbedGroup(GroupInfo group, ModelTestResult result) {
    }
}

package io.gatesync.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.catalog.EndpointTypes;
import io.gatesync.core.catalog.VendorCatalog;
import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.provider.AggregationState;
import io.gatesync.core.provider.ChannelSpec;
import io.gatesync.core.provider.MergedGroup;
import io.gatesync.core.provider.MergedModel;
import io.gatesync.core.provider.ProviderAdapter;
import io.gatesync.core.provider.ProviderReport;
import io.gatesync.core.target.Channel;
import io.gatesync.core.target.ManagedOptions;
import io.gatesync.core.upstream.EndpointInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs provider adapters one at a time over a shared {@link AggregationState} and folds the
 * result into a {@link DesiredState}.
 */
public final class AggregationPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(AggregationPipeline.class);

    private final SyncConfig config;
    private final ObjectMapper mapper;

    public AggregationPipeline(SyncConfig config, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public PipelineResult run(List<ProviderAdapter> adapters) {
        AggregationState state = new AggregationState();
        List<ProviderReport> reports = new ArrayList<>();
        List<ProviderAdapter> ordered = adapters.stream()
            .sorted(Comparator.comparing(ProviderAdapter::kind))
            .toList();
        for (ProviderAdapter adapter : ordered) {
            LOG.info("[{}] Processing {} provider", adapter.name(), adapter.kind().name().toLowerCase());
            reports.add(adapter.run(state));
        }
        return new PipelineResult(buildDesired(state), reports);
    }

    DesiredState buildDesired(AggregationState state) {
        Map<String, Channel> channelsByName = new LinkedHashMap<>();
        for (ChannelSpec spec : state.channels()) {
            channelsByName.remove(spec.name());
            channelsByName.put(spec.name(), toChannel(spec));
        }
        List<Channel> channels = new ArrayList<>(channelsByName.values());

        return new DesiredState(
            channels,
            desiredModels(channels, state),
            options(state),
            config.providers().stream().map(ProviderConfig::name).collect(Collectors.toCollection(LinkedHashSet::new)),
            mappingSources()
        );
    }

    private ManagedOptionMaps options(AggregationState state) {
        Map<String, Double> groupRatio = new LinkedHashMap<>();
        Map<String, String> userUsableGroups = new LinkedHashMap<>();
        userUsableGroups.put(ManagedOptions.AUTO_GROUP, ManagedOptions.AUTO_GROUP_LABEL);
        for (MergedGroup group : state.groups()) {
            groupRatio.put(group.name(), round4(group.ratio()));
            userUsableGroups.put(group.name(), group.description());
        }
        List<String> autoGroups = state.groups().stream()
            .sorted(Comparator.comparingDouble(MergedGroup::ratio))
            .map(MergedGroup::name)
            .distinct()
            .toList();

        Map<String, Double> modelRatio = new LinkedHashMap<>();
        Map<String, Double> completionRatio = new LinkedHashMap<>();
        Map<String, Double> modelPrice = new LinkedHashMap<>();
        for (Map.Entry<String, MergedModel> entry : state.models().entrySet()) {
            MergedModel model = entry.getValue();
            if (model.fixedPrice()) {
                modelPrice.put(entry.getKey(), round4(model.modelPrice()));
            } else {
                modelRatio.put(entry.getKey(), round4(model.ratio()));
                completionRatio.put(entry.getKey(), round4(model.completionRatio()));
            }
        }
        return new ManagedOptionMaps(groupRatio, userUsableGroups, autoGroups, modelRatio, completionRatio, modelPrice, true);
    }

    private Map<String, DesiredModel> desiredModels(List<Channel> channels, AggregationState state) {
        Map<String, String> reverseMapping = new HashMap<>();
        config.modelMapping().forEach((original, mapped) -> reverseMapping.putIfAbsent(mapped, original));

        Map<String, DesiredModel> models = new LinkedHashMap<>();
        for (Channel channel : channels) {
            for (String modelName : channel.modelList()) {
                List<String> endpoints = state.modelEndpoints().get(modelName);
                if (endpoints == null && reverseMapping.containsKey(modelName)) {
                    endpoints = state.modelEndpoints().get(reverseMapping.get(modelName));
                }
                models.put(modelName, new DesiredModel(
                    modelName,
                    VendorCatalog.vendorOf(modelName).orElse(null),
                    endpointsJson(endpoints, state.endpointPaths())
                ));
            }
        }
        return models;
    }

    private String endpointsJson(List<String> endpoints, Map<String, EndpointInfo> paths) {
        if (endpoints == null || endpoints.isEmpty()) {
            return null;
        }
        Map<String, String> byType = new LinkedHashMap<>();
        for (String original : endpoints) {
            String normalized = EndpointTypes.normalize(original);
            EndpointInfo info = paths.get(original);
            String path = info != null && info.path() != null ? info.path() : EndpointTypes.DEFAULT_PATHS.get(normalized);
            if (path != null) {
                byType.put(normalized, path);
            }
        }
        if (byType.isEmpty()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(byType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize endpoint map", e);
        }
    }

    private Set<String> mappingSources() {
        Set<String> sources = new LinkedHashSet<>();
        config.modelMapping().forEach((original, mapped) -> {
            if (!original.equals(mapped)) {
                sources.add(original);
            }
        });
        return sources;
    }

    private static Channel toChannel(ChannelSpec spec) {
        return new Channel(
            null,
            spec.name(),
            spec.type(),
            spec.key(),
            spec.baseUrl(),
            String.join(",", spec.models()),
            spec.group(),
            spec.priority(),
            spec.weight(),
            Channel.STATUS_ENABLED,
            spec.provider(),
            spec.remark(),
            null
        );
    }

    static double round4(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}

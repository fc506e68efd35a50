package io.gatesync.core.provider;

import io.gatesync.core.upstream.EndpointInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything providers have contributed so far in one run. Owned by the pipeline and handed to
 * one adapter at a time, so later providers can price relative to earlier ones.
 */
public final class AggregationState {
    private final List<MergedGroup> groups = new ArrayList<>();
    private final Map<String, MergedModel> models = new LinkedHashMap<>();
    private final Map<String, List<String>> modelEndpoints = new HashMap<>();
    private final Map<String, EndpointInfo> endpointPaths = new HashMap<>();
    private final List<ChannelSpec> channels = new ArrayList<>();

    public void addGroup(MergedGroup group) {
        groups.add(group);
    }

    public void addChannel(ChannelSpec channel) {
        channels.add(channel);
    }

    /**
     * Keeps the lower ratio when the model is already known.
     */
    public void mergeCheapest(String modelName, MergedModel model) {
        MergedModel existing = models.get(modelName);
        if (existing == null || model.ratio() < existing.ratio()) {
            models.put(modelName, model);
        }
    }

    public void putModelIfAbsent(String modelName, MergedModel model) {
        models.putIfAbsent(modelName, model);
    }

    public Optional<MergedModel> model(String modelName) {
        return Optional.ofNullable(models.get(modelName));
    }

    public void recordEndpoints(String modelName, List<String> endpoints) {
        if (endpoints != null && !endpoints.isEmpty()) {
            modelEndpoints.put(modelName, List.copyOf(endpoints));
        }
    }

    public void recordEndpointPaths(Map<String, EndpointInfo> paths) {
        endpointPaths.putAll(paths);
    }

    /**
     * Cheapest ratio of any group, owned by another provider, whose channel already serves the
     * model.
     */
    public OptionalDouble cheapestGroupRatio(String modelName, String excludeProvider) {
        Map<String, Double> ratioByGroup = new HashMap<>();
        groups.forEach(group -> ratioByGroup.put(group.name(), group.ratio()));
        return channels.stream()
            .filter(channel -> !channel.provider().equals(excludeProvider))
            .filter(channel -> channel.models().contains(modelName))
            .mapToDouble(channel -> ratioByGroup.getOrDefault(channel.group(), 1.0))
            .min();
    }

    public List<MergedGroup> groups() {
        return Collections.unmodifiableList(groups);
    }

    public Map<String, MergedModel> models() {
        return Collections.unmodifiableMap(models);
    }

    public Map<String, List<String>> modelEndpoints() {
        return Collections.unmodifiableMap(modelEndpoints);
    }

    public Map<String, EndpointInfo> endpointPaths() {
        return Collections.unmodifiableMap(endpointPaths);
    }

    public List<ChannelSpec> channels() {
        return Collections.unmodifiableList(channels);
    }
}

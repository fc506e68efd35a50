package io.gatesync.core.upstream;

import java.util.List;
import java.util.Map;

public record UpstreamPricing(
    PricingShape shape,
    List<GroupInfo> groups,
    List<ModelInfo> models,
    Map<String, Double> groupRatios,
    Map<String, Double> modelRatios,
    Map<String, Double> completionRatios,
    Map<Integer, String> vendorIdToName,
    Map<String, EndpointInfo> endpointPaths
) {
    public UpstreamPricing {
        groups = List.copyOf(groups);
        models = List.copyOf(models);
        groupRatios = Map.copyOf(groupRatios);
        modelRatios = Map.copyOf(modelRatios);
        completionRatios = Map.copyOf(completionRatios);
        vendorIdToName = Map.copyOf(vendorIdToName);
        endpointPaths = Map.copyOf(endpointPaths);
    }

    public enum PricingShape {
        /** {@code data} is an array of models carrying flat ratios. */
        FLAT,
        /** {@code data} is an object keyed by group with nested per-model prices. */
        GROUPED
    }
}

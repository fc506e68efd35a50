package io.gatesync.core.upstream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.catalog.ChannelTypes;
import io.gatesync.core.catalog.EndpointTypes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code {"data": [{model_name, model_ratio, completion_ratio, enable_groups, ...}],
 * "group_ratio": {...}, "usable_group": {...}, "vendors": [...], "supported_endpoint": {...}}}
 */
final class FlatPricingParser implements PricingParser {
    private final ObjectMapper mapper;

    FlatPricingParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public boolean supports(JsonNode root) {
        return root.path("data").isArray();
    }

    @Override
    public UpstreamPricing parse(JsonNode root) {
        Map<String, Set<String>> groupModels = new LinkedHashMap<>();
        Map<String, Set<String>> groupEndpoints = new LinkedHashMap<>();
        List<ModelInfo> models = new ArrayList<>();
        Map<String, Double> modelRatios = new LinkedHashMap<>();
        Map<String, Double> completionRatios = new LinkedHashMap<>();

        for (JsonNode row : root.path("data")) {
            String name = row.path("model_name").asText("");
            if (name.isBlank()) {
                continue;
            }
            List<String> groups = strings(row.path("enable_groups"));
            List<String> endpoints = strings(row.path("supported_endpoint_types"));
            for (String group : groups) {
                groupModels.computeIfAbsent(group, ignored -> new LinkedHashSet<>()).add(name);
                groupEndpoints.computeIfAbsent(group, ignored -> new LinkedHashSet<>())
                    .addAll(endpoints.stream().map(EndpointTypes::normalize).toList());
            }
            double ratio = row.path("model_ratio").asDouble(0);
            double completion = row.path("completion_ratio").asDouble(0);
            double price = row.path("model_price").asDouble(0);
            boolean fixed = row.path("quota_type").asInt(0) == 1 && price > 0;
            models.add(new ModelInfo(
                name,
                ratio,
                completion,
                groups,
                row.hasNonNull("vendor_id") ? row.path("vendor_id").asInt() : null,
                endpoints,
                fixed ? price : null
            ));
            if (ratio > 0) {
                modelRatios.put(name, ratio);
            }
            if (completion > 0) {
                completionRatios.put(name, completion);
            }
        }

        Map<String, Double> groupRatios = new LinkedHashMap<>();
        root.path("group_ratio").fields().forEachRemaining(e -> groupRatios.put(e.getKey(), e.getValue().asDouble(1)));

        List<GroupInfo> groups = new ArrayList<>();
        root.path("usable_group").fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            if (name.isEmpty()) {
                return;
            }
            groups.add(new GroupInfo(
                name,
                entry.getValue().asText(name),
                groupRatios.getOrDefault(name, 1.0),
                new ArrayList<>(groupModels.getOrDefault(name, Set.of())),
                ChannelTypes.fromEndpoints(groupEndpoints.getOrDefault(name, Set.of()))
            ));
        });

        Map<Integer, String> vendors = new LinkedHashMap<>();
        for (JsonNode vendor : root.path("vendors")) {
            vendors.put(vendor.path("id").asInt(), vendor.path("name").asText(""));
        }

        return new UpstreamPricing(
            UpstreamPricing.PricingShape.FLAT,
            groups,
            models,
            groupRatios,
            modelRatios,
            completionRatios,
            vendors,
            endpointPaths(root.path("supported_endpoint"))
        );
    }

    private Map<String, EndpointInfo> endpointPaths(JsonNode node) {
        if (!node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, new TypeReference<LinkedHashMap<String, EndpointInfo>>() {
        });
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String value = item.asText("");
            if (!value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }
}

package io.gatesync.core.upstream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.catalog.ChannelTypes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code {"data": {"model_group": {group: {DisplayName, GroupRatio, ModelPrice: {model: {price}}}},
 * "model_completion_ratio": {...}}}}. This shape carries no endpoint kinds, so groups default
 * to the OpenAI channel type.
 */
final class GroupedPricingParser implements PricingParser {
    private final ObjectMapper mapper;

    GroupedPricingParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public boolean supports(JsonNode root) {
        JsonNode data = root.path("data");
        return data.isObject() && data.path("model_group").isObject();
    }

    @Override
    public UpstreamPricing parse(JsonNode root) {
        JsonNode data = root.path("data");
        Map<String, Double> completionRatios = new LinkedHashMap<>();
        data.path("model_completion_ratio").fields()
            .forEachRemaining(e -> completionRatios.put(e.getKey(), e.getValue().asDouble(1)));

        Map<String, Double> groupRatios = new LinkedHashMap<>();
        Map<String, Double> modelRatios = new LinkedHashMap<>();
        Map<String, List<String>> modelGroups = new LinkedHashMap<>();
        Map<String, Double> firstPrice = new LinkedHashMap<>();
        List<GroupInfo> groups = new ArrayList<>();

        data.path("model_group").fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            if (name.isEmpty()) {
                return;
            }
            JsonNode group = entry.getValue();
            double ratio = group.path("GroupRatio").asDouble(1);
            groupRatios.put(name, ratio);
            List<String> modelNames = new ArrayList<>();
            group.path("ModelPrice").fields().forEachRemaining(price -> {
                String model = price.getKey();
                double value = price.getValue().path("price").asDouble(0);
                modelNames.add(model);
                modelGroups.computeIfAbsent(model, ignored -> new ArrayList<>()).add(name);
                firstPrice.putIfAbsent(model, value);
                if (value > 0) {
                    modelRatios.putIfAbsent(model, value);
                }
            });
            String display = group.path("DisplayName").asText("");
            groups.add(new GroupInfo(name, display.isBlank() ? name : display, ratio, modelNames, ChannelTypes.OPENAI));
        });

        List<ModelInfo> models = new ArrayList<>();
        modelGroups.forEach((model, memberOf) -> {
            double price = firstPrice.getOrDefault(model, 0.0);
            models.add(new ModelInfo(
                model,
                price > 0 ? price : 1.0,
                completionRatios.getOrDefault(model, 1.0),
                memberOf,
                null,
                List.of(),
                null
            ));
        });

        Map<String, EndpointInfo> endpointPaths = root.path("supported_endpoint").isObject()
            ? mapper.convertValue(root.path("supported_endpoint"), new TypeReference<LinkedHashMap<String, EndpointInfo>>() {
            })
            : Map.of();

        return new UpstreamPricing(
            UpstreamPricing.PricingShape.GROUPED,
            groups,
            models,
            groupRatios,
            modelRatios,
            completionRatios,
            Map.of(),
            endpointPaths
        );
    }
}

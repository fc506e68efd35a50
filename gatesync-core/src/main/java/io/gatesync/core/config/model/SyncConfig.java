package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncConfig(
    TargetConfig target,
    List<ProviderConfig> providers,
    List<String> blacklist,
    @JsonAlias("model_mapping") Map<String, String> modelMapping,
    SyncSettings settings
) {
    public SyncConfig {
        providers = providers == null ? List.of() : List.copyOf(providers);
        blacklist = blacklist == null ? List.of() : List.copyOf(blacklist);
        modelMapping = modelMapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(modelMapping));
        settings = settings == null ? SyncSettings.defaults() : settings;
    }

    public SyncConfig withProviders(List<ProviderConfig> selected) {
        return new SyncConfig(target, selected, blacklist, modelMapping, settings);
    }

    public String mapModel(String modelName) {
        return modelMapping.getOrDefault(modelName, modelName);
    }
}

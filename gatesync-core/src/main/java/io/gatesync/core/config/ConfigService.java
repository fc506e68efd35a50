package io.gatesync.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        this(JsonSupport.newMapper());
    }

    public ConfigService(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public SyncConfig load(Path configPath) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigException("Config file not found: " + configPath);
        }
        String raw;
        try {
            raw = Files.readString(configPath);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + configPath + ": " + e.getMessage(), e);
        }
        return parse(raw, configPath.toString());
    }

    public SyncConfig parse(String json, String source) {
        SyncConfig config;
        try {
            config = mapper.readValue(json, SyncConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid config " + source + ": " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Invalid config " + source + ": document is empty");
        }
        List<String> issues = ConfigValidator.validate(config);
        if (!issues.isEmpty()) {
            throw new ConfigException("Invalid config " + source + ":", issues);
        }
        return config;
    }

    /**
     * Restricts the config to the named providers. The restricted set is also the set of
     * providers whose target resources a run may delete.
     */
    public static SyncConfig applyOnly(SyncConfig config, Collection<String> only) {
        Set<String> requested = normalizeOnly(only);
        if (requested.isEmpty()) {
            return config;
        }
        Set<String> available = config.providers().stream()
            .map(ProviderConfig::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> unknown = requested.stream().filter(name -> !available.contains(name)).toList();
        if (!unknown.isEmpty()) {
            throw new ConfigException("Unknown provider(s) in --only: " + String.join(", ", unknown)
                + ". Available: " + String.join(", ", available));
        }
        return config.withProviders(config.providers().stream()
            .filter(provider -> requested.contains(provider.name()))
            .toList());
    }

    private static Set<String> normalizeOnly(Collection<String> only) {
        Set<String> names = new LinkedHashSet<>();
        if (only == null) {
            return names;
        }
        for (String value : only) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    names.add(part.trim());
                }
            }
        }
        return names;
    }
}

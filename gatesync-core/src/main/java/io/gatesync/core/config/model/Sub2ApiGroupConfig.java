package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Sub2ApiGroupConfig(String key, String platform, String name) {
}

package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetConfig(
    @JsonAlias("base_url") String baseUrl,
    @JsonAlias("system_access_token") String systemAccessToken,
    @JsonAlias("user_id") long userId
) {
}

package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.gatesync.core.pricing.PriceAdjustment;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NewApiProviderConfig(
    String name,
    @JsonAlias("base_url") String baseUrl,
    @JsonAlias("system_access_token") String systemAccessToken,
    @JsonAlias("user_id") long userId,
    @JsonAlias("enabled_groups") List<String> enabledGroups,
    @JsonAlias("enabled_vendors") List<String> enabledVendors,
    @JsonAlias("enabled_models") List<String> enabledModels,
    @JsonAlias("price_adjustment") PriceAdjustment priceAdjustment
) implements ProviderConfig {
    public NewApiProviderConfig {
        enabledGroups = enabledGroups == null ? List.of() : List.copyOf(enabledGroups);
        enabledVendors = enabledVendors == null ? List.of() : List.copyOf(enabledVendors);
        enabledModels = enabledModels == null ? List.of() : List.copyOf(enabledModels);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.NEWAPI;
    }
}

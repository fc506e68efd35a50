package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.gatesync.core.pricing.PriceAdjustment;
import java.util.List;

/**
 * A vendor API key used without any intermediate gateway. {@code baseUrl} falls back to the
 * vendor's default endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectProviderConfig(
    String name,
    String vendor,
    @JsonAlias("api_key") String apiKey,
    @JsonAlias("base_url") String baseUrl,
    @JsonAlias("group_ratio") Double groupRatio,
    @JsonAlias("enabled_models") List<String> enabledModels,
    @JsonAlias("price_adjustment") PriceAdjustment priceAdjustment
) implements ProviderConfig {
    public DirectProviderConfig {
        enabledModels = enabledModels == null ? List.of() : List.copyOf(enabledModels);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.DIRECT;
    }
}

package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.gatesync.core.pricing.PriceAdjustment;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Sub2ApiProviderConfig(
    String name,
    @JsonAlias("base_url") String baseUrl,
    @JsonAlias("admin_api_key") String adminApiKey,
    List<Sub2ApiGroupConfig> groups,
    @JsonAlias("enabled_vendors") List<String> enabledVendors,
    @JsonAlias("enabled_models") List<String> enabledModels,
    @JsonAlias("price_discount") Double priceDiscount,
    @JsonAlias("price_adjustment") PriceAdjustment priceAdjustment
) implements ProviderConfig {
    public static final double DEFAULT_DISCOUNT = 0.1;

    public Sub2ApiProviderConfig {
        groups = groups == null ? List.of() : List.copyOf(groups);
        enabledVendors = enabledVendors == null ? List.of() : List.copyOf(enabledVendors);
        enabledModels = enabledModels == null ? List.of() : List.copyOf(enabledModels);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.SUB2API;
    }

    /**
     * Adjustment applied on top of the cheapest known ratio: an explicit {@code priceAdjustment}
     * wins, otherwise the discount expressed as a negative adjustment.
     */
    public PriceAdjustment effectiveAdjustment() {
        if (priceAdjustment != null) {
            return priceAdjustment;
        }
        double discount = priceDiscount == null ? DEFAULT_DISCOUNT : priceDiscount;
        return new PriceAdjustment.Flat(-discount);
    }

    public boolean hasAdminKey() {
        return adminApiKey != null && !adminApiKey.isBlank();
    }
}

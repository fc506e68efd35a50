package io.gatesync.core.config;

import io.gatesync.core.catalog.ResourceNames;
import io.gatesync.core.catalog.VendorCatalog;
import io.gatesync.core.config.model.DirectProviderConfig;
import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.Sub2ApiGroupConfig;
import io.gatesync.core.config.model.Sub2ApiProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.config.model.TargetConfig;
import io.gatesync.core.pricing.PriceAdjustment;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects every problem in a parsed config as {@code path: message} lines.
 */
final class ConfigValidator {

    private ConfigValidator() {
    }

    static List<String> validate(SyncConfig config) {
        List<String> issues = new ArrayList<>();
        validateTarget(config.target(), issues);

        if (config.providers().isEmpty()) {
            issues.add("providers: must contain at least one provider");
        }
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < config.providers().size(); i++) {
            String path = "providers[" + i + "]";
            ProviderConfig provider = config.providers().get(i);
            if (provider == null) {
                issues.add(path + ": must not be null");
                continue;
            }
            if (blank(provider.name())) {
                issues.add(path + ".name: is required");
            } else if (!names.add(provider.name())) {
                issues.add(path + ".name: duplicate provider name \"" + provider.name() + "\"");
            } else if (provider.name().length() > ResourceNames.PROVIDER_NAME_MAX) {
                issues.add(path + ".name: must be at most " + ResourceNames.PROVIDER_NAME_MAX + " characters");
            }
            validateAdjustment(path + ".priceAdjustment", provider.priceAdjustment(), issues);
            if (provider instanceof NewApiProviderConfig newApi) {
                validateNewApi(path, newApi, issues);
            } else if (provider instanceof DirectProviderConfig direct) {
                validateDirect(path, direct, issues);
            } else if (provider instanceof Sub2ApiProviderConfig sub2api) {
                validateSub2Api(path, sub2api, issues);
            }
        }

        // Tokens are owned by name suffix, so "acme" would claim the tokens of "my-acme".
        for (String name : names) {
            for (String other : names) {
                if (!name.equals(other) && other.endsWith(ResourceNames.tokenSuffix(name))) {
                    issues.add("providers: name \"" + other + "\" ends with \"-" + name + "\" and would share its tokens");
                }
            }
        }

        config.modelMapping().forEach((from, to) -> {
            if (blank(to)) {
                issues.add("modelMapping." + from + ": mapped name must not be blank");
            }
        });
        return issues;
    }

    private static void validateTarget(TargetConfig target, List<String> issues) {
        if (target == null) {
            issues.add("target: is required");
            return;
        }
        if (blank(target.baseUrl())) {
            issues.add("target.baseUrl: is required");
        }
        if (blank(target.systemAccessToken())) {
            issues.add("target.systemAccessToken: is required");
        }
        if (target.userId() <= 0) {
            issues.add("target.userId: must be a positive integer");
        }
    }

    private static void validateNewApi(String path, NewApiProviderConfig provider, List<String> issues) {
        if (blank(provider.baseUrl())) {
            issues.add(path + ".baseUrl: is required");
        }
        if (blank(provider.systemAccessToken())) {
            issues.add(path + ".systemAccessToken: is required");
        }
        if (provider.userId() <= 0) {
            issues.add(path + ".userId: must be a positive integer");
        }
    }

    private static void validateDirect(String path, DirectProviderConfig provider, List<String> issues) {
        if (blank(provider.vendor())) {
            issues.add(path + ".vendor: is required");
        } else if (!VendorCatalog.isKnown(provider.vendor())) {
            issues.add(path + ".vendor: unknown vendor \"" + provider.vendor() + "\"");
        }
        if (blank(provider.apiKey())) {
            issues.add(path + ".apiKey: is required");
        }
        if (provider.groupRatio() != null && provider.priceAdjustment() != null) {
            issues.add(path + ": groupRatio and priceAdjustment are mutually exclusive");
        }
        if (provider.groupRatio() != null && provider.groupRatio() <= 0) {
            issues.add(path + ".groupRatio: must be positive");
        }
    }

    private static void validateSub2Api(String path, Sub2ApiProviderConfig provider, List<String> issues) {
        if (blank(provider.baseUrl())) {
            issues.add(path + ".baseUrl: is required");
        }
        if (!provider.hasAdminKey() && provider.groups().isEmpty()) {
            issues.add(path + ": either adminApiKey or groups is required");
        }
        for (int i = 0; i < provider.groups().size(); i++) {
            Sub2ApiGroupConfig group = provider.groups().get(i);
            if (group == null || blank(group.key())) {
                issues.add(path + ".groups[" + i + "].key: is required");
            }
            if (group == null || blank(group.platform())) {
                issues.add(path + ".groups[" + i + "].platform: is required");
            }
        }
        Double discount = provider.priceDiscount();
        if (discount != null && (discount < 0 || discount >= 1)) {
            issues.add(path + ".priceDiscount: must be >= 0 and < 1");
        }
    }

    private static void validateAdjustment(String path, PriceAdjustment adjustment, List<String> issues) {
        if (adjustment == null) {
            return;
        }
        if (adjustment instanceof PriceAdjustment.PerKey perKey && !perKey.entries().containsKey(PriceAdjustment.DEFAULT_KEY)) {
            issues.add(path + ": must contain a \"default\" key");
        }
        for (double value : adjustment.values()) {
            if (value <= -1 || value >= 1) {
                issues.add(path + ": values must be between -1 and 1 (exclusive), got " + value);
            }
        }
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}

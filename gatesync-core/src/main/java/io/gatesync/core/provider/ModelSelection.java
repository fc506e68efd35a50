package io.gatesync.core.provider;

import io.gatesync.core.catalog.ModelClassifier;
import io.gatesync.core.catalog.ModelPatterns;
import io.gatesync.core.catalog.VendorCatalog;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Model filters shared by the adapters: text capability, blacklist, vendor and model allow-lists,
 * then renaming with duplicates removed.
 */
final class ModelSelection {
    private final String provider;
    private final List<String> blacklist;
    private final Set<String> enabledVendors;
    private final List<String> enabledModels;

    ModelSelection(String provider, List<String> blacklist, Collection<String> enabledVendors, List<String> enabledModels) {
        this.provider = provider;
        this.blacklist = blacklist;
        this.enabledVendors = new LinkedHashSet<>();
        if (enabledVendors != null) {
            enabledVendors.forEach(vendor -> this.enabledVendors.add(vendor.toLowerCase(Locale.ROOT)));
        }
        this.enabledModels = enabledModels == null ? List.of() : enabledModels;
    }

    boolean accepts(String model, Map<String, List<String>> modelEndpoints) {
        if (!ModelClassifier.isTextModel(model, modelEndpoints.get(model))) {
            return false;
        }
        if (ModelPatterns.blacklisted(model, blacklist, provider)) {
            return false;
        }
        if (!enabledVendors.isEmpty()) {
            String vendor = VendorCatalog.vendorOf(model).orElse(null);
            if (vendor == null || !enabledVendors.contains(vendor)) {
                return false;
            }
        }
        return enabledModels.isEmpty() || ModelPatterns.matchesAny(model, enabledModels);
    }

    /**
     * Accepted models renamed by {@code mapping}, de-duplicated in first-seen order.
     */
    List<String> select(Collection<String> models, Map<String, List<String>> modelEndpoints, UnaryOperator<String> mapping) {
        Set<String> selected = new LinkedHashSet<>();
        for (String model : models) {
            if (accepts(model, modelEndpoints)) {
                selected.add(mapping.apply(model));
            }
        }
        return new ArrayList<>(selected);
    }

    boolean hasVendorFilter() {
        return !enabledVendors.isEmpty();
    }

    boolean anyFromEnabledVendor(Collection<String> models) {
        return models.stream()
            .map(model -> VendorCatalog.vendorOf(model).orElse(""))
            .anyMatch(enabledVendors::contains);
    }
}

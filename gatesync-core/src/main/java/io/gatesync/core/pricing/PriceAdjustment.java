package io.gatesync.core.pricing;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.gatesync.core.catalog.ModelClassifier;
import io.gatesync.core.catalog.ModelPatterns;
import io.gatesync.core.catalog.VendorCatalog;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relative price change applied on top of an upstream ratio: the published ratio is
 * {@code base * (1 + adjustment)}. Either one value for every model, or a per-key table.
 */
@JsonDeserialize(using = PriceAdjustmentDeserializer.class)
public interface PriceAdjustment {
    String DEFAULT_KEY = "default";

    PriceAdjustment NONE = new Flat(0.0);

    double resolve(String modelName);

    /**
     * Smallest adjustment this value can produce for any model.
     */
    double minimum();

    Collection<Double> values();

    static PriceAdjustment orNone(PriceAdjustment adjustment) {
        return adjustment == null ? NONE : adjustment;
    }

    static double multiplier(double adjustment) {
        return 1.0 + adjustment;
    }

    record Flat(double value) implements PriceAdjustment {

        @Override
        public double resolve(String modelName) {
            return value;
        }

        @Override
        public double minimum() {
            return value;
        }

        @Override
        public Collection<Double> values() {
            return List.of(value);
        }

        @JsonValue
        public double json() {
            return value;
        }
    }

    /**
     * Lookup order: a key that matches the model name (exact or glob), the model's vendor,
     * the model type ({@code chat} or {@code reasoning}), then {@code default}.
     */
    record PerKey(Map<String, Double> entries) implements PriceAdjustment {

        public PerKey {
            Map<String, Double> normalized = new LinkedHashMap<>();
            if (entries != null) {
                entries.forEach((key, value) -> normalized.put(key.toLowerCase(), value));
            }
            entries = Collections.unmodifiableMap(normalized);
        }

        public double defaultValue() {
            return entries.getOrDefault(DEFAULT_KEY, 0.0);
        }

        @Override
        public double resolve(String modelName) {
            String name = modelName == null ? "" : modelName.toLowerCase();
            Double exact = entries.get(name);
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<String, Double> entry : entries.entrySet()) {
                String key = entry.getKey();
                if ((key.indexOf('*') >= 0 || key.indexOf('?') >= 0) && ModelPatterns.matchesGlob(name, key)) {
                    return entry.getValue();
                }
            }
            String vendor = VendorCatalog.vendorOf(name).orElse(null);
            if (vendor != null && entries.containsKey(vendor)) {
                return entries.get(vendor);
            }
            String type = ModelClassifier.modelType(name);
            if (entries.containsKey(type)) {
                return entries.get(type);
            }
            return defaultValue();
        }

        @Override
        public double minimum() {
            return entries.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        }

        @Override
        public Collection<Double> values() {
            return entries.values();
        }

        @JsonValue
        public Map<String, Double> json() {
            return entries;
        }
    }
}

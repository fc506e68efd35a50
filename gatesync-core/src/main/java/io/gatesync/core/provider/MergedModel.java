package io.gatesync.core.provider;

/**
 * Aggregated price of one model. A positive {@code modelPrice} means per-request pricing.
 */
public record MergedModel(double ratio, double completionRatio, Double modelPrice) {

    public static MergedModel ratios(double ratio, double completionRatio) {
        return new MergedModel(ratio, completionRatio, null);
    }

    public boolean fixedPrice() {
        return modelPrice != null && modelPrice > 0;
    }
}

package io.gatesync.core.pricing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Splits a model set into price tiers, one per distinct effective ratio.
 */
public final class PriceTiers {
    /** Published ratios never exceed the reference cost. */
    public static final double MAX_RATIO = 1.0;
    private static final double PRECISION = 1e6;

    private PriceTiers() {
    }

    /**
     * Groups models by {@code ratioOf(model)} rounded to six decimals, in first-seen order.
     * Tiers above {@link #MAX_RATIO} are dropped.
     */
    public static List<Tier> split(List<String> models, ToDoubleFunction<String> ratioOf) {
        Map<Double, List<String>> byRatio = new LinkedHashMap<>();
        for (String model : models) {
            double ratio = round(ratioOf.applyAsDouble(model));
            byRatio.computeIfAbsent(ratio, ignored -> new ArrayList<>()).add(model);
        }
        List<Tier> tiers = new ArrayList<>();
        byRatio.forEach((ratio, members) -> {
            if (publishable(ratio)) {
                tiers.add(new Tier(ratio, members));
            }
        });
        return tiers;
    }

    /**
     * Effective ratio of one model within a group: {@code base * (1 + adjustment(model))}.
     */
    public static double effectiveRatio(double base, PriceAdjustment adjustment, String model) {
        return base * PriceAdjustment.multiplier(PriceAdjustment.orNone(adjustment).resolve(model));
    }

    public static boolean publishable(double ratio) {
        return ratio <= MAX_RATIO;
    }

    /**
     * {@code base} alone when there is one tier, {@code base-t<index>} otherwise.
     */
    public static String tierName(String base, int index, int tierCount) {
        return tierCount > 1 ? base + "-t" + index : base;
    }

    static double round(double value) {
        return Math.round(value * PRECISION) / PRECISION;
    }

    public record Tier(double ratio, List<String> models) {
        public Tier {
            models = List.copyOf(models);
        }
    }
}

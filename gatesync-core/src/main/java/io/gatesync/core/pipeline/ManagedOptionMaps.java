package io.gatesync.core.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured form of the managed option values this run wants on the target.
 */
public record ManagedOptionMaps(
    Map<String, Double> groupRatio,
    Map<String, String> userUsableGroups,
    List<String> autoGroups,
    Map<String, Double> modelRatio,
    Map<String, Double> completionRatio,
    Map<String, Double> modelPrice,
    boolean defaultUseAutoGroup
) {
    public ManagedOptionMaps {
        groupRatio = sorted(groupRatio);
        userUsableGroups = sorted(userUsableGroups);
        autoGroups = List.copyOf(autoGroups);
        modelRatio = sorted(modelRatio);
        completionRatio = sorted(completionRatio);
        modelPrice = sorted(modelPrice);
    }

    public static ManagedOptionMaps empty() {
        return new ManagedOptionMaps(Map.of(), Map.of(), List.of(), Map.of(), Map.of(), Map.of(), true);
    }

    private static <V> Map<String, V> sorted(Map<String, V> values) {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }
}

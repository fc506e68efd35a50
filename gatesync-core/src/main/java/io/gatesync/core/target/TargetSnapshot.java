package io.gatesync.core.target;

import java.util.List;
import java.util.Map;

/**
 * The target's current state. {@code options} holds the raw stored value per managed key.
 */
public record TargetSnapshot(List<Channel> channels, List<ModelMeta> models, List<Vendor> vendors, Map<String, String> options) {
    public TargetSnapshot {
        channels = List.copyOf(channels);
        models = List.copyOf(models);
        vendors = List.copyOf(vendors);
        options = Map.copyOf(options);
    }

    public static TargetSnapshot empty() {
        return new TargetSnapshot(List.of(), List.of(), List.of(), Map.of());
    }
}

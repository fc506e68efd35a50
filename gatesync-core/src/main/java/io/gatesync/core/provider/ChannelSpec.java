package io.gatesync.core.provider;

import java.util.List;

/**
 * A channel one provider wants on the target. {@code provider} becomes the channel tag.
 */
public record ChannelSpec(
    String name,
    int type,
    String key,
    String baseUrl,
    List<String> models,
    String group,
    int priority,
    int weight,
    String provider,
    String remark
) {
    public ChannelSpec {
        models = List.copyOf(models);
    }
}

package io.gatesync.core.upstream;

import java.util.List;

/**
 * One upstream routing/pricing bucket.
 */
public record GroupInfo(String name, String description, double ratio, List<String> models, int channelType) {
    public GroupInfo {
        description = description == null || description.isBlank() ? name : description;
        models = models == null ? List.of() : List.copyOf(models);
    }
}

package io.gatesync.core.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.gatesync.core.target.Channel;
import io.gatesync.core.target.ModelMeta;
import java.util.List;

/**
 * {@code cleanupOrphans} asks the apply step to purge target models bound to no channel.
 */
public record SyncDiff(
    List<DiffOperation<Channel>> channels,
    List<DiffOperation<ModelMeta>> models,
    List<DiffOperation<String>> options,
    boolean cleanupOrphans
) {
    public SyncDiff {
        channels = List.copyOf(channels);
        models = List.copyOf(models);
        options = List.copyOf(options);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return channels.isEmpty() && models.isEmpty() && options.isEmpty();
    }

    public static long count(List<? extends DiffOperation<?>> operations, DiffOperation.Type type) {
        return operations.stream().filter(operation -> operation.type() == type).count();
    }
}

package io.gatesync.core.sync;

import io.gatesync.core.apply.ApplyError;
import java.util.List;

public record ResetResult(
    int channelsDeleted,
    int modelsDeleted,
    int orphanModelsDeleted,
    int tokensDeleted,
    List<String> optionsUpdated,
    List<ApplyError> errors
) {
    public ResetResult {
        optionsUpdated = List.copyOf(optionsUpdated);
        errors = List.copyOf(errors);
    }

    public boolean success() {
        return errors.isEmpty();
    }
}

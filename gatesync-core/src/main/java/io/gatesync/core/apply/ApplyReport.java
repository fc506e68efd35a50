package io.gatesync.core.apply;

import java.util.List;

/**
 * Outcome of one apply. In dry-run mode the counts are what would have been done.
 */
public record ApplyReport(boolean dryRun, ChannelCounts channels, ModelCounts models, OptionChanges options, List<ApplyError> errors) {
    public ApplyReport {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public record ChannelCounts(int created, int updated, int deleted) {
    }

    public record ModelCounts(int created, int updated, int deleted, int orphansDeleted) {
    }

    public record OptionChanges(List<String> updated) {
        public OptionChanges {
            updated = List.copyOf(updated);
        }
    }
}

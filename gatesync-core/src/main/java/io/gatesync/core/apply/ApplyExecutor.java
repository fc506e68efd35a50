package io.gatesync.core.apply;

import io.gatesync.core.apply.ApplyError.Phase;
import io.gatesync.core.diff.DiffOperation;
import io.gatesync.core.diff.SyncDiff;
import io.gatesync.core.target.Channel;
import io.gatesync.core.target.ModelMeta;
import io.gatesync.core.target.TargetClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a {@link SyncDiff} against the target: options, then channels, then models, then the
 * orphan purge. A failed operation is recorded and the remaining ones still run.
 */
public final class ApplyExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ApplyExecutor.class);
    private static final String ORPHAN_KEY = "orphaned-models";

    private final TargetClient target;

    public ApplyExecutor(TargetClient target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public ApplyReport apply(SyncDiff diff, boolean dryRun) {
        if (dryRun) {
            return preview(diff);
        }
        List<ApplyError> errors = new ArrayList<>();

        List<String> optionsUpdated = new ArrayList<>();
        for (DiffOperation<String> op : diff.options()) {
            if (op.type() == DiffOperation.Type.DELETE) {
                continue;
            }
            if (attempt(errors, Phase.OPTIONS, op.key(), () -> target.updateOption(op.key(), op.value()))) {
                optionsUpdated.add(op.key());
            }
        }

        int[] channelCounts = new int[3];
        for (DiffOperation<Channel> op : diff.channels()) {
            switch (op.type()) {
                case CREATE -> {
                    if (attempt(errors, Phase.CHANNELS, op.key(), () -> target.createChannel(op.value().withId(null)))) {
                        channelCounts[0]++;
                    }
                }
                case UPDATE -> {
                    if (attempt(errors, Phase.CHANNELS, op.key(), () -> target.updateChannel(op.value()))) {
                        channelCounts[1]++;
                    }
                }
                case DELETE -> {
                    Long id = op.existing().id();
                    if (id == null) {
                        errors.add(new ApplyError(Phase.CHANNELS, op.key(), "missing channel id for delete"));
                    } else if (attempt(errors, Phase.CHANNELS, op.key(), () -> target.deleteChannel(id))) {
                        channelCounts[2]++;
                    }
                }
            }
        }

        int[] modelCounts = new int[3];
        for (DiffOperation<ModelMeta> op : diff.models()) {
            switch (op.type()) {
                case CREATE -> {
                    if (attempt(errors, Phase.MODELS, op.key(), () -> target.createModel(op.value()))) {
                        modelCounts[0]++;
                    }
                }
                case UPDATE -> {
                    if (attempt(errors, Phase.MODELS, op.key(), () -> target.updateModel(op.value()))) {
                        modelCounts[1]++;
                    }
                }
                case DELETE -> {
                    Long id = op.existing().id();
                    if (id == null) {
                        errors.add(new ApplyError(Phase.MODELS, op.key(), "missing model id for delete"));
                    } else if (attempt(errors, Phase.MODELS, op.key(), () -> target.deleteModel(id))) {
                        modelCounts[2]++;
                    }
                }
            }
        }

        int orphansDeleted = 0;
        if (diff.cleanupOrphans()) {
            try {
                orphansDeleted = target.cleanupOrphanedModels();
            } catch (RuntimeException e) {
                LOG.warn("[target] Orphan model cleanup failed: {}", e.getMessage());
                errors.add(new ApplyError(Phase.CLEANUP, ORPHAN_KEY, messageOf(e)));
            }
        }

        return new ApplyReport(
            false,
            new ApplyReport.ChannelCounts(channelCounts[0], channelCounts[1], channelCounts[2]),
            new ApplyReport.ModelCounts(modelCounts[0], modelCounts[1], modelCounts[2], orphansDeleted),
            new ApplyReport.OptionChanges(optionsUpdated),
            errors
        );
    }

    private static ApplyReport preview(SyncDiff diff) {
        List<String> options = diff.options().stream()
            .filter(op -> op.type() != DiffOperation.Type.DELETE)
            .map(DiffOperation::key)
            .toList();
        return new ApplyReport(
            true,
            new ApplyReport.ChannelCounts(
                count(diff.channels(), DiffOperation.Type.CREATE),
                count(diff.channels(), DiffOperation.Type.UPDATE),
                count(diff.channels(), DiffOperation.Type.DELETE)),
            new ApplyReport.ModelCounts(
                count(diff.models(), DiffOperation.Type.CREATE),
                count(diff.models(), DiffOperation.Type.UPDATE),
                count(diff.models(), DiffOperation.Type.DELETE),
                0),
            new ApplyReport.OptionChanges(options),
            List.of()
        );
    }

    private static int count(List<? extends DiffOperation<?>> operations, DiffOperation.Type type) {
        return (int) SyncDiff.count(operations, type);
    }

    private static boolean attempt(List<ApplyError> errors, Phase phase, String key, Runnable action) {
        try {
            action.run();
            return true;
        } catch (RuntimeException e) {
            LOG.warn("[target] {} {} failed: {}", phase.json(), key, e.getMessage());
            errors.add(new ApplyError(phase, key, messageOf(e)));
            return false;
        }
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}

package io.gatesync.core.apply;

import static org.assertj.core.api.Assertions.assertThat;

import io.gatesync.core.diff.DiffOperation;
import io.gatesync.core.diff.SyncDiff;
import io.gatesync.core.target.Channel;
import io.gatesync.core.target.InMemoryTargetClient;
import io.gatesync.core.target.ModelMeta;
import java.util.List;
import org.junit.jupiter.api.Test;

class ApplyExecutorTest {

    @Test
    void shouldApplyOptionsThenChannelsThenModelsThenCleanup() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        Channel stale = target.addChannel(channel("stale"));
        SyncDiff diff = new SyncDiff(
            List.of(DiffOperation.create("fresh", channel("fresh")), DiffOperation.delete("stale", stale)),
            List.of(DiffOperation.create("gpt-x", model("gpt-x"))),
            List.of(DiffOperation.create("GroupRatio", "{\"fresh\":0.5}")),
            true
        );

        ApplyReport report = new ApplyExecutor(target).apply(diff, false);

        assertThat(report.dryRun()).isFalse();
        assertThat(report.errors()).isEmpty();
        assertThat(report.channels()).isEqualTo(new ApplyReport.ChannelCounts(1, 0, 1));
        assertThat(report.models().created()).isEqualTo(1);
        assertThat(report.options().updated()).containsExactly("GroupRatio");
        assertThat(target.mutations).containsExactly(
            "option GroupRatio",
            "create-channel fresh",
            "delete-channel " + stale.id(),
            "create-model gpt-x"
        );
        assertThat(target.listChannels()).extracting(Channel::name).containsExactly("fresh");
    }

    @Test
    void shouldRecordFailuresAndKeepGoing() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        target.rejected.add("broken");
        SyncDiff diff = new SyncDiff(
            List.of(
                DiffOperation.create("broken", channel("broken")),
                DiffOperation.create("fine", channel("fine")),
                DiffOperation.delete("no-id", channel("no-id"))
            ),
            List.of(),
            List.of(),
            false
        );

        ApplyReport report = new ApplyExecutor(target).apply(diff, false);

        assertThat(report.channels().created()).isEqualTo(1);
        assertThat(report.errors()).containsExactly(
            new ApplyError(ApplyError.Phase.CHANNELS, "broken", "rejected broken"),
            new ApplyError(ApplyError.Phase.CHANNELS, "no-id", "missing channel id for delete")
        );
        assertThat(report.hasErrors()).isTrue();
    }

    @Test
    void shouldCountOrphansRemovedByCleanup() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        target.addModel(model("lonely"));

        ApplyReport report = new ApplyExecutor(target).apply(new SyncDiff(List.of(), List.of(), List.of(), true), false);

        assertThat(report.models().orphansDeleted()).isEqualTo(1);
        assertThat(target.listModels()).isEmpty();
    }

    @Test
    void shouldOnlyPreviewInDryRun() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        target.addModel(model("lonely"));
        SyncDiff diff = new SyncDiff(
            List.of(DiffOperation.create("fresh", channel("fresh"))),
            List.of(DiffOperation.create("gpt-x", model("gpt-x"))),
            List.of(DiffOperation.update("ModelRatio", "{}", "{\"gpt-x\":1}")),
            true
        );

        ApplyReport report = new ApplyExecutor(target).apply(diff, true);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.channels().created()).isEqualTo(1);
        assertThat(report.models().created()).isEqualTo(1);
        assertThat(report.options().updated()).containsExactly("ModelRatio");
        assertThat(target.mutations).isEmpty();
        assertThat(target.listModels()).hasSize(1);
    }

    private static Channel channel(String name) {
        return new Channel(null, name, 1, "sk-" + name, "https://up.example", "gpt-x", name, 10, 10, 1, "providerA", null, null);
    }

    private static ModelMeta model(String name) {
        return new ModelMeta(null, name, null, null, 1, ModelMeta.OWNED);
    }
}

package io.gatesync.core.sync;

import io.gatesync.core.apply.ApplyReport;
import io.gatesync.core.diff.SyncDiff;
import io.gatesync.core.pipeline.DesiredState;
import io.gatesync.core.provider.ProviderReport;
import java.time.Instant;
import java.util.List;

public record SyncRunResult(
    boolean success,
    Instant startedAt,
    long elapsedMs,
    List<ProviderReport> providers,
    DesiredState desired,
    SyncDiff diff,
    ApplyReport apply
) {
    public SyncRunResult {
        providers = List.copyOf(providers);
    }

    public long succeededProviders() {
        return providers.stream().filter(ProviderReport::success).count();
    }
}

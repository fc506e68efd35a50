package io.gatesync.core.sync;

import io.gatesync.core.apply.ApplyExecutor;
import io.gatesync.core.apply.ApplyReport;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.diff.DiffEngine;
import io.gatesync.core.diff.SyncDiff;
import io.gatesync.core.pipeline.AggregationPipeline;
import io.gatesync.core.pipeline.PipelineResult;
import io.gatesync.core.provider.ProviderAdapter;
import io.gatesync.core.provider.ProviderReport;
import io.gatesync.core.target.SnapshotReader;
import io.gatesync.core.target.TargetClient;
import io.gatesync.core.target.TargetSnapshot;
import io.gatesync.core.upstream.HealthStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One sync run: target health check, provider pipeline, target snapshot, diff and apply.
 */
public final class SyncRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SyncRunner.class);

    private final SyncConfig config;
    private final TargetClient target;
    private final Supplier<List<ProviderAdapter>> adapters;
    private final AggregationPipeline pipeline;
    private final DiffEngine diffEngine = new DiffEngine();
    private final Clock clock;

    public SyncRunner(SyncEnvironment environment) {
        this(
            environment.config(),
            environment.target(),
            () -> environment.adapterFactory().createAll(environment.config().providers()),
            new AggregationPipeline(environment.config(), environment.mapper()),
            Clock.systemUTC()
        );
    }

    SyncRunner(
        SyncConfig config,
        TargetClient target,
        Supplier<List<ProviderAdapter>> adapters,
        AggregationPipeline pipeline,
        Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public SyncRunResult run(boolean dryRun) {
        Instant startedAt = clock.instant();

        HealthStatus health = target.healthCheck();
        if (!health.ok()) {
            throw new SyncAbortedException("Target health check failed: " + (health.error() == null ? "unknown" : health.error()));
        }
        health.balanceValue().ifPresent(balance -> LOG.info("[target] Healthy, balance ${}", String.format("%.2f", balance)));

        PipelineResult pipelineResult = pipeline.run(adapters.get());
        TargetSnapshot snapshot = new SnapshotReader(target).read();
        LOG.info("[target] Snapshot: {} channels, {} models, {} vendors",
            snapshot.channels().size(), snapshot.models().size(), snapshot.vendors().size());

        SyncDiff diff = diffEngine.buildSyncDiff(pipelineResult.desired(), snapshot);
        ApplyReport report = new ApplyExecutor(target).apply(diff, dryRun);

        long succeeded = pipelineResult.providerReports().stream().filter(ProviderReport::success).count();
        boolean providersOk = succeeded > 0 || config.providers().isEmpty();
        long elapsedMs = Duration.between(startedAt, clock.instant()).toMillis();
        return new SyncRunResult(
            providersOk && !report.hasErrors(),
            startedAt,
            elapsedMs,
            pipelineResult.providerReports(),
            pipelineResult.desired(),
            diff,
            report
        );
    }
}

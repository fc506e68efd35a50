package io.gatesync.core.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.ProviderKind;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.config.model.TargetConfig;
import io.gatesync.core.json.JsonSupport;
import io.gatesync.core.pipeline.AggregationPipeline;
import io.gatesync.core.provider.ProviderAdapter;
import io.gatesync.core.provider.StubProviderAdapter;
import io.gatesync.core.target.InMemoryTargetClient;
import io.gatesync.core.upstream.HealthStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SyncRunnerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldSyncAndReachFixedPoint() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        SyncConfig config = config("providerA");
        List<ProviderAdapter> adapters = List.of(new StubProviderAdapter("providerA", ProviderKind.NEWAPI).group("g1", 0.4, "gpt-x"));

        SyncRunResult first = runner(config, target, adapters).run(false);
        SyncRunResult second = runner(config, target, adapters).run(false);

        assertThat(first.success()).isTrue();
        assertThat(first.apply().channels().created()).isEqualTo(1);
        assertThat(first.startedAt()).isEqualTo(clock.instant());
        assertThat(second.success()).isTrue();
        assertThat(second.diff().isEmpty()).isTrue();
    }

    @Test
    void shouldNotMutateTargetInDryRun() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        SyncConfig config = config("providerA");

        SyncRunResult result = runner(config, target,
            List.of(new StubProviderAdapter("providerA", ProviderKind.NEWAPI).group("g1", 0.4, "gpt-x"))).run(true);

        assertThat(result.apply().dryRun()).isTrue();
        assertThat(result.apply().channels().created()).isEqualTo(1);
        assertThat(target.mutations).isEmpty();
    }

    @Test
    void shouldFailWhenEveryProviderFails() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        SyncConfig config = config("providerA");

        SyncRunResult result = runner(config, target,
            List.of(new StubProviderAdapter("providerA", ProviderKind.NEWAPI).failing("no groups"))).run(false);

        assertThat(result.success()).isFalse();
        assertThat(result.providers()).singleElement().satisfies(report -> {
            assertThat(report.success()).isFalse();
            assertThat(report.error()).isEqualTo("no groups");
        });
    }

    @Test
    void shouldSucceedWhenOneOfSeveralProvidersSucceeds() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        SyncConfig config = config("providerA", "providerB");

        SyncRunResult result = runner(config, target, List.of(
            new StubProviderAdapter("providerA", ProviderKind.NEWAPI).failing("unreachable"),
            new StubProviderAdapter("providerB", ProviderKind.NEWAPI).group("g2", 0.6, "gemini-y")
        )).run(false);

        assertThat(result.success()).isTrue();
        assertThat(result.succeededProviders()).isEqualTo(1);
    }

    @Test
    void shouldFailWhenApplyRecordsErrors() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        target.rejected.add("g1-providerA");

        SyncRunResult result = runner(config("providerA"), target,
            List.of(new StubProviderAdapter("providerA", ProviderKind.NEWAPI).group("g1", 0.4, "gpt-x"))).run(false);

        assertThat(result.success()).isFalse();
        assertThat(result.apply().errors()).hasSize(1);
    }

    @Test
    void shouldAbortBeforeProvidersRunWhenTargetIsUnhealthy() {
        InMemoryTargetClient target = new InMemoryTargetClient();
        target.health = HealthStatus.failed("401 unauthorized");
        List<String> calls = new ArrayList<>();

        SyncRunner runner = new SyncRunner(config("providerA"), target, () -> {
            calls.add("adapters");
            return List.of();
        }, new AggregationPipeline(config("providerA"), JsonSupport.newMapper()), clock);

        assertThatThrownBy(() -> runner.run(false))
            .isInstanceOf(SyncAbortedException.class)
            .hasMessage("Target health check failed: 401 unauthorized");
        assertThat(calls).isEmpty();
    }

    static SyncConfig config(String... providers) {
        List<ProviderConfig> configs = Arrays.stream(providers)
            .<ProviderConfig>map(name -> new NewApiProviderConfig(name, "https://" + name + ".example", "token", 1, null, null, null, null))
            .toList();
        return new SyncConfig(new TargetConfig("https://target.example", "admin", 1), configs, List.of(), Map.of(), null);
    }

    private SyncRunner runner(SyncConfig config, InMemoryTargetClient target, List<ProviderAdapter> adapters) {
        return new SyncRunner(config, target, () -> adapters, new AggregationPipeline(config, JsonSupport.newMapper()), clock);
    }
}

package io.gatesync.cli;

import io.gatesync.core.config.model.ProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.upstream.HealthStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Check the target gateway and list configured providers")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-c", "--config"}, description = "Config file path")
    Path config;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path configPath = context.resolveConfig(config);
            System.out.println("Config path: " + configPath);
            System.out.println("Config exists: " + Files.exists(configPath));
            SyncConfig loaded = context.configService().load(configPath);
            System.out.println("Target: " + loaded.target().baseUrl());
            HealthStatus health = context.environments().apply(loaded).target().healthCheck();
            if (health.ok()) {
                System.out.println("Target healthy: true" + health.balanceValue()
                    .map(balance -> String.format(Locale.ROOT, " (balance $%.2f)", balance))
                    .orElse(""));
            } else {
                System.out.println("Target healthy: false (" + health.error() + ")");
            }
            System.out.println("Providers: " + loaded.providers().size());
            for (ProviderConfig provider : loaded.providers()) {
                System.out.println("  " + provider.name() + " (" + provider.kind().name().toLowerCase(Locale.ROOT) + ")");
            }
            return health.ok() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

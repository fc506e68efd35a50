package io.gatesync.cli;

import io.gatesync.core.config.ConfigService;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.sync.SyncEnvironment;
import java.nio.file.Path;
import java.util.function.Function;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Function<SyncConfig, SyncEnvironment> environments,
    Runnable verboseLogging
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, SyncEnvironment::new, () -> {
        });
    }

    Path resolveConfig(Path override) {
        return override != null ? override : configPath;
    }
}

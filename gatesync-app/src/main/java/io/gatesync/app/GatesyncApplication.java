package io.gatesync.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.gatesync.cli.CliContext;
import io.gatesync.cli.GatesyncCliCommand;
import io.gatesync.cli.ResetCommand;
import io.gatesync.cli.RunCommand;
import io.gatesync.cli.StatusCommand;
import io.gatesync.core.config.ConfigPaths;
import io.gatesync.core.config.ConfigService;
import io.gatesync.core.sync.SyncEnvironment;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class GatesyncApplication {

    private GatesyncApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.resolve(null),
            SyncEnvironment::new,
            GatesyncApplication::enableDebugLogging
        );

        CommandLine commandLine = new CommandLine(new GatesyncCliCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("reset", new ResetCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(Level.DEBUG);
        }
    }
}

package io.gatesync.cli;

import io.gatesync.core.config.ConfigService;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.json.JsonSupport;
import io.gatesync.core.sync.SyncRunResult;
import io.gatesync.core.sync.SyncRunner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Aggregate providers and reconcile the target gateway")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--only", description = "Only sync these providers (comma-separated, repeatable)")
    List<String> only = new ArrayList<>();

    @Option(names = "--dry-run", description = "Compute the diff without changing the target")
    boolean dryRun;

    @Option(names = "--json", description = "Print the full result as JSON")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    boolean verbose;

    @Option(names = {"-c", "--config"}, description = "Config file path")
    Path config;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (verbose) {
                context.verboseLogging().run();
            }
            SyncConfig loaded = context.configService().load(context.resolveConfig(config));
            SyncConfig selected = ConfigService.applyOnly(loaded, only);
            SyncRunResult result = new SyncRunner(context.environments().apply(selected)).run(dryRun);
            if (json) {
                System.out.println(JsonSupport.newMapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } else {
                RunSummaryPrinter.printRun(result, System.out);
            }
            return result.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.gatesync.cli;

import io.gatesync.core.config.ConfigService;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.json.JsonSupport;
import io.gatesync.core.sync.ResetResult;
import io.gatesync.core.sync.ResetService;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "reset", description = "Delete every channel, model, option entry and token owned by the selected providers")
public final class ResetCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--only", description = "Only reset these providers (comma-separated, repeatable)")
    List<String> only = new ArrayList<>();

    @Option(names = "--json", description = "Print the result as JSON")
    boolean json;

    @Option(names = {"-c", "--config"}, description = "Config file path")
    Path config;

    public ResetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SyncConfig loaded = context.configService().load(context.resolveConfig(config));
            SyncConfig selected = ConfigService.applyOnly(loaded, only);
            ResetResult result = new ResetService(context.environments().apply(selected)).reset();
            if (json) {
                System.out.println(JsonSupport.newMapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } else {
                RunSummaryPrinter.printReset(result, System.out);
            }
            return result.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Reset command failed: " + e.getMessage());
            return 1;
        }
    }
}

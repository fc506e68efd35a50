package io.gatesync.cli;

import picocli.CommandLine.Command;

@Command(name = "gatesync", mixinStandardHelpOptions = true, description = "Sync upstream LLM providers into a new-api gateway")
public final class GatesyncCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}

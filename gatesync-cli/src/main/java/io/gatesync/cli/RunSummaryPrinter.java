package io.gatesync.cli;

import io.gatesync.core.apply.ApplyError;
import io.gatesync.core.apply.ApplyReport;
import io.gatesync.core.provider.ProviderReport;
import io.gatesync.core.sync.ResetResult;
import io.gatesync.core.sync.SyncRunResult;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Human-readable run and reset summaries.
 */
final class RunSummaryPrinter {

    private RunSummaryPrinter() {
    }

    static void printRun(SyncRunResult result, PrintStream out) {
        ApplyReport apply = result.apply();
        out.println("Mode: " + (apply.dryRun() ? "dry-run" : "apply"));
        out.println("Providers: " + result.succeededProviders() + "/" + result.providers().size());
        out.println("Channels: +" + apply.channels().created() + " ~" + apply.channels().updated() + " -" + apply.channels().deleted());
        out.println("Models: +" + apply.models().created() + " ~" + apply.models().updated() + " -" + apply.models().deleted()
            + " | Orphans: -" + apply.models().orphansDeleted());
        out.println("Options updated: " + apply.options().updated().size());

        for (ProviderReport provider : result.providers()) {
            if (!provider.success()) {
                out.println("[" + provider.name() + "] " + (provider.error() == null ? "unknown error" : provider.error()));
            }
        }
        for (ApplyError error : apply.errors()) {
            out.println("[" + error.phase().json() + "/" + error.key() + "] " + error.message());
        }

        String elapsed = String.format(Locale.ROOT, "%.2f", result.elapsedMs() / 1000.0);
        out.println(result.success() ? "Completed in " + elapsed + "s" : "Completed with errors in " + elapsed + "s");
    }

    static void printReset(ResetResult result, PrintStream out) {
        out.println("Reset complete | Channels: -" + result.channelsDeleted()
            + " | Models: -" + result.modelsDeleted()
            + " | Orphans: -" + result.orphanModelsDeleted()
            + " | Tokens: -" + result.tokensDeleted()
            + " | Options: " + result.optionsUpdated().size());
        for (ApplyError error : result.errors()) {
            out.println("[" + error.phase().json() + "/" + error.key() + "] " + error.message());
        }
    }
}

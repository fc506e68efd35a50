package io.gatesync.core.target;

import io.gatesync.core.http.TransportException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Reads channels, models, vendors and managed options concurrently and waits for all four.
 */
public final class SnapshotReader {
    private final TargetClient target;

    public SnapshotReader(TargetClient target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public TargetSnapshot read() {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<List<Channel>> channels = supply(target::listChannels, executor);
            CompletableFuture<List<ModelMeta>> models = supply(target::listModels, executor);
            CompletableFuture<List<Vendor>> vendors = supply(target::listVendors, executor);
            CompletableFuture<Map<String, String>> options = supply(() -> target.getOptions(ManagedOptions.KEYS), executor);
            CompletableFuture.allOf(channels, models, vendors, options).join();
            return new TargetSnapshot(channels.join(), models.join(), vendors.join(), options.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new TransportException("Failed to read target snapshot: " + e.getMessage(), false, e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T> CompletableFuture<T> supply(Supplier<T> call, ExecutorService executor) {
        return CompletableFuture.supplyAsync(call, executor);
    }
}

package io.gatesync.core.target;

import io.gatesync.core.http.ApiRejectedException;
import io.gatesync.core.upstream.HealthStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Target fake holding channels, models, vendors and options in memory. Names added to
 * {@link #rejected} make the matching mutation fail.
 */
public final class InMemoryTargetClient implements TargetClient {
    public final Map<Long, Channel> channels = new LinkedHashMap<>();
    public final Map<Long, ModelMeta> models = new LinkedHashMap<>();
    public final List<Vendor> vendors = new ArrayList<>();
    public final Map<String, String> options = new LinkedHashMap<>();
    public final Set<String> rejected = new HashSet<>();
    public final List<String> mutations = new ArrayList<>();
    public HealthStatus health = HealthStatus.healthy(10.0);

    private final AtomicLong ids = new AtomicLong(100);

    public Channel addChannel(Channel channel) {
        Channel stored = channel.withId(ids.incrementAndGet());
        channels.put(stored.id(), stored);
        return stored;
    }

    public ModelMeta addModel(ModelMeta model) {
        ModelMeta stored = model.withId(ids.incrementAndGet());
        models.put(stored.id(), stored);
        return stored;
    }

    public TargetSnapshot snapshot() {
        return new TargetSnapshot(listChannels(), listModels(), listVendors(), getOptions(ManagedOptions.KEYS));
    }

    @Override
    public HealthStatus healthCheck() {
        return health;
    }

    @Override
    public synchronized List<Channel> listChannels() {
        return List.copyOf(channels.values());
    }

    @Override
    public synchronized long createChannel(Channel channel) {
        reject(channel.name());
        mutations.add("create-channel " + channel.name());
        return addChannel(channel).id();
    }

    @Override
    public synchronized void updateChannel(Channel channel) {
        reject(channel.name());
        mutations.add("update-channel " + channel.name());
        channels.put(channel.id(), channel);
    }

    @Override
    public synchronized void deleteChannel(long id) {
        Channel channel = channels.get(id);
        reject(channel == null ? String.valueOf(id) : channel.name());
        mutations.add("delete-channel " + id);
        channels.remove(id);
    }

    @Override
    public synchronized List<ModelMeta> listModels() {
        return List.copyOf(models.values());
    }

    @Override
    public synchronized void createModel(ModelMeta model) {
        reject(model.modelName());
        mutations.add("create-model " + model.modelName());
        addModel(model);
    }

    @Override
    public synchronized void updateModel(ModelMeta model) {
        reject(model.modelName());
        mutations.add("update-model " + model.modelName());
        models.put(model.id(), model);
    }

    @Override
    public synchronized void deleteModel(long id) {
        mutations.add("delete-model " + id);
        models.remove(id);
    }

    @Override
    public synchronized List<Vendor> listVendors() {
        return List.copyOf(vendors);
    }

    @Override
    public synchronized Map<String, String> getOptions(Collection<String> keys) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : keys) {
            if (options.containsKey(key)) {
                values.put(key, options.get(key));
            }
        }
        return values;
    }

    @Override
    public synchronized void updateOption(String key, String value) {
        reject(key);
        mutations.add("option " + key);
        options.put(key, value);
    }

    @Override
    public synchronized int cleanupOrphanedModels() {
        Set<String> bound = new HashSet<>();
        channels.values().forEach(channel -> bound.addAll(channel.modelList()));
        List<Long> orphans = models.values().stream()
            .filter(model -> !bound.contains(model.modelName()))
            .map(ModelMeta::id)
            .toList();
        orphans.forEach(models::remove);
        return orphans.size();
    }

    private void reject(String name) {
        if (rejected.contains(name)) {
            throw new ApiRejectedException("rejected " + name);
        }
    }
}

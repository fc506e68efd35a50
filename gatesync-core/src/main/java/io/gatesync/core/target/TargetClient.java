package io.gatesync.core.target;

import io.gatesync.core.upstream.HealthStatus;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Resource CRUD on the target instance. Listing covers every page. Mutations throw
 * {@link io.gatesync.core.http.TransportException} on failure.
 */
public interface TargetClient {

    HealthStatus healthCheck();

    List<Channel> listChannels();

    long createChannel(Channel channel);

    void updateChannel(Channel channel);

    void deleteChannel(long id);

    List<ModelMeta> listModels();

    void createModel(ModelMeta model);

    void updateModel(ModelMeta model);

    void deleteModel(long id);

    List<Vendor> listVendors();

    /**
     * Current values of the requested keys; keys never set on the target are absent.
     */
    Map<String, String> getOptions(Collection<String> keys);

    void updateOption(String key, String value);

    /**
     * Asks the target to delete models bound to no channel. Returns how many were removed.
     */
    int cleanupOrphanedModels();
}

package io.gatesync.core.pipeline;

import io.gatesync.core.target.Channel;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the target should look like for the providers in {@code managedProviders}.
 * {@code mappingSources} are model names renamed away by the model mapping.
 */
public record DesiredState(
    List<Channel> channels,
    Map<String, DesiredModel> models,
    ManagedOptionMaps options,
    Set<String> managedProviders,
    Set<String> mappingSources
) {
    public DesiredState {
        channels = List.copyOf(channels);
        models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        managedProviders = Collections.unmodifiableSet(new LinkedHashSet<>(managedProviders));
        mappingSources = Collections.unmodifiableSet(new LinkedHashSet<>(mappingSources));
    }

    /**
     * Nothing desired for the given providers, which therefore lose every resource they own.
     */
    public static DesiredState emptyFor(Set<String> providers) {
        return new DesiredState(List.of(), Map.of(), ManagedOptionMaps.empty(), providers, Set.of());
    }
}

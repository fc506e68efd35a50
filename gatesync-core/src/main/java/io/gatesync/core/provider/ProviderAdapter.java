package io.gatesync.core.provider;

import io.gatesync.core.config.model.ProviderKind;
import io.gatesync.core.http.TransportException;
import org.slf4j.LoggerFactory;

/**
 * One configured upstream taking part in a run. The phases are called once each, in order,
 * with the same state.
 */
public interface ProviderAdapter {

    String name();

    ProviderKind kind();

    /**
     * Reads the upstream catalog, applies filters and provisions credentials.
     */
    void discover(AggregationState state);

    /**
     * Probes the discovered models through the provisioned credentials.
     */
    void healthProbe(AggregationState state);

    /**
     * Folds the surviving groups and models into {@code state}.
     */
    ProviderReport materialize(AggregationState state);

    /**
     * Token counts accumulated so far, reported even when a later phase fails.
     */
    TokenCounts tokenCounts();

    /**
     * Runs every phase. Failures never escape: they become a failed report.
     */
    default ProviderReport run(AggregationState state) {
        try {
            discover(state);
            healthProbe(state);
            return materialize(state);
        } catch (ProviderException | TransportException e) {
            LoggerFactory.getLogger(ProviderAdapter.class).warn("[{}] {}", name(), e.getMessage());
            return ProviderReport.failed(name(), e.getMessage(), tokenCounts());
        } catch (RuntimeException e) {
            LoggerFactory.getLogger(ProviderAdapter.class).warn("[{}] Unexpected failure", name(), e);
            return ProviderReport.failed(name(), String.valueOf(e.getMessage()), tokenCounts());
        }
    }
}

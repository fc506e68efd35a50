package io.gatesync.core.tester;

/**
 * Invoked on the calling thread after each probe, in input order.
 */
@FunctionalInterface
public interface ProbeListener {
    ProbeListener NONE = result -> {
    };

    void onProbe(ProbeResult result);
}

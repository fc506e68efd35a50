package io.gatesync.core.pricing;

/**
 * Faster groups get both a higher routing priority and a higher load-balancing weight.
 */
public final class RoutingWeights {

    private RoutingWeights() {
    }

    /**
     * {@code round(10000 / (avg + 100))}, or 0 when no probe succeeded.
     */
    public static int priority(Double avgResponseTimeMs) {
        if (avgResponseTimeMs == null || avgResponseTimeMs.isNaN() || avgResponseTimeMs < 0) {
            return 0;
        }
        return (int) Math.round(10_000.0 / (avgResponseTimeMs + 100.0));
    }

    public static int weight(int priority) {
        return priority > 0 ? priority : 1;
    }
}

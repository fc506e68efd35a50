package io.gatesync.core.upstream;

import java.util.Optional;

public record HealthStatus(boolean ok, Double balance, String error) {

    public static HealthStatus healthy(Double balance) {
        return new HealthStatus(true, balance, null);
    }

    public static HealthStatus failed(String error) {
        return new HealthStatus(false, null, error);
    }

    public Optional<Double> balanceValue() {
        return Optional.ofNullable(balance);
    }
}

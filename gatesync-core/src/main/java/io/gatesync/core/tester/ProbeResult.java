package io.gatesync.core.tester;

public record ProbeResult(String model, boolean success, long latencyMs, String error) {
}

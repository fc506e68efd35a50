package io.gatesync.core.tester;

import java.util.List;
import java.util.OptionalDouble;

/**
 * {@code avgResponseTimeMs} averages successful probes only and is null when none succeeded.
 */
public record ModelTestResult(List<String> workingModels, List<ProbeResult> details, Double avgResponseTimeMs) {
    public ModelTestResult {
        workingModels = List.copyOf(workingModels);
        details = List.copyOf(details);
    }

    public static ModelTestResult of(List<ProbeResult> details) {
        List<String> working = details.stream().filter(ProbeResult::success).map(ProbeResult::model).toList();
        OptionalDouble average = details.stream()
            .filter(ProbeResult::success)
            .mapToLong(ProbeResult::latencyMs)
            .average();
        return new ModelTestResult(working, details, average.isPresent() ? average.getAsDouble() : null);
    }

    public List<String> failedModels() {
        return details.stream().filter(result -> !result.success()).map(ProbeResult::model).toList();
    }
}

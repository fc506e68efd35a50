package io.gatesync.core.pipeline;

import io.gatesync.core.provider.ProviderReport;
import java.util.List;

public record PipelineResult(DesiredState desired, List<ProviderReport> providerReports) {
    public PipelineResult {
        providerReports = List.copyOf(providerReports);
    }
}

package io.gatesync.core.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderReport(String name, boolean success, int groups, int models, TokenCounts tokens, String error) {

    public static ProviderReport succeeded(String name, int groups, int models, TokenCounts tokens) {
        return new ProviderReport(name, true, groups, models, tokens, null);
    }

    public static ProviderReport failed(String name, String error, TokenCounts tokens) {
        return new ProviderReport(name, false, 0, 0, tokens, error);
    }
}

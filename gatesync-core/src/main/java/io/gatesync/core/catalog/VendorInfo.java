package io.gatesync.core.catalog;

public record VendorInfo(int channelType, String defaultBaseUrl, DiscoveryDialect discovery) {

    public enum DiscoveryDialect {
        OPENAI,
        ANTHROPIC,
        GEMINI
    }
}

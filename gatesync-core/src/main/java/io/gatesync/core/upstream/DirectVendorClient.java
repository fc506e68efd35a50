package io.gatesync.core.upstream;

import io.gatesync.core.catalog.VendorInfo;
import io.gatesync.core.http.JsonHttpClient;
import java.util.List;
import java.util.Objects;

/**
 * A vendor's own API, used with the customer's key.
 */
public final class DirectVendorClient {
    private final ModelDiscovery discovery;
    private final String baseUrl;
    private final String apiKey;
    private final VendorInfo vendor;

    public DirectVendorClient(JsonHttpClient http, String baseUrl, String apiKey, VendorInfo vendor) {
        this.discovery = new ModelDiscovery(Objects.requireNonNull(http, "http must not be null"));
        this.vendor = Objects.requireNonNull(vendor, "vendor must not be null");
        this.baseUrl = NewApiSession.stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? vendor.defaultBaseUrl() : baseUrl);
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
    }

    public String baseUrl() {
        return baseUrl;
    }

    public List<String> discoverModels() {
        return discovery.listModels(baseUrl, apiKey, vendor.discovery());
    }
}

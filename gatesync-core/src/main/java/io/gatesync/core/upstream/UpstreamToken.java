package io.gatesync.core.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpstreamToken(long id, String name, String key, String group, int status) {

    /**
     * Gateways return token secrets without the conventional {@code sk-} prefix.
     */
    public String apiKey() {
        if (key == null || key.isBlank()) {
            return "";
        }
        return key.startsWith("sk-") ? key : "sk-" + key;
    }
}

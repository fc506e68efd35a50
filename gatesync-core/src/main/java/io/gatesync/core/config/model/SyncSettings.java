package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSettings(
    int probeConcurrency,
    int probeTimeoutSeconds,
    int httpTimeoutSeconds,
    int maxAttempts
) {
    public SyncSettings {
        probeConcurrency = probeConcurrency <= 0 ? 5 : probeConcurrency;
        probeTimeoutSeconds = probeTimeoutSeconds <= 0 ? 10 : probeTimeoutSeconds;
        httpTimeoutSeconds = httpTimeoutSeconds <= 0 ? 10 : httpTimeoutSeconds;
        maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    }

    public static SyncSettings defaults() {
        return new SyncSettings(0, 0, 0, 0);
    }

    public Duration probeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds);
    }
}

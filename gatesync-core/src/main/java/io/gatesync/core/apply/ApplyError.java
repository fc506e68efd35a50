package io.gatesync.core.apply;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public record ApplyError(Phase phase, String key, String message) {

    public enum Phase {
        OPTIONS,
        CHANNELS,
        MODELS,
        CLEANUP,
        TOKENS;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}

package io.gatesync.core.target;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Model catalog entry on the target. {@code syncOfficial == 1} marks entries this tool owns and
 * may delete.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelMeta(
    Long id,
    @JsonProperty("model_name") String modelName,
    @JsonProperty("vendor_id") Integer vendorId,
    String endpoints,
    Integer status,
    @JsonProperty("sync_official") Integer syncOfficial
) {
    public static final int OWNED = 1;

    public boolean owned() {
        return syncOfficial != null && syncOfficial == OWNED;
    }

    public ModelMeta withId(Long newId) {
        return new ModelMeta(newId, modelName, vendorId, endpoints, status, syncOfficial);
    }
}

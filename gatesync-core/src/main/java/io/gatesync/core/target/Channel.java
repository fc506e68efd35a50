package io.gatesync.core.target;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * A target channel in the target's own wire format. {@code name} is the identity key;
 * {@code id} is assigned by the target. {@code tag} names the owning provider.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Channel(
    Long id,
    String name,
    int type,
    String key,
    @JsonProperty("base_url") String baseUrl,
    String models,
    String group,
    long priority,
    Integer weight,
    int status,
    String tag,
    String remark,
    @JsonProperty("model_mapping") String modelMapping
) {
    public static final int STATUS_ENABLED = 1;

    public Channel withId(Long newId) {
        return new Channel(newId, name, type, key, baseUrl, models, group, priority, weight, status, tag, remark, modelMapping);
    }

    public List<String> modelList() {
        if (models == null || models.isBlank()) {
            return List.of();
        }
        return Arrays.stream(models.split(","))
            .map(String::trim)
            .filter(model -> !model.isEmpty())
            .toList();
    }

    public boolean taggedBy(Set<String> providers) {
        return tag != null && !tag.isEmpty() && providers.contains(tag);
    }
}

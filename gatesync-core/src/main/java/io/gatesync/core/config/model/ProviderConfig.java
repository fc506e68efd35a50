package io.gatesync.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.gatesync.core.pricing.PriceAdjustment;
import java.util.List;

/**
 * One configured upstream. The {@code type} discriminator defaults to {@code newapi}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = NewApiProviderConfig.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = NewApiProviderConfig.class, name = "newapi"),
    @JsonSubTypes.Type(value = DirectProviderConfig.class, name = "direct"),
    @JsonSubTypes.Type(value = Sub2ApiProviderConfig.class, name = "sub2api")
})
public interface ProviderConfig {

    String name();

    List<String> enabledModels();

    PriceAdjustment priceAdjustment();

    @JsonIgnore
    ProviderKind kind();
}

package io.gatesync.core.upstream;

import java.util.List;

/**
 * Upstream pricing for one model. {@code modelPrice} is set only for fixed-price models.
 */
public record ModelInfo(
    String name,
    double ratio,
    double completionRatio,
    List<String> groups,
    Integer vendorId,
    List<String> supportedEndpoints,
    Double modelPrice
) {
    public ModelInfo {
        groups = groups == null ? List.of() : List.copyOf(groups);
        supportedEndpoints = supportedEndpoints == null ? List.of() : List.copyOf(supportedEndpoints);
    }

    public boolean fixedPrice() {
        return modelPrice != null && modelPrice > 0;
    }
}

package io.gatesync.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One upstream pricing response shape. Implementations are selected by probing the payload,
 * never by a version flag.
 */
public interface PricingParser {

    boolean supports(JsonNode root);

    UpstreamPricing parse(JsonNode root);
}

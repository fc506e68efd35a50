package io.gatesync.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;

public final class PricingParsers {
    private final List<PricingParser> parsers;

    public PricingParsers(ObjectMapper mapper) {
        this(List.of(new FlatPricingParser(mapper), new GroupedPricingParser(mapper)));
    }

    public PricingParsers(List<PricingParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public Optional<PricingParser> select(JsonNode root) {
        return parsers.stream().filter(parser -> parser.supports(root)).findFirst();
    }

    public UpstreamPricing parse(JsonNode root) {
        return select(root)
            .orElseThrow(() -> new IllegalArgumentException("Unrecognized pricing payload shape"))
            .parse(root);
    }
}

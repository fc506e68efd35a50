package io.gatesync.core.diff;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical text form of option values: object keys sorted, numbers rounded to four decimals and
 * written plain without trailing zeros. Values read back from the target are put through the same
 * form before comparing.
 */
final class OptionValues {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
        .build();
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private OptionValues() {
    }

    static Optional<JsonNode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(canonical(MAPPER.readTree(raw)));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static ObjectNode object(Optional<JsonNode> node) {
        return node.filter(JsonNode::isObject).map(ObjectNode.class::cast).orElseGet(NODES::objectNode);
    }

    static ArrayNode array(Optional<JsonNode> node) {
        return node.filter(JsonNode::isArray).map(ArrayNode.class::cast).orElseGet(NODES::arrayNode);
    }

    static ObjectNode numbers(Map<String, Double> values) {
        ObjectNode node = NODES.objectNode();
        values.forEach((key, value) -> node.put(key, number(value)));
        return node;
    }

    static ObjectNode strings(Map<String, String> values) {
        ObjectNode node = NODES.objectNode();
        values.forEach(node::put);
        return node;
    }

    static ArrayNode stringArray(Iterable<String> values) {
        ArrayNode node = NODES.arrayNode();
        values.forEach(node::add);
        return node;
    }

    static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(canonical(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize option value", e);
        }
    }

    /**
     * Canonical form of a stored value, or the raw text when it is not JSON.
     */
    static String normalize(String raw) {
        return parse(raw).map(OptionValues::write).orElse(raw);
    }

    static BigDecimal number(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.signum() == 0 ? BigDecimal.ZERO : rounded;
    }

    static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            node.fields().forEachRemaining(entry -> sorted.put(entry.getKey(), canonical(entry.getValue())));
            ObjectNode result = NODES.objectNode();
            sorted.forEach(result::set);
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = NODES.arrayNode();
            node.forEach(item -> result.add(canonical(item)));
            return result;
        }
        if (node.isNumber()) {
            return NODES.numberNode(number(node.asDouble()));
        }
        return node;
    }
}

package io.gatesync.core.pricing;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads either a bare number or an object of numbers.
 */
public final class PriceAdjustmentDeserializer extends StdDeserializer<PriceAdjustment> {

    public PriceAdjustmentDeserializer() {
        super(PriceAdjustment.class);
    }

    @Override
    public PriceAdjustment deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node.isNumber()) {
            return new PriceAdjustment.Flat(node.doubleValue());
        }
        if (node.isObject()) {
            Map<String, Double> entries = new LinkedHashMap<>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if (!field.getValue().isNumber()) {
                    throw JsonMappingException.from(parser, "priceAdjustment." + field.getKey() + " must be a number");
                }
                entries.put(field.getKey(), field.getValue().doubleValue());
            }
            return new PriceAdjustment.PerKey(entries);
        }
        throw JsonMappingException.from(parser, "priceAdjustment must be a number or an object of numbers");
    }
}

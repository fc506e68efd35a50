package io.gatesync.core.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gatesync.core.json.JsonSupport;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PriceAdjustmentTest {

    private final ObjectMapper mapper = JsonSupport.newMapper();

    @Test
    void shouldResolveByModelThenVendorThenTypeThenDefault() {
        Map<String, Double> entries = new LinkedHashMap<>();
        entries.put("gpt-4o", -0.5);
        entries.put("claude-*", -0.4);
        entries.put("google", -0.3);
        entries.put("reasoning", -0.2);
        entries.put("default", -0.1);
        PriceAdjustment adjustment = new PriceAdjustment.PerKey(entries);

        assertThat(adjustment.resolve("GPT-4o")).isEqualTo(-0.5);
        assertThat(adjustment.resolve("claude-sonnet-4")).isEqualTo(-0.4);
        assertThat(adjustment.resolve("gemini-2.5-pro")).isEqualTo(-0.3);
        assertThat(adjustment.resolve("deepseek-reasoner")).isEqualTo(-0.2);
        assertThat(adjustment.resolve("llama-3")).isEqualTo(-0.1);
        assertThat(adjustment.minimum()).isEqualTo(-0.5);
    }

    @Test
    void shouldReadNumberOrObject() throws Exception {
        PriceAdjustment flat = mapper.readValue("-0.2", PriceAdjustment.class);
        PriceAdjustment perKey = mapper.readValue("{\"default\": 0.1, \"OpenAI\": -0.1}", PriceAdjustment.class);

        assertThat(flat).isEqualTo(new PriceAdjustment.Flat(-0.2));
        assertThat(perKey.resolve("gpt-4o")).isEqualTo(-0.1);
        assertThat(perKey.resolve("mystery")).isEqualTo(0.1);
        assertThat(mapper.writeValueAsString(perKey)).isEqualTo("{\"default\":0.1,\"openai\":-0.1}");
    }

    @Test
    void shouldRejectNonNumericEntries() {
        assertThatThrownBy(() -> mapper.readValue("{\"default\": \"cheap\"}", PriceAdjustment.class))
            .isInstanceOf(JsonMappingException.class)
            .hasMessageContaining("priceAdjustment.default must be a number");
    }

    @Test
    void shouldTreatMissingAdjustmentAsNone() {
        assertThat(PriceTiers.effectiveRatio(0.8, null, "gpt-4o")).isEqualTo(0.8);
    }
}

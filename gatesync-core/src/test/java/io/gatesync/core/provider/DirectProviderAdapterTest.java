package io.gatesync.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.gatesync.core.catalog.ChannelTypes;
import io.gatesync.core.config.model.DirectProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.config.model.TargetConfig;
import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.json.JsonSupport;
import io.gatesync.core.pricing.PriceAdjustment;
import io.gatesync.core.tester.ModelTester;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DirectProviderAdapterTest {

    private MockWebServer server;
    private VendorDispatcher vendor;
    private JsonHttpClient http;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        vendor = new VendorDispatcher();
        server.setDispatcher(vendor);
        server.start();
        http = new JsonHttpClient(JsonHttpClient.defaultClient(Duration.ofSeconds(5)), JsonSupport.newMapper(), 1, Duration.ZERO);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPublishFixedGroupRatio() {
        DirectProviderAdapter adapter = adapter(0.8, null);
        AggregationState state = stateWithGatewayGroup(0.5, "deepseek-chat");

        ProviderReport report = run(adapter, state);

        assertThat(report.success()).isTrue();
        assertThat(report.groups()).isEqualTo(1);
        assertThat(directGroups(state)).singleElement().satisfies(group -> {
            assertThat(group.name()).isEqualTo("deepseek-ds");
            assertThat(group.ratio()).isEqualTo(0.8);
            assertThat(group.description()).isEqualTo("deepseek via ds (direct)");
        });
        assertThat(directChannels(state)).singleElement().satisfies(channel -> {
            assertThat(channel.type()).isEqualTo(ChannelTypes.DEEPSEEK);
            assertThat(channel.key()).isEqualTo("sk-ds");
            assertThat(channel.models()).containsExactly("deepseek-chat", "deepseek-reasoner");
        });
        assertThat(vendor.authorizations).containsOnly("Bearer sk-ds");
    }

    @Test
    void shouldPriceRelativeToCheapestEarlierGroup() {
        DirectProviderAdapter adapter = adapter(0.8, new PriceAdjustment.Flat(-0.2));
        AggregationState state = stateWithGatewayGroup(0.5, "deepseek-chat");

        run(adapter, state);

        assertThat(directGroups(state)).extracting(MergedGroup::name)
            .containsExactly("deepseek-ds-t0", "deepseek-ds-t1");
        assertThat(directGroups(state).get(0).ratio()).isCloseTo(0.4, within(1e-9));
        assertThat(directGroups(state).get(1).ratio()).isCloseTo(0.8, within(1e-9));
        assertThat(directChannels(state)).extracting(ChannelSpec::models)
            .containsExactly(List.of("deepseek-chat"), List.of("deepseek-reasoner"));
    }

    @Test
    void shouldDropModelsPricedAboveReferenceWhenNoEarlierGroupServesThem() {
        DirectProviderAdapter adapter = adapter(null, new PriceAdjustment.Flat(0.1));
        AggregationState state = stateWithGatewayGroup(0.5, "deepseek-chat");

        run(adapter, state);

        assertThat(directGroups(state)).singleElement().satisfies(group -> {
            assertThat(group.name()).isEqualTo("deepseek-ds");
            assertThat(group.ratio()).isCloseTo(0.55, within(1e-9));
        });
        assertThat(directChannels(state)).singleElement()
            .satisfies(channel -> assertThat(channel.models()).containsExactly("deepseek-chat"));
    }

    @Test
    void shouldFailWhenFixedRatioExceedsReference() {
        DirectProviderAdapter adapter = adapter(1.2, null);
        AggregationState state = new AggregationState();
        adapter.discover(state);
        adapter.healthProbe(state);

        assertThatThrownBy(() -> adapter.materialize(state))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("exceeds ratio 1");
        assertThat(state.channels()).isEmpty();
    }

    @Test
    void shouldFailWhenNoModelWorks() {
        vendor.completionsFail = true;
        DirectProviderAdapter adapter = adapter(null, null);
        AggregationState state = new AggregationState();
        adapter.discover(state);

        assertThatThrownBy(() -> adapter.healthProbe(state))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("0/2 passed");
    }

    private DirectProviderAdapter adapter(Double groupRatio, PriceAdjustment adjustment) {
        DirectProviderConfig provider = new DirectProviderConfig(
            "ds", "deepseek", "sk-ds", server.url("/").toString(), groupRatio, null, adjustment);
        SyncConfig config = new SyncConfig(
            new TargetConfig("https://target.example", "root", 1), List.of(provider), List.of(), Map.of(), null);
        return new DirectProviderAdapter(provider, new ProviderContext(config, http, new ModelTester(http, 2)));
    }

    private static AggregationState stateWithGatewayGroup(double ratio, String model) {
        AggregationState state = new AggregationState();
        state.addGroup(new MergedGroup("cheap-gw", ratio, "cheap via gw", "gw"));
        state.addChannel(new ChannelSpec("cheap-gw", ChannelTypes.OPENAI, "sk-gw", "https://gw.example",
            List.of(model), "cheap-gw", 50, 50, "gw", "cheap-gw"));
        return state;
    }

    private static ProviderReport run(DirectProviderAdapter adapter, AggregationState state) {
        adapter.discover(state);
        adapter.healthProbe(state);
        return adapter.materialize(state);
    }

    private static List<MergedGroup> directGroups(AggregationState state) {
        return state.groups().stream().filter(group -> group.provider().equals("ds")).toList();
    }

    private static List<ChannelSpec> directChannels(AggregationState state) {
        return state.channels().stream().filter(channel -> channel.provider().equals("ds")).toList();
    }

    private static final class VendorDispatcher extends Dispatcher {
        private final List<String> authorizations = new CopyOnWriteArrayList<>();
        private volatile boolean completionsFail;

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath() == null ? "" : request.getPath();
            authorizations.add(String.valueOf(request.getHeader("Authorization")));

            if (path.equals("/v1/models")) {
                return json("{\"object\": \"list\", \"data\": [{\"id\": \"deepseek-chat\"}, {\"id\": \"deepseek-reasoner\"}]}");
            }
            if (path.equals("/v1/chat/completions")) {
                return completionsFail
                    ? new MockResponse().setResponseCode(401).setBody("{\"error\":{\"message\":\"invalid key\"}}")
                    : json("{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"choices\":[]}");
            }
            return new MockResponse().setResponseCode(404);
        }

        private static MockResponse json(String body) {
            return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
        }
    }
}

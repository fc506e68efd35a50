package io.gatesync.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.gatesync.core.config.model.NewApiProviderConfig;
import io.gatesync.core.config.model.SyncConfig;
import io.gatesync.core.config.model.TargetConfig;
import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.json.JsonSupport;
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

class GatewayProviderAdapterTest {

    private static final String PRICING = """
        {"success": true,
         "data": [
           {"model_name": "claude-x", "model_ratio": 1.5, "completion_ratio": 5, "enable_groups": ["cheap", "pricey"],
            "supported_endpoint_types": ["anthropic"], "quota_type": 0},
           {"model_name": "gpt-y", "model_ratio": 0.5, "completion_ratio": 4, "enable_groups": ["cheap"],
            "supported_endpoint_types": ["openai"], "quota_type": 0}
         ],
         "group_ratio": {"cheap": 0.5, "pricey": 1.5},
         "usable_group": {"cheap": "Cheap tier", "pricey": "Pricey tier"}}
        """;

    private MockWebServer server;
    private UpstreamDispatcher upstream;
    private GatewayProviderAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        upstream = new UpstreamDispatcher();
        server.setDispatcher(upstream);
        server.start();

        NewApiProviderConfig provider = new NewApiProviderConfig(
            "gw", server.url("/").toString(), "admin", 3, List.of(), List.of(), List.of(), null);
        SyncConfig config = new SyncConfig(
            new TargetConfig("https://target.example", "root", 1), List.of(provider), List.of(), Map.of(), null);
        JsonHttpClient http = new JsonHttpClient(JsonHttpClient.defaultClient(Duration.ofSeconds(5)), JsonSupport.newMapper(), 1, Duration.ZERO);
        adapter = new GatewayProviderAdapter(provider, new ProviderContext(config, http, new ModelTester(http, 2)));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPublishAffordableGroupWithProvisionedToken() {
        AggregationState state = new AggregationState();

        adapter.discover(state);
        adapter.healthProbe(state);
        ProviderReport report = adapter.materialize(state);

        assertThat(report.success()).isTrue();
        assertThat(report.groups()).isEqualTo(1);
        assertThat(report.tokens()).isEqualTo(new TokenCounts(1, 0, 0));
        assertThat(state.channels()).singleElement().satisfies(channel -> {
            assertThat(channel.name()).isEqualTo("cheap-gw");
            assertThat(channel.key()).isEqualTo("sk-abc");
            assertThat(channel.models()).containsExactlyInAnyOrder("claude-x", "gpt-y");
            assertThat(channel.provider()).isEqualTo("gw");
        });
        assertThat(state.groups()).singleElement().satisfies(group -> {
            assertThat(group.ratio()).isEqualTo(0.5);
            assertThat(group.description()).isEqualTo("cheap via gw");
        });
        assertThat(state.models().get("claude-x")).isEqualTo(MergedModel.ratios(1.5, 5));
        assertThat(state.modelEndpoints()).containsEntry("gpt-y", List.of("openai"));
        assertThat(upstream.requests).contains("POST /api/token/").doesNotContain("DELETE /api/token/1");
    }

    @Test
    void shouldDropGroupAndTokenWhenNoModelWorks() {
        upstream.probesFail = true;
        AggregationState state = new AggregationState();

        adapter.discover(state);
        adapter.healthProbe(state);
        ProviderReport report = adapter.materialize(state);

        assertThat(report.success()).isTrue();
        assertThat(state.channels()).isEmpty();
        assertThat(report.tokens().deleted()).isEqualTo(1);
        assertThat(upstream.requests).contains("DELETE /api/token/1");
    }

    private static final class UpstreamDispatcher extends Dispatcher {
        private final List<String> requests = new CopyOnWriteArrayList<>();
        private volatile boolean tokenCreated;
        private volatile boolean probesFail;

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath() == null ? "" : request.getPath();
            requests.add(request.getMethod() + " " + path);

            if (path.equals("/api/pricing_new")) {
                return json(PRICING);
            }
            if (path.equals("/api/user/self")) {
                return json("{\"success\":true,\"data\":{\"quota\":1000000}}");
            }
            if (path.startsWith("/api/token/") && "GET".equals(request.getMethod())) {
                String items = tokenCreated ? "[{\"id\":1,\"name\":\"cheap-gw\",\"key\":\"abc\",\"group\":\"cheap\",\"status\":1}]" : "[]";
                return json("{\"success\":true,\"data\":{\"items\":" + items + "}}");
            }
            if (path.equals("/api/token/") && "POST".equals(request.getMethod())) {
                tokenCreated = true;
                return json("{\"success\":true}");
            }
            if (path.startsWith("/api/token/")) {
                tokenCreated = false;
                return json("{\"success\":true}");
            }
            if (path.startsWith("/v1/")) {
                return probesFail
                    ? new MockResponse().setResponseCode(500).setBody("{\"error\":{\"message\":\"down\"}}")
                    : json("{\"id\":\"msg_1\",\"type\":\"message\"}");
            }
            return new MockResponse().setResponseCode(404);
        }

        private static MockResponse json(String body) {
            return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
        }
    }
}

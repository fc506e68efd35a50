package io.gatesync.core.upstream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gatesync.core.http.ApiRejectedException;
import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.json.JsonSupport;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NewApiClientTest {

    private MockWebServer server;
    private NewApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        JsonHttpClient http = new JsonHttpClient(JsonHttpClient.defaultClient(Duration.ofSeconds(5)), JsonSupport.newMapper(), 1, Duration.ZERO);
        client = new NewApiClient(new NewApiSession(http, server.url("/").toString(), "admin-token", 42), "upstream");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReportBalanceFromQuota() throws Exception {
        server.enqueue(json("{\"success\":true,\"data\":{\"quota\":5000000}}"));

        HealthStatus status = client.healthCheck();

        assertThat(status.ok()).isTrue();
        assertThat(status.balance()).isEqualTo(10.0);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/user/self");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer admin-token");
        assertThat(request.getHeader("New-Api-User")).isEqualTo("42");
    }

    @Test
    void shouldReportUnhealthyOnEnvelopeFailure() {
        server.enqueue(json("{\"success\":false,\"message\":\"access denied\"}"));

        HealthStatus status = client.healthCheck();

        assertThat(status.ok()).isFalse();
        assertThat(status.error()).isEqualTo("access denied");
    }

    @Test
    void shouldFallBackToLegacyPricingWhenNewEndpointIsNotFlat() throws Exception {
        server.enqueue(json("{\"success\":true,\"data\":{\"model_group\":{}}}"));
        server.enqueue(json("""
            {"success": true, "data": [{"model_name": "gpt-4o", "model_ratio": 1.25, "enable_groups": ["default"]}],
             "usable_group": {"default": "Default"}}
            """));

        UpstreamPricing pricing = client.fetchPricing();

        assertThat(pricing.shape()).isEqualTo(UpstreamPricing.PricingShape.FLAT);
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/pricing_new");
        RecordedRequest legacy = server.takeRequest();
        assertThat(legacy.getPath()).isEqualTo("/api/pricing");
        assertThat(legacy.getHeader("Authorization")).isNull();
    }

    @Test
    void shouldListTokensAcrossPages() throws Exception {
        StringBuilder page = new StringBuilder("{\"success\":true,\"data\":{\"items\":[");
        for (int i = 0; i < NewApiSession.PAGE_SIZE; i++) {
            page.append(i == 0 ? "" : ",").append("{\"id\":").append(i).append(",\"name\":\"t").append(i).append("\",\"key\":\"k\"}");
        }
        page.append("]}}");
        server.enqueue(json(page.toString()));
        server.enqueue(json("{\"success\":true,\"data\":[{\"id\":500,\"name\":\"last\",\"key\":\"abc\",\"group\":\"vip\"}]}"));

        List<UpstreamToken> tokens = client.listTokens();

        assertThat(tokens).hasSize(NewApiSession.PAGE_SIZE + 1);
        assertThat(tokens.get(tokens.size() - 1).apiKey()).isEqualTo("sk-abc");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/token/?p=0&page_size=100");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/token/?p=1&page_size=100");
    }

    @Test
    void shouldCreateUnlimitedToken() throws Exception {
        server.enqueue(json("{\"success\":true}"));

        client.createToken("vip-upstream", "vip");

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("\"name\":\"vip-upstream\"", "\"group\":\"vip\"", "\"expired_time\":-1", "\"unlimited_quota\":true");
    }

    @Test
    void shouldSurfaceRejectedDelete() {
        server.enqueue(json("{\"success\":false,\"message\":\"not found\"}"));

        assertThatThrownBy(() -> client.deleteToken(9))
            .isInstanceOf(ApiRejectedException.class)
            .hasMessageContaining("not found");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}

package io.gatesync.core.target;

import static org.assertj.core.api.Assertions.assertThat;

import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.json.JsonSupport;
import io.gatesync.core.upstream.NewApiSession;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NewApiTargetClientTest {

    private MockWebServer server;
    private NewApiTargetClient target;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        JsonHttpClient http = new JsonHttpClient(JsonHttpClient.defaultClient(Duration.ofSeconds(5)), JsonSupport.newMapper(), 1, Duration.ZERO);
        target = new NewApiTargetClient(new NewApiSession(http, server.url("/").toString(), "root-token", 1));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReadChannelsInTargetWireFormat() {
        server.enqueue(json("""
            {"success": true, "data": {"items": [
              {"id": 3, "name": "g1-a", "type": 1, "key": "sk-1", "base_url": "https://a.example", "models": "gpt-x, gpt-y",
               "group": "g1-a", "priority": 40, "weight": 40, "status": 1, "tag": "a", "model_mapping": "", "created_time": 1}
            ]}}
            """));

        List<Channel> channels = target.listChannels();

        assertThat(channels).singleElement().satisfies(channel -> {
            assertThat(channel.id()).isEqualTo(3L);
            assertThat(channel.baseUrl()).isEqualTo("https://a.example");
            assertThat(channel.modelList()).containsExactly("gpt-x", "gpt-y");
            assertThat(channel.taggedBy(Set.of("a"))).isTrue();
        });
    }

    @Test
    void shouldFallBackToFlatPayloadWhenWrappedCreateIsRejected() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"success\":false}"));
        server.enqueue(json("{\"success\":true,\"data\":{\"id\":17}}"));
        Channel channel = new Channel(5L, "g1-a", 1, "sk-1", "https://a.example", "gpt-x", "g1-a", 40, 40, 1, "a", null, null);

        long id = target.createChannel(channel);

        assertThat(id).isEqualTo(17);
        String wrapped = server.takeRequest().getBody().readUtf8();
        assertThat(wrapped).contains("\"mode\":\"single\"").doesNotContain("\"id\"");
        String flat = server.takeRequest().getBody().readUtf8();
        assertThat(flat).doesNotContain("\"mode\"").contains("\"name\":\"g1-a\"", "\"base_url\":\"https://a.example\"");
    }

    @Test
    void shouldReadOnlyRequestedOptions() throws Exception {
        server.enqueue(json("""
            {"success": true, "data": [
              {"key": "GroupRatio", "value": "{\\"default\\":1}"},
              {"key": "SMTPServer", "value": "mail"}
            ]}
            """));

        Map<String, String> options = target.getOptions(ManagedOptions.KEYS);

        assertThat(options).containsOnlyKeys("GroupRatio");
        assertThat(options.get("GroupRatio")).isEqualTo("{\"default\":1}");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/option/");
    }

    @Test
    void shouldPutOptionAsKeyValue() throws Exception {
        server.enqueue(json("{\"success\":true}"));

        target.updateOption("AutoGroups", "[\"g1\"]");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getBody().readUtf8()).contains("\"key\":\"AutoGroups\"", "\"value\":\"[\\\"g1\\\"]\"");
    }

    @Test
    void shouldPageVendorsFromOne() throws Exception {
        server.enqueue(json("{\"success\":true,\"data\":{\"items\":[{\"id\":1,\"name\":\"OpenAI\"}]}}"));

        List<Vendor> vendors = target.listVendors();

        assertThat(vendors).containsExactly(new Vendor(1, "OpenAI"));
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/vendors/?page=1&page_size=100");
    }

    @Test
    void shouldReportOrphanCleanupCount() throws Exception {
        server.enqueue(json("{\"success\":true,\"data\":{\"deleted\":4}}"));

        assertThat(target.cleanupOrphanedModels()).isEqualTo(4);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("DELETE");
        assertThat(request.getPath()).isEqualTo("/api/models/orphaned");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}

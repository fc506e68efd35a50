package io.gatesync.core.tester;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatesync.core.http.JsonHttpClient;
import io.gatesync.core.http.TransportException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one minimal request per model (one output token) and reports which models answer.
 *
 * <p>Models are probed in fixed-size batches: batches run one after another, the probes inside a
 * batch run in parallel. The probe transport is expected to carry its own timeout and to make a
 * single attempt.
 */
public final class ModelTester {
    private static final Logger LOG = LoggerFactory.getLogger(ModelTester.class);
    public static final int DEFAULT_CONCURRENCY = 5;
    private static final String PROMPT = "hi";

    private final JsonHttpClient http;
    private final int concurrency;

    public ModelTester(JsonHttpClient http) {
        this(http, DEFAULT_CONCURRENCY);
    }

    public ModelTester(JsonHttpClient http, int concurrency) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.concurrency = Math.max(1, concurrency);
    }

    public ModelTestResult testModels(String baseUrl, String apiKey, List<String> models, ProbeDialect dialect) {
        return testModels(baseUrl, apiKey, models, dialect, ProbeListener.NONE);
    }

    public ModelTestResult testModels(
        String baseUrl,
        String apiKey,
        List<String> models,
        ProbeDialect dialect,
        ProbeListener listener
    ) {
        Objects.requireNonNull(models, "models must not be null");
        ProbeListener callback = listener == null ? ProbeListener.NONE : listener;
        String root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        List<ProbeResult> results = new ArrayList<>(models.size());
        if (models.isEmpty()) {
            return ModelTestResult.of(results);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, models.size()));
        try {
            for (int start = 0; start < models.size(); start += concurrency) {
                List<String> batch = models.subList(start, Math.min(start + concurrency, models.size()));
                List<Future<ProbeResult>> futures = new ArrayList<>(batch.size());
                for (String model : batch) {
                    futures.add(executor.submit(() -> probe(root, apiKey, model, dialect)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    ProbeResult result = await(futures.get(i), batch.get(i));
                    results.add(result);
                    callback.onProbe(result);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return ModelTestResult.of(results);
    }

    ProbeResult probe(String baseUrl, String apiKey, String model, ProbeDialect dialect) {
        ProbeRequest request = ProbeRequest.of(baseUrl, apiKey, model, dialect);
        long started = System.nanoTime();
        try {
            JsonNode body = http.post(request.url(), request.headers(), request.body());
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            String error = errorOf(body, dialect);
            if (error != null) {
                LOG.debug("Probe {} rejected: {}", model, error);
                return new ProbeResult(model, false, elapsedMs, error);
            }
            return new ProbeResult(model, true, elapsedMs, null);
        } catch (TransportException e) {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            LOG.debug("Probe {} failed: {}", model, e.getMessage());
            return new ProbeResult(model, false, elapsedMs, e.getMessage());
        }
    }

    private ProbeResult await(Future<ProbeResult> future, String model) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while probing " + model, false, e);
        } catch (ExecutionException e) {
            return new ProbeResult(model, false, 0, String.valueOf(e.getCause()));
        }
    }

    static String errorOf(JsonNode body, ProbeDialect dialect) {
        if (dialect == ProbeDialect.ANTHROPIC) {
            if ("error".equals(body.path("type").asText(""))) {
                return body.path("error").path("message").asText("error");
            }
            return null;
        }
        JsonNode error = body.get("error");
        if (error == null || error.isNull()) {
            return null;
        }
        String message = error.isObject() ? error.path("message").asText("") : error.asText("");
        return message.isBlank() ? "error" : message;
    }

    record ProbeRequest(String url, Map<String, String> headers, Map<String, Object> body) {

        static ProbeRequest of(String baseUrl, String apiKey, String model, ProbeDialect dialect) {
            Map<String, Object> body = new LinkedHashMap<>();
            return switch (dialect) {
                case ANTHROPIC -> {
                    body.put("model", model);
                    body.put("messages", List.of(Map.of("role", "user", "content", PROMPT)));
                    body.put("max_tokens", 1);
                    yield new ProbeRequest(baseUrl + "/v1/messages", Map.of(
                        "x-api-key", apiKey,
                        "anthropic-version", "2023-06-01"
                    ), body);
                }
                case GEMINI -> {
                    body.put("contents", List.of(Map.of("parts", List.of(Map.of("text", PROMPT)))));
                    body.put("generationConfig", Map.of("maxOutputTokens", 1));
                    yield new ProbeRequest(baseUrl + "/v1beta/models/" + model + ":generateContent?key=" + apiKey, Map.of(), body);
                }
                case OPENAI_RESPONSES -> {
                    body.put("model", model);
                    body.put("input", List.of(Map.of(
                        "role", "user",
                        "content", List.of(Map.of("type", "input_text", "text", PROMPT))
                    )));
                    body.put("max_output_tokens", 1);
                    body.put("store", false);
                    yield new ProbeRequest(baseUrl + "/v1/responses", Map.of("Authorization", "Bearer " + apiKey), body);
                }
                case OPENAI_CHAT -> {
                    body.put("model", model);
                    body.put("messages", List.of(Map.of("role", "user", "content", PROMPT)));
                    body.put("max_tokens", 1);
                    yield new ProbeRequest(baseUrl + "/v1/chat/completions", Map.of("Authorization", "Bearer " + apiKey), body);
                }
            };
        }
    }
}

package io.gatesync.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-over-HTTP transport shared by every upstream and target client.
 *
 * <p>Transient failures (I/O errors including timeouts, HTTP 429 and 5xx) are retried with
 * exponential backoff. Any other non-2xx status aborts immediately without consuming the
 * remaining attempts.
 */
public final class JsonHttpClient {
    private static final Logger LOG = LoggerFactory.getLogger(JsonHttpClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long MAX_BACKOFF_MS = 10_000;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;
    private final long initialBackoffMs;

    public JsonHttpClient(OkHttpClient client, ObjectMapper mapper) {
        this(client, mapper, 3, Duration.ofMillis(500));
    }

    public JsonHttpClient(OkHttpClient client, ObjectMapper mapper, int maxAttempts, Duration initialBackoff) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoff.toMillis());
    }

    public static OkHttpClient defaultClient(Duration callTimeout) {
        return new OkHttpClient.Builder()
            .callTimeout(callTimeout)
            .connectTimeout(callTimeout)
            .readTimeout(callTimeout)
            .writeTimeout(callTimeout)
            .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode get(String url, Map<String, String> headers) {
        return send("GET", url, headers, null);
    }

    public JsonNode post(String url, Map<String, String> headers, Object body) {
        return send("POST", url, headers, body);
    }

    public JsonNode put(String url, Map<String, String> headers, Object body) {
        return send("PUT", url, headers, body);
    }

    public JsonNode delete(String url, Map<String, String> headers) {
        return send("DELETE", url, headers, null);
    }

    public JsonNode send(String method, String url, Map<String, String> headers, Object body) {
        Request request = buildRequest(method, url, headers, body);
        long delayMs = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return execute(request);
            } catch (TransportException e) {
                if (!e.retriable() || attempt >= maxAttempts) {
                    throw e;
                }
                LOG.debug("{} {} failed (attempt {}/{}): {}", method, redact(request.url()), attempt, maxAttempts, e.getMessage());
                sleep(delayMs);
                delayMs = Math.min(Math.max(delayMs * 2, 1), MAX_BACKOFF_MS);
            }
        }
    }

    private JsonNode execute(Request request) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new HttpStatusException(request.method(), redact(request.url()), response.code(), raw);
            }
            return parse(raw, request);
        } catch (IOException e) {
            throw new TransportException(
                request.method() + " " + redact(request.url()) + " failed: " + e.getMessage(),
                true,
                e
            );
        }
    }

    private JsonNode parse(String raw, Request request) {
        if (raw == null || raw.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new TransportException(
                request.method() + " " + redact(request.url()) + " returned invalid JSON",
                false,
                e
            );
        }
    }

    private Request buildRequest(String method, String url, Map<String, String> headers, Object body) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new TransportException("Invalid URL: " + url, false);
        }
        RequestBody requestBody = null;
        if (requiresBody(method)) {
            try {
                requestBody = RequestBody.create(mapper.writeValueAsString(body == null ? Map.of() : body), JSON);
            } catch (JsonProcessingException e) {
                throw new TransportException("Failed to serialize request body for " + url, false, e);
            }
        }
        Request.Builder builder = new Request.Builder().url(parsed);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        return builder.method(method, requestBody).build();
    }

    private boolean requiresBody(String method) {
        return "POST".equalsIgnoreCase(method)
            || "PUT".equalsIgnoreCase(method)
            || "PATCH".equalsIgnoreCase(method);
    }

    // Gemini-style probes carry the API key as a query parameter.
    private static String redact(HttpUrl url) {
        if (url.queryParameter("key") == null) {
            return url.toString();
        }
        return url.newBuilder().setQueryParameter("key", "***").build().toString();
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting to retry", false, ie);
        }
    }
}

package io.gatesync.core.catalog;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

public final class EndpointTypes {
    public static final String OPENAI = "openai";
    public static final String OPENAI_RESPONSE = "openai-response";
    public static final String OPENAI_RESPONSE_COMPACT = "openai-response-compact";
    public static final String ANTHROPIC = "anthropic";
    public static final String GEMINI = "gemini";

    public static final Set<String> TEXT = Set.of(
        OPENAI,
        ANTHROPIC,
        GEMINI,
        OPENAI_RESPONSE,
        OPENAI_RESPONSE_COMPACT
    );

    public static final Map<String, String> DEFAULT_PATHS = Map.of(
        OPENAI, "/v1/chat/completions",
        OPENAI_RESPONSE, "/v1/responses",
        OPENAI_RESPONSE_COMPACT, "/v1/responses/compact",
        ANTHROPIC, "/v1/messages",
        GEMINI, "/v1beta/models/{model}:generateContent",
        "jina-rerank", "/v1/rerank",
        "image-generation", "/v1/images/generations",
        "embedding", "/v1/embeddings"
    );

    private EndpointTypes() {
    }

    /**
     * Upstreams spell a few endpoint kinds differently from the target.
     */
    public static String normalize(String endpointType) {
        if (endpointType == null) {
            return "";
        }
        String value = endpointType.trim().toLowerCase();
        return switch (value) {
            case "openai_response", "responses", "openai-responses" -> OPENAI_RESPONSE;
            case "claude" -> ANTHROPIC;
            case "embeddings" -> "embedding";
            default -> value;
        };
    }

    public static boolean anyText(Collection<String> endpoints) {
        return endpoints.stream().map(EndpointTypes::normalize).anyMatch(TEXT::contains);
    }
}

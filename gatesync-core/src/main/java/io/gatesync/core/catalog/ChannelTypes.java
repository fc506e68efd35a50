package io.gatesync.core.catalog;

import java.util.Collection;

/**
 * Channel type identifiers understood by the target gateway.
 */
public final class ChannelTypes {
    public static final int UNKNOWN = 0;
    public static final int OPENAI = 1;
    public static final int ANTHROPIC = 14;
    public static final int ALI = 17;
    public static final int GEMINI = 24;
    public static final int MOONSHOT = 25;
    public static final int ZHIPU_V4 = 26;
    public static final int PERPLEXITY = 27;
    public static final int COHERE = 34;
    public static final int MINIMAX = 35;
    public static final int JINA = 38;
    public static final int CLOUDFLARE = 39;
    public static final int SILICONFLOW = 40;
    public static final int MISTRAL = 42;
    public static final int DEEPSEEK = 43;
    public static final int VOLCENGINE = 45;
    public static final int XAI = 48;
    public static final int SORA = 55;
    public static final int CODEX = 57;

    private ChannelTypes() {
    }

    /**
     * Picks a channel type from the endpoint kinds a group or model set supports.
     */
    public static int fromEndpoints(Collection<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            return OPENAI;
        }
        if (endpoints.contains("jina-rerank")) {
            return JINA;
        }
        if (endpoints.contains("openai-video")) {
            return SORA;
        }
        if (endpoints.contains(EndpointTypes.ANTHROPIC)) {
            return ANTHROPIC;
        }
        if (endpoints.contains(EndpointTypes.GEMINI)) {
            return GEMINI;
        }
        return OPENAI;
    }

    public static int fromPlatform(String platform) {
        if (platform == null) {
            return OPENAI;
        }
        return switch (platform.toLowerCase()) {
            case "anthropic" -> ANTHROPIC;
            case "gemini", "antigravity" -> GEMINI;
            default -> OPENAI;
        };
    }
}

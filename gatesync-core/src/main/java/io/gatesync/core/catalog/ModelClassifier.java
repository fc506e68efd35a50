package io.gatesync.core.catalog;

import java.util.List;

public final class ModelClassifier {
    public static final String TYPE_CHAT = "chat";
    public static final String TYPE_REASONING = "reasoning";

    private static final List<String> NON_TEXT_PATTERNS = List.of(
        // image
        "dall-e", "dalle", "gpt-image", "imagen", "midjourney", "stable-diffusion", "flux", "seedream", "jimeng",
        // video
        "sora", "veo", "video", "kling", "vidu", "hailuo", "seedance", "t2v-", "i2v-", "s2v-", "wan2", "wanx",
        // audio
        "whisper", "tts", "speech", "suno",
        // embeddings and reranking
        "embedding", "embed", "rerank", "bge-", "m3e-",
        "image", "moderation"
    );

    private static final List<String> REASONING_PATTERNS = List.of(
        "o1-", "o3-", "o4-", "reasoner", "thinking", "-r1", "qwq-"
    );

    private ModelClassifier() {
    }

    public static boolean matchesNonTextPattern(String modelName) {
        String name = modelName.toLowerCase();
        return NON_TEXT_PATTERNS.stream().anyMatch(name::contains);
    }

    /**
     * A model is text-capable unless its name looks like an image, video, audio or embedding
     * model. When the upstream advertises endpoint kinds, at least one of them must be a text
     * endpoint.
     */
    public static boolean isTextModel(String modelName, List<String> endpoints) {
        if (matchesNonTextPattern(modelName)) {
            return false;
        }
        if (endpoints != null && !endpoints.isEmpty()) {
            return EndpointTypes.anyText(endpoints);
        }
        return true;
    }

    public static boolean isTextModel(String modelName) {
        return isTextModel(modelName, null);
    }

    public static String modelType(String modelName) {
        String name = modelName.toLowerCase();
        if (name.startsWith("o1") || name.startsWith("o3") || name.startsWith("o4")) {
            return TYPE_REASONING;
        }
        return REASONING_PATTERNS.stream().anyMatch(name::contains) ? TYPE_REASONING : TYPE_CHAT;
    }
}

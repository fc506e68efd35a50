package io.gatesync.core.catalog;

import io.gatesync.core.catalog.VendorInfo.DiscoveryDialect;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Vendor lookups: which vendor a model name belongs to, how to reach a vendor directly,
 * and which localized labels a target may use for a vendor.
 */
public final class VendorCatalog {

    private static final Map<String, VendorInfo> REGISTRY = new LinkedHashMap<>();
    private static final Map<String, List<String>> MODEL_PATTERNS = new LinkedHashMap<>();
    private static final Map<String, List<String>> NAME_ALIASES = new LinkedHashMap<>();
    private static final Map<String, List<String>> VENDOR_PLATFORMS = Map.of(
        "google", List.of("gemini", "antigravity"),
        "anthropic", List.of("anthropic"),
        "openai", List.of("openai")
    );

    static {
        REGISTRY.put("openai", new VendorInfo(ChannelTypes.OPENAI, "https://api.openai.com", DiscoveryDialect.OPENAI));
        REGISTRY.put("anthropic", new VendorInfo(ChannelTypes.ANTHROPIC, "https://api.anthropic.com", DiscoveryDialect.ANTHROPIC));
        REGISTRY.put("google", new VendorInfo(ChannelTypes.GEMINI, "https://generativelanguage.googleapis.com", DiscoveryDialect.GEMINI));
        REGISTRY.put("deepseek", new VendorInfo(ChannelTypes.DEEPSEEK, "https://api.deepseek.com", DiscoveryDialect.OPENAI));
        REGISTRY.put("moonshot", new VendorInfo(ChannelTypes.MOONSHOT, "https://api.moonshot.cn", DiscoveryDialect.OPENAI));
        REGISTRY.put("mistral", new VendorInfo(ChannelTypes.MISTRAL, "https://api.mistral.ai", DiscoveryDialect.OPENAI));
        REGISTRY.put("xai", new VendorInfo(ChannelTypes.XAI, "https://api.x.ai", DiscoveryDialect.OPENAI));
        REGISTRY.put("siliconflow", new VendorInfo(ChannelTypes.SILICONFLOW, "https://api.siliconflow.cn", DiscoveryDialect.OPENAI));
        REGISTRY.put("cohere", new VendorInfo(ChannelTypes.COHERE, "https://api.cohere.ai", DiscoveryDialect.OPENAI));
        REGISTRY.put("zhipu", new VendorInfo(ChannelTypes.ZHIPU_V4, "https://open.bigmodel.cn", DiscoveryDialect.OPENAI));
        REGISTRY.put("volcengine", new VendorInfo(ChannelTypes.VOLCENGINE, "https://ark.cn-beijing.volces.com", DiscoveryDialect.OPENAI));
        REGISTRY.put("minimax", new VendorInfo(ChannelTypes.MINIMAX, "https://api.minimax.chat", DiscoveryDialect.OPENAI));
        REGISTRY.put("perplexity", new VendorInfo(ChannelTypes.PERPLEXITY, "https://api.perplexity.ai", DiscoveryDialect.OPENAI));

        // Order matters: the first vendor whose pattern occurs in the model name wins.
        MODEL_PATTERNS.put("anthropic", List.of("claude"));
        MODEL_PATTERNS.put("google", List.of("gemini", "palm"));
        MODEL_PATTERNS.put("openai", List.of("gpt", "o1-", "o3-", "o4-", "chatgpt"));
        MODEL_PATTERNS.put("deepseek", List.of("deepseek"));
        MODEL_PATTERNS.put("xai", List.of("grok"));
        MODEL_PATTERNS.put("mistral", List.of("mistral", "codestral"));
        MODEL_PATTERNS.put("meta", List.of("llama"));
        MODEL_PATTERNS.put("alibaba", List.of("qwen", "qwq-"));
        MODEL_PATTERNS.put("cohere", List.of("command-", "c4ai-"));
        MODEL_PATTERNS.put("minimax", List.of("abab", "minimax-"));
        MODEL_PATTERNS.put("moonshot", List.of("moonshot-", "kimi-"));
        MODEL_PATTERNS.put("zhipu", List.of("glm-", "chatglm"));
        MODEL_PATTERNS.put("perplexity", List.of("sonar"));
        MODEL_PATTERNS.put("baidu", List.of("ernie-"));
        MODEL_PATTERNS.put("xunfei", List.of("sparkdesk"));
        MODEL_PATTERNS.put("tencent", List.of("hunyuan-"));
        MODEL_PATTERNS.put("bytedance", List.of("doubao-"));
        MODEL_PATTERNS.put("yi", List.of("yi-"));
        MODEL_PATTERNS.put("ai360", List.of("360gpt"));

        NAME_ALIASES.put("alibaba", List.of("阿里", "通义", "qwen"));
        NAME_ALIASES.put("moonshot", List.of("月之暗面", "kimi"));
        NAME_ALIASES.put("zhipu", List.of("智谱", "zhipu ai", "chatglm"));
        NAME_ALIASES.put("baidu", List.of("百度", "文心"));
        NAME_ALIASES.put("xunfei", List.of("讯飞", "spark"));
        NAME_ALIASES.put("tencent", List.of("腾讯", "混元"));
        NAME_ALIASES.put("bytedance", List.of("字节", "豆包", "doubao"));
    }

    private VendorCatalog() {
    }

    public static Optional<String> vendorOf(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            return Optional.empty();
        }
        String name = modelName.toLowerCase();
        for (Map.Entry<String, List<String>> entry : MODEL_PATTERNS.entrySet()) {
            for (String pattern : entry.getValue()) {
                if (name.contains(pattern)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<VendorInfo> info(String vendor) {
        if (vendor == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(vendor.toLowerCase()));
    }

    public static boolean isKnown(String vendor) {
        return info(vendor).isPresent();
    }

    public static Map<String, List<String>> nameAliases() {
        return NAME_ALIASES;
    }

    /**
     * Account-pool upstreams name their pools by platform rather than vendor.
     */
    public static List<String> platformsFor(String vendor) {
        String key = vendor.toLowerCase();
        return VENDOR_PLATFORMS.getOrDefault(key, List.of(key));
    }

    /**
     * Channel type for a set of models: the most common vendor's registered channel type,
     * falling back to the endpoint kinds the models advertise.
     */
    public static int channelTypeFor(Collection<String> models, Map<String, List<String>> modelEndpoints) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String model : models) {
            vendorOf(model).ifPresent(vendor -> counts.merge(vendor, 1, Integer::sum));
        }
        String topVendor = null;
        int topCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > topCount) {
                topVendor = entry.getKey();
                topCount = entry.getValue();
            }
        }
        if (topVendor != null) {
            Optional<VendorInfo> info = info(topVendor);
            if (info.isPresent()) {
                return info.get().channelType();
            }
        }
        Set<String> endpoints = new LinkedHashSet<>();
        for (String model : models) {
            List<String> eps = modelEndpoints.get(model);
            if (eps != null) {
                eps.stream().map(EndpointTypes::normalize).forEach(endpoints::add);
            }
        }
        return ChannelTypes.fromEndpoints(endpoints);
    }
}

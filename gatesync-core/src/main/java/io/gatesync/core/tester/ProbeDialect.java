package io.gatesync.core.tester;

import io.gatesync.core.catalog.ChannelTypes;

/**
 * Request shape used to probe a model.
 */
public enum ProbeDialect {
    OPENAI_CHAT,
    OPENAI_RESPONSES,
    ANTHROPIC,
    GEMINI;

    public static ProbeDialect forChannelType(int channelType, boolean preferResponses) {
        if (channelType == ChannelTypes.ANTHROPIC) {
            return ANTHROPIC;
        }
        if (channelType == ChannelTypes.GEMINI) {
            return GEMINI;
        }
        return preferResponses ? OPENAI_RESPONSES : OPENAI_CHAT;
    }
}

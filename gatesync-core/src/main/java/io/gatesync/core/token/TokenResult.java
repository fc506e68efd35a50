package io.gatesync.core.token;

import java.util.Map;

/**
 * Keys by group name for every group that ended up with a usable token.
 */
public record TokenResult(Map<String, String> tokens, Map<String, String> tokenNames, int created, int existing, int deleted) {
    public TokenResult {
        tokens = Map.copyOf(tokens);
        tokenNames = Map.copyOf(tokenNames);
    }
}

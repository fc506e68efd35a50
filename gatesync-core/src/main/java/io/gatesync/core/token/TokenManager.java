package io.gatesync.core.token;

import io.gatesync.core.catalog.ResourceNames;
import io.gatesync.core.http.TransportException;
import io.gatesync.core.upstream.UpstreamToken;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps exactly one upstream token per (provider, group), named
 * {@code <sanitized group>-<provider>}.
 */
public final class TokenManager {
    private static final Logger LOG = LoggerFactory.getLogger(TokenManager.class);

    private final TokenStore store;
    private final String provider;

    public TokenManager(TokenStore store, String provider) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    /**
     * Deterministic token names for the given groups. Groups are named in sorted order so that
     * collision counters do not depend on upstream ordering.
     */
    public Map<String, String> desiredNames(Collection<String> groups) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (String group : new TreeSet<>(groups)) {
            String name = ResourceNames.tokenName(group, provider, taken);
            taken.add(name);
            names.put(group, name);
        }
        return names;
    }

    public TokenResult ensureTokens(Collection<String> groups) {
        List<UpstreamToken> existingTokens = store.listTokens();
        Map<String, UpstreamToken> byName = existingTokens.stream()
            .collect(Collectors.toMap(UpstreamToken::name, Function.identity(), (first, second) -> first, LinkedHashMap::new));
        Map<String, String> desired = desiredNames(groups);
        Set<String> desiredNames = new HashSet<>(desired.values());
        String suffix = ResourceNames.tokenSuffix(provider);

        int deleted = 0;
        for (UpstreamToken token : existingTokens) {
            if (!token.name().endsWith(suffix) || desiredNames.contains(token.name())) {
                continue;
            }
            try {
                store.deleteToken(token.id());
                deleted++;
                LOG.info("[{}] Deleted stale token {}", provider, token.name());
            } catch (TransportException e) {
                LOG.warn("[{}] Failed to delete stale token {}: {}", provider, token.name(), e.getMessage());
            }
        }

        Map<String, String> keys = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        int created = 0;
        int existing = 0;
        for (Map.Entry<String, String> entry : desired.entrySet()) {
            String group = entry.getKey();
            String tokenName = entry.getValue();
            UpstreamToken token = byName.get(tokenName);
            if (token != null) {
                existing++;
            } else {
                Optional<UpstreamToken> fresh = create(tokenName, group);
                if (fresh.isEmpty()) {
                    continue;
                }
                created++;
                token = fresh.get();
            }
            if (token.apiKey().isEmpty()) {
                LOG.warn("[{}] Token {} has no key, skipping group {}", provider, tokenName, group);
                continue;
            }
            keys.put(group, token.apiKey());
            names.put(group, tokenName);
        }
        return new TokenResult(keys, names, created, existing, deleted);
    }

    public boolean deleteToken(String tokenName) {
        for (UpstreamToken token : store.listTokens()) {
            if (token.name().equals(tokenName)) {
                try {
                    store.deleteToken(token.id());
                    return true;
                } catch (TransportException e) {
                    LOG.warn("[{}] Failed to delete token {}: {}", provider, tokenName, e.getMessage());
                    return false;
                }
            }
        }
        return false;
    }

    /**
     * Deletes every token carrying this provider's suffix.
     */
    public int deleteAll() {
        String suffix = ResourceNames.tokenSuffix(provider);
        int deleted = 0;
        for (UpstreamToken token : store.listTokens()) {
            if (!token.name().endsWith(suffix)) {
                continue;
            }
            try {
                store.deleteToken(token.id());
                deleted++;
            } catch (TransportException e) {
                LOG.warn("[{}] Failed to delete token {}: {}", provider, token.name(), e.getMessage());
            }
        }
        return deleted;
    }

    // Some upstreams never return the secret on create, so the token is re-listed.
    private Optional<UpstreamToken> create(String tokenName, String group) {
        Optional<UpstreamToken> fresh;
        try {
            store.createToken(tokenName, group);
            fresh = store.listTokens().stream()
                .filter(token -> token.name().equals(tokenName))
                .findFirst();
        } catch (TransportException e) {
            LOG.warn("[{}] Token create failed for group {}: {}", provider, group, e.getMessage());
            return Optional.empty();
        }
        if (fresh.isEmpty()) {
            LOG.warn("[{}] Token {} created but not found", provider, tokenName);
        } else {
            LOG.info("[{}] Created token {}", provider, tokenName);
        }
        return fresh;
    }
}

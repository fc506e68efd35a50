package io.gatesync.core.catalog;

import java.util.Set;

/**
 * Channel and token names are identity keys on both the upstream and the target, so they are
 * built deterministically: non-ASCII characters are dropped, repeated hyphens collapsed and the
 * result bounded in length. Two inputs that sanitize to the same name are told apart by a
 * numeric suffix, first-seen wins.
 */
public final class ResourceNames {
    public static final int TOKEN_NAME_MAX = 30;
    /**
     * Leaves room in a token name for at least a short group name and a collision counter.
     */
    public static final int PROVIDER_NAME_MAX = TOKEN_NAME_MAX - 10;
    private static final String FALLBACK = "group";

    private ResourceNames() {
    }

    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder ascii = new StringBuilder(name.length());
        name.codePoints()
            .filter(cp -> cp < 0x80)
            .forEach(ascii::appendCodePoint);
        return ascii.toString()
            .trim()
            .replaceAll("\\s+", "-")
            .replaceAll("-+", "-")
            .replaceAll("^-|-$", "");
    }

    public static String tokenSuffix(String provider) {
        return "-" + provider;
    }

    /**
     * Token name for a group: sanitized group name truncated so that {@code name + "-" + provider}
     * fits {@link #TOKEN_NAME_MAX}, then disambiguated against {@code taken}.
     */
    public static String tokenName(String groupName, String provider, Set<String> taken) {
        String suffix = tokenSuffix(provider);
        String base = sanitize(groupName);
        if (base.isEmpty()) {
            base = FALLBACK;
        }
        int room = Math.max(1, TOKEN_NAME_MAX - suffix.length());
        String candidate = truncate(base, room) + suffix;
        for (int n = 2; taken.contains(candidate); n++) {
            String counter = String.valueOf(n);
            candidate = truncate(base, Math.max(1, room - counter.length())) + counter + suffix;
        }
        return candidate;
    }

    /**
     * Channel name for an upstream group: {@code sanitize(group + "-" + provider)}, disambiguated
     * against {@code taken}.
     */
    public static String channelName(String groupName, String provider, Set<String> taken) {
        String base = sanitize(groupName + "-" + provider);
        if (base.isEmpty() || base.equals(sanitize(provider))) {
            base = sanitize(FALLBACK + "-" + provider);
        }
        String candidate = base;
        for (int n = 2; taken.contains(candidate); n++) {
            candidate = base + "-" + n;
        }
        return candidate;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}

package io.gatesync.core.catalog;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Name matching used by allow-lists and blacklists.
 */
public final class ModelPatterns {

    private ModelPatterns() {
    }

    /**
     * Case-insensitive match. Patterns without {@code *} or {@code ?} are substring matches,
     * otherwise the whole name must match the glob.
     */
    public static boolean matchesGlob(String name, String pattern) {
        String n = name.toLowerCase();
        String p = pattern.toLowerCase();
        if (p.indexOf('*') < 0 && p.indexOf('?') < 0) {
            return n.contains(p);
        }
        return globToRegex(p).matcher(n).matches();
    }

    public static boolean matchesAny(String name, Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        return patterns.stream().anyMatch(pattern -> matchesGlob(name, pattern));
    }

    /**
     * Blacklist entries are either global ({@code pattern}) or scoped to one provider
     * ({@code provider/pattern}). A scoped entry only applies when {@code provider} equals the
     * given scope. Matching is a case-insensitive substring test.
     */
    public static boolean blacklisted(String text, Collection<String> blacklist, String scope) {
        if (text == null || text.isEmpty() || blacklist == null || blacklist.isEmpty()) {
            return false;
        }
        String t = text.toLowerCase();
        String s = scope == null ? null : scope.toLowerCase();
        for (String raw : blacklist) {
            String entry = raw.toLowerCase();
            int slash = entry.indexOf('/');
            if (slash < 0) {
                if (t.contains(entry)) {
                    return true;
                }
                continue;
            }
            if (s != null && s.equals(entry.substring(0, slash)) && t.contains(entry.substring(slash + 1))) {
                return true;
            }
        }
        return false;
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}

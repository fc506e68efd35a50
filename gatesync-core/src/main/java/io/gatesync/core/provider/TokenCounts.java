package io.gatesync.core.provider;

public record TokenCounts(int created, int existing, int deleted) {
    public static final TokenCounts NONE = new TokenCounts(0, 0, 0);

    public TokenCounts plusDeleted(int count) {
        return new TokenCounts(created, existing, deleted + count);
    }
}

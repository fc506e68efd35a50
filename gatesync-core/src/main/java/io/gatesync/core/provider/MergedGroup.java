package io.gatesync.core.provider;

public record MergedGroup(String name, double ratio, String description, String provider) {
}

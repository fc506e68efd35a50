package io.gatesync.core.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigPaths {
    private static final List<String> LOCAL_NAMES = List.of("gatesync.json", "config.json");

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".gatesync", "config.json");
    }

    public static Path resolve(Path explicit) {
        return resolve(explicit, Path.of("").toAbsolutePath(), defaultConfigPath());
    }

    /**
     * An explicit path always wins, even if it does not exist; otherwise the first local file
     * found in {@code workingDir}, falling back to {@code fallback}.
     */
    public static Path resolve(Path explicit, Path workingDir, Path fallback) {
        if (explicit != null) {
            return expandHome(explicit.toString());
        }
        for (String name : LOCAL_NAMES) {
            Path candidate = workingDir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return fallback;
    }

    static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}

package io.gatesync.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigPathsTest {

    @TempDir
    Path workingDir;

    @Test
    void shouldPreferExplicitPathEvenWhenMissing() {
        Path explicit = workingDir.resolve("custom.json");

        assertThat(ConfigPaths.resolve(explicit, workingDir, Path.of("fallback.json"))).isEqualTo(explicit);
    }

    @Test
    void shouldPickLocalFileBeforeFallback() throws Exception {
        Files.writeString(workingDir.resolve("config.json"), "{}");
        Files.writeString(workingDir.resolve("gatesync.json"), "{}");

        assertThat(ConfigPaths.resolve(null, workingDir, Path.of("fallback.json")))
            .isEqualTo(workingDir.resolve("gatesync.json"));
    }

    @Test
    void shouldFallBackWhenNoLocalFile() {
        Path fallback = Path.of("fallback.json");

        assertThat(ConfigPaths.resolve(null, workingDir, fallback)).isEqualTo(fallback);
    }

    @Test
    void shouldExpandHomeDirectory() {
        assertThat(ConfigPaths.expandHome("~/gs/config.json"))
            .isEqualTo(Path.of(System.getProperty("user.home"), "gs", "config.json"));
    }
}

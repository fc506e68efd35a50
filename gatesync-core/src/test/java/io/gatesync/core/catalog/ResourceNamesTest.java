package io.gatesync.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResourceNamesTest {

    @Test
    void shouldDropNonAsciiAndCollapseSeparators() {
        assertThat(ResourceNames.sanitize("Claude 官方  Pro")).isEqualTo("Claude-Pro");
        assertThat(ResourceNames.sanitize(" --vip-- ")).isEqualTo("vip");
        assertThat(ResourceNames.sanitize(null)).isEmpty();
    }

    @Test
    void shouldBoundTokenNameLength() {
        String name = ResourceNames.tokenName("a".repeat(40), "prov", Set.of());

        assertThat(name).hasSize(ResourceNames.TOKEN_NAME_MAX).endsWith("-prov");
    }

    @Test
    void shouldStayWithinLimitForLongestAllowedProviderName() {
        String provider = "p".repeat(ResourceNames.PROVIDER_NAME_MAX);
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < 120; i++) {
            String name = ResourceNames.tokenName("shared group name", provider, taken);
            assertThat(name).hasSizeLessThanOrEqualTo(ResourceNames.TOKEN_NAME_MAX).endsWith("-" + provider);
            assertThat(taken.add(name)).isTrue();
        }
    }

    @Test
    void shouldDisambiguateTokenNames() {
        String first = ResourceNames.tokenName("Claude Pro", "p1", Set.of());
        String second = ResourceNames.tokenName("Claude 官方 Pro", "p1", Set.of(first));

        assertThat(first).isEqualTo("Claude-Pro-p1");
        assertThat(second).isEqualTo("Claude-Pro2-p1");
    }

    @Test
    void shouldFallBackWhenGroupNameIsUnusable() {
        assertThat(ResourceNames.tokenName("官方", "p1", Set.of())).isEqualTo("group-p1");
        assertThat(ResourceNames.channelName("官方", "p1", Set.of())).isEqualTo("group-p1");
    }

    @Test
    void shouldDisambiguateChannelNames() {
        assertThat(ResourceNames.channelName("g1", "p1", Set.of("g1-p1"))).isEqualTo("g1-p1-2");
        assertThat(ResourceNames.channelName("g1", "p1", Set.of("g1-p1", "g1-p1-2"))).isEqualTo("g1-p1-3");
    }
}

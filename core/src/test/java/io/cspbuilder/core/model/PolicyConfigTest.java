package io.cspbuilder.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link PolicyConfig}: defaults, immutability and option accessors. */
class PolicyConfigTest {

    @Test
    void defaultsMatchDefaultTable() {
        PolicyConfig config = PolicyConfig.defaults();

        assertThat(config.directives())
                .containsExactly(
                        Map.entry(Directives.DEFAULT_SRC, DirectiveValue.sources("'self'")),
                        Map.entry(Directives.UPGRADE_INSECURE_REQUESTS, DirectiveValue.flag(false)),
                        Map.entry(Directives.BLOCK_ALL_MIXED_CONTENT, DirectiveValue.flag(false)));
        assertThat(config.includeNonceIn()).isNull();
        assertThat(config.nonceTargets()).containsExactly("default-src");
        assertThat(config.reportOnly()).isFalse();
        assertThat(config.reportPercentage()).isZero();
        assertThat(config.excludeUrlPrefixes()).isEmpty();
    }

    @Test
    void absentDirectivesAreDropped() {
        Map<String, DirectiveValue> directives = new LinkedHashMap<>();
        directives.put("script-src", null);
        directives.put("img-src", DirectiveValue.sources("*"));

        PolicyConfig config = new PolicyConfig(directives, null, false, 0, null);

        assertThat(config.directives()).containsOnlyKeys("img-src");
    }

    @Test
    void directivesAreCopiedAndUnmodifiable() {
        Map<String, DirectiveValue> directives = new HashMap<>();
        directives.put("img-src", DirectiveValue.sources("*"));
        PolicyConfig config = new PolicyConfig(directives, List.of(), false, 0, List.of());

        directives.put("font-src", DirectiveValue.sources("*"));

        assertThat(config.directives()).containsOnlyKeys("img-src");
        assertThatThrownBy(() -> config.directives().put("x", DirectiveValue.flag(true)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyNonceTargetsAreKept() {
        PolicyConfig config = PolicyConfig.builder().includeNonceIn(List.of()).build();
        assertThat(config.nonceTargets()).isEmpty();
    }

    @Test
    void reportPercentageOutOfRangeIsRejected() {
        assertThatThrownBy(() -> PolicyConfig.builder().reportPercentage(101).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("101");
        assertThatThrownBy(() -> PolicyConfig.builder().reportPercentage(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void headerNameFollowsReportOnly() {
        assertThat(PolicyConfig.defaults().headerName()).isEqualTo("Content-Security-Policy");
        assertThat(PolicyConfig.builder().reportOnly(true).build().headerName())
                .isEqualTo("Content-Security-Policy-Report-Only");
    }

    @Test
    void builderDirectiveNullRemovesAndReplaceKeepsPosition() {
        PolicyConfig config = PolicyConfig.builder()
                .directive("script-src", "'self'")
                .directive("upgrade-insecure-requests", null)
                .directive("default-src", "'none'")
                .build();

        assertThat(config.directives().keySet())
                .containsExactly("default-src", "block-all-mixed-content", "script-src");
        assertThat(config.directives().get("default-src")).isEqualTo(DirectiveValue.sources("'none'"));
    }

    @Test
    void toBuilderRoundTripsEveryOption() {
        PolicyConfig original = PolicyConfig.builder()
                .clearDirectives()
                .directive("img-src", "*")
                .includeNonceIn("script-src")
                .reportOnly(true)
                .reportPercentage(40)
                .excludeUrlPrefixes(List.of("/admin"))
                .build();

        assertThat(original.toBuilder().build()).isEqualTo(original);
    }

    @Test
    void knownDirectivesAreInformational() {
        assertThat(Directives.isKnown("script-src")).isTrue();
        assertThat(Directives.isKnown("x-custom")).isFalse();
        assertThat(Directives.KNOWN).startsWith("child-src", "connect-src", "default-src");
        assertThat(Directives.KNOWN).endsWith("upgrade-insecure-requests", "block-all-mixed-content");
    }
}

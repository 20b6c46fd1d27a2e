package com.veil.blocklist.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatcherConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(MatcherConfig.ENV_MAX_PATTERNS);
        System.clearProperty(MatcherConfig.ENV_FALSE_POSITIVE_RATE);
        System.clearProperty(MatcherConfig.ENV_MAX_PATTERN_LENGTH);
    }

    @Test
    @DisplayName("Defaults match the documented limits")
    void defaults() {
        MatcherConfig config = MatcherConfig.defaults();

        assertThat(config.getMaxPatterns()).isEqualTo(100_000);
        assertThat(config.getExpectedPatterns()).isEqualTo(100_000);
        assertThat(config.getFalsePositiveRate()).isEqualTo(0.01);
        assertThat(config.getHashFunctions()).isEqualTo(7);
        assertThat(config.getMaxPatternLength()).isEqualTo(512);
        assertThat(config.getBloomFilterBits()).isEmpty();
    }

    @Test
    @DisplayName("System properties override defaults when no environment variable is set")
    void systemPropertyOverrides() {
        System.setProperty(MatcherConfig.ENV_MAX_PATTERNS, "250");
        System.setProperty(MatcherConfig.ENV_FALSE_POSITIVE_RATE, "0.001");

        MatcherConfig config = MatcherConfig.fromEnvironment();

        assertThat(config.getMaxPatterns()).isEqualTo(250);
        assertThat(config.getFalsePositiveRate()).isEqualTo(0.001);
    }

    @Test
    @DisplayName("Unparseable overrides are ignored")
    void invalidOverrideIgnored() {
        System.setProperty(MatcherConfig.ENV_MAX_PATTERN_LENGTH, "lots");

        assertThat(MatcherConfig.fromEnvironment().getMaxPatternLength()).isEqualTo(512);
    }

    @Test
    @DisplayName("Explicit builder values win over overrides")
    void builderWins() {
        System.setProperty(MatcherConfig.ENV_MAX_PATTERNS, "250");

        MatcherConfig config = MatcherConfig.builder().maxPatterns(10).build();

        assertThat(config.getMaxPatterns()).isEqualTo(10);
    }

    @Test
    @DisplayName("toBuilder copies every value")
    void toBuilderCopies() {
        MatcherConfig original = MatcherConfig.defaults().toBuilder()
                .bloomFilterBits(4096)
                .hashFunctions(5)
                .build();

        MatcherConfig copy = original.toBuilder().build();

        assertThat(copy.getBloomFilterBits()).contains(4096);
        assertThat(copy.getHashFunctions()).isEqualTo(5);
        assertThat(copy.toString()).isEqualTo(original.toString());
    }

    @Test
    @DisplayName("Invalid values are rejected at build time")
    void validation() {
        MatcherConfig.Builder builder = MatcherConfig.defaults().toBuilder();

        assertThatThrownBy(() -> builder.maxPatterns(0).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatcherConfig.defaults().toBuilder().falsePositiveRate(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatcherConfig.defaults().toBuilder().bloomFilterBits(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatcherConfig.defaults().toBuilder().maxPatternLength(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}

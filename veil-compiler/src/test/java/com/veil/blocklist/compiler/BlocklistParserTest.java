package com.veil.blocklist.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

class BlocklistParserTest {

    @Test
    @DisplayName("Keeps network rules and counts comments and headers")
    void keepsNetworkRules() {
        String text = """
                [Adblock Plus 2.0]
                ! Title: Test list
                ! Expires: 4 days
                # hosts-style comment

                ||google-analytics.com^
                *://*.hotjar.com/*
                /ads/banner
                """;

        BlocklistParseResult result = BlocklistParser.parse(text);

        assertThat(result.patterns()).containsExactly("||google-analytics.com^", "*://*.hotjar.com/*", "/ads/banner");
        assertThat(result.commentLines()).isEqualTo(4);
        assertThat(result.skippedLines()).isZero();
    }

    @Test
    @DisplayName("Skips cosmetic, exception and option rules")
    void skipsUnsupportedRules() {
        String text = """
                example.com##.ad-banner
                ##div[id^="ad"]
                example.com#@#.sponsored
                example.com#?#div:-abp-has(.ad)
                @@||cdn.example.com^
                ||ads.example.com^$third-party
                /banner/*$image,domain=news.com
                ||tracker.net^
                """;

        BlocklistParseResult result = BlocklistParser.parse(text);

        assertThat(result.patterns()).containsExactly("||tracker.net^");
        assertThat(result.skippedLines()).isEqualTo(7);
        assertThat(result.commentLines()).isZero();
    }

    @Test
    @DisplayName("Converts hosts-file lines to domain anchors")
    void convertsHostsLines() {
        String text = """
                127.0.0.1 localhost
                0.0.0.0 ads.example.com
                127.0.0.1\tTracker.NET  # inline comment
                0.0.0.0 a.com b.com
                """;

        BlocklistParseResult result = BlocklistParser.parse(text);

        assertThat(result.patterns()).containsExactly(
                "||ads.example.com^", "||tracker.net^", "||a.com^", "||b.com^");
        assertThat(result.skippedLines()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reads from a Reader")
    void readsFromReader() throws IOException {
        BlocklistParseResult result = BlocklistParser.parse(new StringReader("||a.com^\r\n||b.com^\r\n"));

        assertThat(result.patterns()).containsExactly("||a.com^", "||b.com^");
    }

    @Test
    @DisplayName("Empty input yields an empty result")
    void emptyInput() {
        BlocklistParseResult result = BlocklistParser.parse("");

        assertThat(result.patterns()).isEmpty();
        assertThat(result.commentLines()).isZero();
        assertThat(result.skippedLines()).isZero();
    }
}

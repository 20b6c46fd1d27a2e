package com.veil.blocklist.activity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.veil.blocklist.api.model.BlockDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class JsonActivityLogSinkTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Writes one JSON object per decision with an ISO-8601 timestamp")
    void writesJsonLines() throws IOException {
        StringWriter out = new StringWriter();
        JsonActivityLogSink sink = new JsonActivityLogSink(out);

        sink.record(BlockDecision.blocked("https://www.google-analytics.com/collect", "www.google-analytics.com",
                BlockDecision.Reason.PATTERN, NOW));
        sink.record(BlockDecision.allowed("https://example.org/", "example.org", NOW));

        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(2);

        JsonNode first = mapper.readTree(lines[0]);
        assertThat(first.get("url").asText()).isEqualTo("https://www.google-analytics.com/collect");
        assertThat(first.get("host").asText()).isEqualTo("www.google-analytics.com");
        assertThat(first.get("blocked").asBoolean()).isTrue();
        assertThat(first.get("reason").asText()).isEqualTo("PATTERN");
        assertThat(first.get("timestamp").asText()).isEqualTo("2025-03-01T12:00:00Z");

        JsonNode second = mapper.readTree(lines[1]);
        assertThat(second.get("blocked").asBoolean()).isFalse();
        assertThat(second.get("reason").asText()).isEqualTo("NONE");
    }

    @Test
    @DisplayName("Appends to an existing file")
    void appendsToFile() throws IOException {
        Path log = tempDir.resolve("activity.jsonl");
        Files.writeString(log, "{\"existing\":true}\n");

        try (JsonActivityLogSink sink = JsonActivityLogSink.open(log)) {
            sink.record(BlockDecision.blocked("https://ads.com/x", "ads.com", BlockDecision.Reason.CUSTOM_RULE, NOW));
        }

        List<String> lines = Files.readAllLines(log);
        assertThat(lines).hasSize(2);
        assertThat(mapper.readTree(lines.get(1)).get("reason").asText()).isEqualTo("CUSTOM_RULE");
    }

    @Test
    @DisplayName("Write failures are contained")
    void writeFailureContained() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        JsonActivityLogSink sink = new JsonActivityLogSink(broken);

        assertThatCode(() -> sink.record(BlockDecision.allowed("https://a.com/", "a.com", NOW)))
                .doesNotThrowAnyException();
    }
}

package com.veil.blocklist.activity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.veil.blocklist.api.ActivityLogSink;
import com.veil.blocklist.api.model.BlockDecision;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends each decision as one JSON object per line.
 *
 * <pre>
 * {"url":"https://www.google-analytics.com/collect","host":"www.google-analytics.com",
 *  "blocked":true,"reason":"PATTERN","timestamp":"2025-01-01T00:00:00Z"}
 * </pre>
 *
 * Write failures are logged and the decision is dropped; the request path is
 * never interrupted by the activity log.
 */
public final class JsonActivityLogSink implements ActivityLogSink, Closeable {
    private static final Logger logger = Logger.getLogger(JsonActivityLogSink.class.getName());

    private final ObjectMapper objectMapper;
    private final Writer writer;

    public JsonActivityLogSink(Writer writer) {
        this.writer = writer;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Opens {@code path} for appending, creating it if needed.
     */
    public static JsonActivityLogSink open(Path path) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return new JsonActivityLogSink(writer);
    }

    @Override
    public synchronized void record(BlockDecision decision) {
        try {
            writer.write(objectMapper.writeValueAsString(decision));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to write activity log entry", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}

package com.veil.blocklist.infra.management;

import com.veil.blocklist.compiler.BlocklistParseResult;
import com.veil.blocklist.compiler.BlocklistParser;
import com.veil.blocklist.privacy.TrackerBlocker;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a {@link TrackerBlocker} in sync with a blocklist file.
 *
 * <p>The file is read once at construction; a missing or unreadable file fails
 * fast. After {@link #start()} its modification time is polled on a daemon
 * thread and the blocker's list is swapped when it changes. A reload that
 * fails leaves the previous list active.
 */
public class BlocklistManager {
    private static final Logger logger = Logger.getLogger(BlocklistManager.class.getName());

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(10);

    private final Path blocklistPath;
    private final TrackerBlocker blocker;
    private final Tracer tracer;
    private final Duration checkInterval;
    private final ScheduledExecutorService monitoringExecutor;

    /**
     * Result of the last successful load.
     */
    private final AtomicReference<BlocklistParseResult> activeBlocklist = new AtomicReference<>();

    private volatile long lastModifiedTime = -1;

    public BlocklistManager(Path blocklistPath, Tracer tracer, TrackerBlocker blocker) throws IOException {
        this(blocklistPath, tracer, blocker, DEFAULT_CHECK_INTERVAL);
    }

    public BlocklistManager(Path blocklistPath, Tracer tracer, TrackerBlocker blocker, Duration checkInterval)
            throws IOException {
        this.blocklistPath = blocklistPath;
        this.tracer = tracer;
        this.blocker = blocker;
        this.checkInterval = checkInterval;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Blocklist-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    public BlocklistParseResult getActiveBlocklist() {
        return activeBlocklist.get();
    }

    public void start() {
        long millis = checkInterval.toMillis();
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Reloads the file now, regardless of its modification time.
     *
     * @throws IOException if the file cannot be read; the previous list stays active
     */
    public void reload() throws IOException {
        reloadInternal();
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-blocklist-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("blocklistFile", blocklistPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(blocklistPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in blocklist file. Attempting to reload...");
                loadBlocklist();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check blocklist file for modifications.", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during blocklist reload check.", e);
        } finally {
            span.end();
        }
    }

    private void loadBlocklist() {
        try {
            reloadInternal();
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load new blocklist. Old blocklist remains active.", e);
        }
    }

    private void reloadInternal() throws IOException {
        Span span = tracer.spanBuilder("load-blocklist").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(blocklistPath).toMillis();
            BlocklistParseResult result;
            try (BufferedReader reader = Files.newBufferedReader(blocklistPath, StandardCharsets.UTF_8)) {
                result = BlocklistParser.parse(reader);
            }
            blocker.replaceBlocklist(result.patterns());
            activeBlocklist.set(result);
            this.lastModifiedTime = modifiedTime;

            span.setAttribute("patternCount", result.patterns().size());
            span.setAttribute("skippedCount", result.skippedLines());
            logger.info(String.format("Loaded blocklist %s: %d patterns, %d skipped",
                    blocklistPath.getFileName(), result.patterns().size(), result.skippedLines()));
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}

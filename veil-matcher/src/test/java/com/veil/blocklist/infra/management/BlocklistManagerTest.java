package com.veil.blocklist.infra.management;

import com.veil.blocklist.api.ActivityLogSink;
import com.veil.blocklist.api.exceptions.MatcherInitializationException;
import com.veil.blocklist.compiler.PatternCompiler;
import com.veil.blocklist.config.MatcherConfig;
import com.veil.blocklist.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.veil.blocklist.matcher.PatternMatcher;
import com.veil.blocklist.privacy.TrackerBlocker;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlocklistManagerTest {

    @Mock
    private TrackerBlocker blocker;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @TempDir
    Path tempDir;

    private Path blocklistPath;

    @BeforeEach
    void setUp() throws IOException {
        blocklistPath = tempDir.resolve("blocklist.txt");
        Files.writeString(blocklistPath, """
                ! Test list
                ||ads.example.com^
                *://*.tracker.net/*
                """);

        // Setup OpenTelemetry mocks
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    private void touchLater() throws IOException {
        FileTime current = Files.getLastModifiedTime(blocklistPath);
        Files.setLastModifiedTime(blocklistPath, FileTime.fromMillis(current.toMillis() + 5_000));
    }

    @Test
    void shouldLoadBlocklistOnInitialization() throws Exception {
        BlocklistManager manager = new BlocklistManager(blocklistPath, tracer, blocker);

        verify(blocker).replaceBlocklist(List.of("||ads.example.com^", "*://*.tracker.net/*"));
        assertThat(manager.getActiveBlocklist().patterns()).hasSize(2);
        assertThat(manager.getActiveBlocklist().commentLines()).isEqualTo(1);
        verify(span).end();
    }

    @Test
    void shouldThrowExceptionIfInitialLoadFails() {
        Path missing = tempDir.resolve("missing.txt");

        assertThatThrownBy(() -> new BlocklistManager(missing, tracer, blocker))
                .isInstanceOf(NoSuchFileException.class);
        verify(span).recordException(any(NoSuchFileException.class));
        verify(blocker, never()).replaceBlocklist(any());
    }

    @Test
    void shouldReloadBlocklistWhenFileChanges() throws Exception {
        BlocklistManager manager = new BlocklistManager(blocklistPath, tracer, blocker);

        Files.writeString(blocklistPath, "||new.example.com^\n");
        touchLater();
        manager.checkForUpdates();

        verify(blocker).replaceBlocklist(List.of("||new.example.com^"));
        assertThat(manager.getActiveBlocklist().patterns()).containsExactly("||new.example.com^");
        verify(blocker, times(2)).replaceBlocklist(any());
    }

    @Test
    void shouldNotReloadUnchangedFile() throws Exception {
        BlocklistManager manager = new BlocklistManager(blocklistPath, tracer, blocker);

        manager.checkForUpdates();

        verify(blocker, times(1)).replaceBlocklist(any());
    }

    @Test
    void shouldKeepOldBlocklistIfReloadFails() throws Exception {
        BlocklistManager manager = new BlocklistManager(blocklistPath, tracer, blocker);
        doThrow(new MatcherInitializationException("Reload failed")).when(blocker).replaceBlocklist(any());

        Files.writeString(blocklistPath, "||new.example.com^\n");
        touchLater();
        manager.checkForUpdates();

        assertThat(manager.getActiveBlocklist().patterns()).containsExactly("||ads.example.com^", "*://*.tracker.net/*");
        verify(blocker, times(2)).replaceBlocklist(any());
    }

    @Test
    void shouldKeepOldBlocklistIfFileDisappears() throws Exception {
        BlocklistManager manager = new BlocklistManager(blocklistPath, tracer, blocker);

        Files.delete(blocklistPath);
        manager.checkForUpdates();

        assertThat(manager.getActiveBlocklist().patterns()).hasSize(2);
        verify(span).recordException(any(NoSuchFileException.class));
    }

    @Test
    void shouldSwapBlockingBehaviourOnScheduledReload() throws Exception {
        Tracer noop = OpenTelemetry.noop().getTracer("test");
        PatternMatcher matcher = new PatternMatcher(MatcherConfig.defaults(), noop,
                new PatternCompiler(noop), new InMemoryMetricsRegistry());
        TrackerBlocker realBlocker = new TrackerBlocker(matcher, ActivityLogSink.DISCARD, Clock.systemUTC(), List.of());

        BlocklistManager manager = new BlocklistManager(blocklistPath, tracer, realBlocker, Duration.ofMillis(50));
        assertThat(realBlocker.shouldBlock("https://ads.example.com/banner.js")).isTrue();
        assertThat(realBlocker.shouldBlock("https://cdn.tracker.net/t.js")).isTrue();

        manager.start();
        try {
            Files.writeString(blocklistPath, "0.0.0.0 other.example.org\n");
            touchLater();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!realBlocker.shouldBlock("https://other.example.org/") && System.nanoTime() < deadline) {
                TimeUnit.MILLISECONDS.sleep(20);
            }
        } finally {
            manager.shutdown();
        }

        assertThat(realBlocker.shouldBlock("https://other.example.org/")).isTrue();
        assertThat(realBlocker.shouldBlock("https://ads.example.com/banner.js")).isFalse();
        assertThat(realBlocker.getBlocklist()).containsExactly("||other.example.org^");
    }
}

package com.veil.blocklist.infra.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TracingServiceTest {

    private static final String KEY = "VEIL_TRACING_TEST_KEY";

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    @DisplayName("getInstance always returns the same usable tracer")
    void singleton() {
        TracingService first = TracingService.getInstance();
        TracingService second = TracingService.getInstance();

        assertThat(first).isSameAs(second);
        assertThat(first.getTracer()).isSameAs(second.getTracer());
        assertThat(first.getOpenTelemetry()).isNotNull();

        assertThatCode(() -> {
            Span span = first.getTracer().spanBuilder("tracing-service-test").startSpan();
            span.setAttribute("enabled", first.isEnabled());
            span.end();
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Settings fall back from environment to system property to default")
    void settingsFallBack() {
        assertThat(TracingService.getEnvOrProperty(KEY, "fallback")).isEqualTo("fallback");

        System.setProperty(KEY, "from-property");

        assertThat(TracingService.getEnvOrProperty(KEY, "fallback")).isEqualTo("from-property");
    }
}

package com.veil.blocklist.infra.metrics.impl.prometheus;

import com.veil.blocklist.infra.metrics.Counter;
import com.veil.blocklist.infra.metrics.Gauge;
import com.veil.blocklist.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    @Test
    @DisplayName("Counters with the same name share one collector")
    void countersShareCollector() {
        Counter first = metrics.counter("matcher_lookups_total");
        Counter second = metrics.counter("matcher_lookups_total");

        first.increment();
        second.increment(2);

        assertThat(first.count()).isEqualTo(3);
        assertThat(collectorRegistry.getSampleValue("matcher_lookups_total")).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Tags become label values")
    void tagsBecomeLabels() {
        metrics.counter("matcher_blocked_total", "reason", "pattern").increment();
        metrics.counter("matcher_blocked_total", "reason", "custom_rule").increment(4);

        assertThat(collectorRegistry.getSampleValue("matcher_blocked_total",
                new String[]{"reason"}, new String[]{"pattern"})).isEqualTo(1.0);
        assertThat(collectorRegistry.getSampleValue("matcher_blocked_total",
                new String[]{"reason"}, new String[]{"custom_rule"})).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Gauges report the last value set")
    void gaugeReportsLastValue() {
        Gauge gauge = metrics.gauge("matcher_patterns");

        gauge.set(12);
        gauge.set(7);

        assertThat(gauge.value()).isEqualTo(7.0);
        assertThat(collectorRegistry.getSampleValue("matcher_patterns")).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Timers observe seconds and leave percentiles to Prometheus")
    void timerObservesSeconds() {
        Timer timer = metrics.timer("matcher_initialize");

        timer.record(Duration.ofMillis(250));

        assertThat(collectorRegistry.getSampleValue("matcher_initialize_seconds_count")).isEqualTo(1.0);
        assertThat(collectorRegistry.getSampleValue("matcher_initialize_seconds_sum")).isEqualTo(0.25);
        assertThat(((PrometheusTimerAdapter) timer).observationCount()).isEqualTo(1.0);
        assertThatThrownBy(() -> timer.percentile(0.99)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Negative values are rejected")
    void rejectsNegativeValues() {
        assertThatThrownBy(() -> metrics.counter("c_total").increment(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> metrics.timer("t").record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Names are sanitized to the Prometheus charset")
    void sanitizesNames() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Matcher.Lookups-Total"))
                .isEqualTo("matcher_lookups_total");
        assertThat(PrometheusMetricsRegistry.sanitizeName("a..b")).isEqualTo("a_b");
    }
}

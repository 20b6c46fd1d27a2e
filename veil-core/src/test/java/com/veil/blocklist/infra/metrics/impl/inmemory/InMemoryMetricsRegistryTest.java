package com.veil.blocklist.infra.metrics.impl.inmemory;

import com.veil.blocklist.infra.metrics.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMetricsRegistryTest {

    private InMemoryMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
    }

    @Test
    @DisplayName("Counter values are readable by name")
    void counterValues() {
        metrics.counter("matcher_lookups_total").increment();
        metrics.counter("matcher_lookups_total").increment(4);

        assertThat(metrics.getCounterValue("matcher_lookups_total")).isEqualTo(5);
        assertThat(metrics.getCounterValue("unknown")).isZero();
    }

    @Test
    @DisplayName("Gauge keeps the last value")
    void gaugeValues() {
        metrics.gauge("matcher_bloom_usage").set(0.25);

        assertThat(metrics.getGaugeValue("matcher_bloom_usage")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Timer percentiles use nearest rank")
    void timerPercentiles() {
        Timer timer = metrics.timer("matcher_initialize");
        for (int i = 1; i <= 100; i++) {
            timer.record(Duration.ofMillis(i));
        }

        assertThat(timer.percentile(0.5)).isEqualTo(Duration.ofMillis(50));
        assertThat(timer.percentile(0.99)).isEqualTo(Duration.ofMillis(99));
        assertThat(timer.percentile(1.0)).isEqualTo(Duration.ofMillis(100));
        assertThat(metrics.getTimerRecordings("matcher_initialize")).hasSize(100);
    }

    @Test
    @DisplayName("record(Callable) returns the result and records even on failure")
    void timerRecordsCallable() throws Exception {
        Timer timer = metrics.timer("op");

        assertThat(timer.<String>record(() -> "done")).isEqualTo("done");
        assertThatThrownBy(() -> timer.record(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(metrics.getTimerRecordings("op")).hasSize(2);
    }

    @Test
    @DisplayName("reset() forgets all metrics")
    void resetForgets() {
        metrics.counter("c").increment();
        metrics.timer("t").record(Duration.ofMillis(1));

        metrics.reset();

        assertThat(metrics.getCounterValue("c")).isZero();
        assertThat(metrics.getTimerRecordings("t")).isEmpty();
        assertThat(metrics.timer("t").percentile(0.5)).isEqualTo(Duration.ZERO);
    }
}

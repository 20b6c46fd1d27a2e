package com.veil.blocklist.infra.metrics.impl.prometheus;

import com.veil.blocklist.infra.metrics.Counter;
import com.veil.blocklist.infra.metrics.Gauge;
import com.veil.blocklist.infra.metrics.MetricsRegistry;
import com.veil.blocklist.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of MetricsRegistry.
 *
 * <p>Tags are {@code key, value} pairs. A metric's label names are fixed by the
 * first call for that name; later calls bind their own label values.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    // Lookup latencies are microseconds; bulk initialization is up to seconds.
    private static final double[] TIMER_BUCKETS = {
            0.00001, 0.0001, 0.001, 0.01, 0.1, 0.5, 1.0, 5.0
    };

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Histogram> histograms = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        io.prometheus.client.Counter counter = counters.computeIfAbsent(name, n ->
                io.prometheus.client.Counter.build()
                        .name(sanitizeName(n))
                        .help("Counter " + n)
                        .labelNames(extractLabelNames(tags))
                        .register(registry));
        return new PrometheusCounterAdapter(counter, extractLabelValues(tags));
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        io.prometheus.client.Gauge gauge = gauges.computeIfAbsent(name, n ->
                io.prometheus.client.Gauge.build()
                        .name(sanitizeName(n))
                        .help("Gauge " + n)
                        .labelNames(extractLabelNames(tags))
                        .register(registry));
        return new PrometheusGaugeAdapter(gauge, extractLabelValues(tags));
    }

    @Override
    public Timer timer(String name, String... tags) {
        io.prometheus.client.Histogram histogram = histograms.computeIfAbsent(name, n ->
                io.prometheus.client.Histogram.build()
                        .name(sanitizeName(n) + "_seconds")
                        .help("Timer " + n)
                        .buckets(TIMER_BUCKETS)
                        .labelNames(extractLabelNames(tags))
                        .register(registry));
        return new PrometheusTimerAdapter(histogram, extractLabelValues(tags));
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}

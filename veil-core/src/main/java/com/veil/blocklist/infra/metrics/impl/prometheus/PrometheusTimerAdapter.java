package com.veil.blocklist.infra.metrics.impl.prometheus;

import com.veil.blocklist.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram observed in seconds.
 *
 * <p>{@link #percentile(double)} is not supported: percentiles are computed
 * server-side with {@code histogram_quantile()}.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException("Percentiles are computed by Prometheus via histogram_quantile()");
    }

    double observationCount() {
        return histogram.get().buckets[histogram.get().buckets.length - 1];
    }
}

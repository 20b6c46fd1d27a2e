package com.veil.blocklist.infra.metrics.impl.prometheus;

import com.veil.blocklist.infra.metrics.MetricsRegistry;
import com.veil.blocklist.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider, registered through
 * {@code META-INF/services} in this module.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}

package com.veil.blocklist.infra.metrics.impl.inmemory;

import com.veil.blocklist.infra.metrics.MetricsRegistry;
import com.veil.blocklist.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for tests.
 *
 * <p>Enabled by listing it in a test-scoped
 * {@code META-INF/services/com.veil.blocklist.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;  // Highest priority in test environment
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}

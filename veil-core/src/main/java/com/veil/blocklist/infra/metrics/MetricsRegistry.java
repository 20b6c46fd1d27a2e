package com.veil.blocklist.infra.metrics;

import com.veil.blocklist.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; see
 * {@link com.veil.blocklist.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter blocked = metrics.counter("matcher_blocked_total");
 * blocked.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer histogram.
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry. Falls back to a no-op registry when no
     * provider is on the classpath.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}

package com.veil.blocklist.matcher;

import com.veil.blocklist.api.model.MatcherStats;
import com.veil.blocklist.infra.metrics.Counter;
import com.veil.blocklist.infra.metrics.Gauge;
import com.veil.blocklist.infra.metrics.MetricsRegistry;
import com.veil.blocklist.infra.metrics.Timer;

import java.time.Duration;

/**
 * Instruments resolved once per matcher so the lookup path never touches the
 * registry maps.
 */
final class MatcherMetrics {

    static final String LOOKUPS = "matcher_lookups_total";
    static final String BLOCKED = "matcher_blocked_total";
    static final String INITIALIZE = "matcher_initialize";
    static final String PATTERNS = "matcher_patterns";
    static final String DOMAINS = "matcher_domains";
    static final String BLOOM_USAGE = "matcher_bloom_filter_usage";

    private final Counter lookups;
    private final Counter blocked;
    private final Timer initialize;
    private final Gauge patterns;
    private final Gauge domains;
    private final Gauge bloomUsage;

    MatcherMetrics(MetricsRegistry registry) {
        this.lookups = registry.counter(LOOKUPS);
        this.blocked = registry.counter(BLOCKED);
        this.initialize = registry.timer(INITIALIZE);
        this.patterns = registry.gauge(PATTERNS);
        this.domains = registry.gauge(DOMAINS);
        this.bloomUsage = registry.gauge(BLOOM_USAGE);
    }

    void recordLookup(boolean matched) {
        lookups.increment();
        if (matched) {
            blocked.increment();
        }
    }

    void recordInitialize(long durationNanos) {
        initialize.record(Duration.ofNanos(durationNanos));
    }

    void updateSize(MatcherStats stats) {
        patterns.set(stats.patterns());
        domains.set(stats.domains());
        bloomUsage.set(stats.bloomFilterUsage());
    }
}

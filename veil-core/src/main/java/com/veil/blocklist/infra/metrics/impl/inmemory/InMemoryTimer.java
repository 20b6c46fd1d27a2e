package com.veil.blocklist.infra.metrics.impl.inmemory;

import com.veil.blocklist.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores every recorded duration so tests can assert on them.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    /**
     * Nearest-rank percentile over all recordings.
     */
    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);
        double p = Math.max(0.0, Math.min(1.0, percentile));
        int rank = (int) Math.ceil(p * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }

    List<Duration> getRecordings() {
        return List.copyOf(recordings);
    }

    @Override
    public String toString() {
        return "InMemoryTimer{name='" + name + "', recordings=" + recordings.size() + "}";
    }
}

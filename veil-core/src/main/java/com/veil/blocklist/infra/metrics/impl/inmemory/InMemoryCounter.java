package com.veil.blocklist.infra.metrics.impl.inmemory;

import com.veil.blocklist.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {
    private final LongAdder value = new LongAdder();
    private final String name;

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        value.increment();
    }

    @Override
    public void increment(long amount) {
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }

    @Override
    public String toString() {
        return "InMemoryCounter{name='" + name + "', value=" + count() + "}";
    }
}

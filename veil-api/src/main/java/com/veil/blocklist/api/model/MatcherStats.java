/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

import java.io.Serializable;

/**
 * Point-in-time size of a matcher.
 *
 * @param patterns         distinct registered patterns
 * @param domains          distinct domains marked terminal in the domain index
 * @param bloomFilterUsage fraction of Bloom filter bits currently set, in {@code [0, 1]}
 */
public record MatcherStats(
        int patterns,
        int domains,
        double bloomFilterUsage
) implements Serializable {

    public static final MatcherStats EMPTY = new MatcherStats(0, 0, 0.0);
}

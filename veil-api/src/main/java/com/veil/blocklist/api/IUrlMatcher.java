/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api;

import com.veil.blocklist.api.exceptions.MatcherInitializationException;
import com.veil.blocklist.api.model.MatcherStats;

import java.util.List;

/**
 * Contract for classifying outgoing request URLs against a compiled blocklist.
 *
 * <h2>Lifecycle</h2>
 * <p>A matcher starts <em>uninitialized</em>. {@link #initialize(List)} moves it
 * to <em>initialized</em>; {@link #clear()} discards every pattern and moves it
 * back. While uninitialized {@link #matches(String)} always answers
 * {@code false}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IUrlMatcher matcher = new PatternMatcher(MatcherConfig.defaults(), tracer);
 * matcher.initialize(List.of("||google-analytics.com^", "*://*.hotjar.com/*"));
 *
 * matcher.matches("https://www.google-analytics.com/analytics.js"); // true
 * matcher.matches("https://github.com/");                            // false
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are <b>not</b> synchronized. Lookups may run concurrently
 * with each other, but every mutation ({@code initialize}, {@code addPattern},
 * {@code removePattern}, {@code clear}) requires exclusive access, which the
 * owner enforces with its own lock.
 *
 * <h2>Error Handling</h2>
 * <p>No operation throws for ordinary input. Malformed or oversized patterns
 * are dropped; malformed URLs do not match. Callers must treat {@code false}
 * for an unparseable URL as fail-open.
 */
public interface IUrlMatcher {

    /**
     * Bulk-compiles {@code patterns} and marks the matcher initialized.
     * Patterns are added to whatever is already registered.
     *
     * @param patterns raw pattern strings; {@code null} entries are ignored
     * @throws MatcherInitializationException if the JVM runs out of resources
     *         while building; the matcher is left uninitialized and empty
     */
    void initialize(List<String> patterns);

    /**
     * @param url absolute request URL
     * @return {@code true} if the URL is blocked by any registered pattern
     */
    boolean matches(String url);

    /**
     * Registers one pattern. Adding a pattern that is already registered
     * leaves the matcher unchanged.
     */
    void addPattern(String pattern);

    /**
     * Unregisters one pattern. Unknown patterns are ignored.
     */
    void removePattern(String pattern);

    /**
     * Discards all patterns and returns to the uninitialized state.
     */
    void clear();

    MatcherStats getStats();

    boolean isInitialized();
}
